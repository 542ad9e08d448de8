package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Payload of {@code dm.new}. {@code wasPending} is only present on store-and-forward deliveries.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DirectMessageDelivery {
    DirectMessage message;
    Boolean wasPending;

    public static DirectMessageDelivery live(DirectMessage message) {
        return new DirectMessageDelivery(message, null);
    }

    public static DirectMessageDelivery pending(DirectMessage message) {
        return new DirectMessageDelivery(message, Boolean.TRUE);
    }
}
