package com.novoiceCluster.Realtime.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code subscribe} / {@code unsubscribe}; {@code groupId} is {@code server:<id>}
 * or {@code channel:<id>}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRequest {
    private String groupId;
}
