package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class SignalDelivery {
    String channelId;
    String fromUserId;
    JsonNode payload;
}
