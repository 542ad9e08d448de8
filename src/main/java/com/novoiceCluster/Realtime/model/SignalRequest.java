package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Peer-connection negotiation message (offer, answer or ICE candidate). The payload is opaque
 * and forwarded verbatim.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {
    private String channelId;
    private String targetUserId;
    private JsonNode payload;
}
