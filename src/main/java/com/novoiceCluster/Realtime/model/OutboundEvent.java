package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Envelope of everything sent on a connection's {@code /user/queue/events}.
 */
@Value
public class OutboundEvent {
    EventType type;
    Object payload;
    long timestamp;
}
