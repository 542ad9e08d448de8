package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.OutboundEvent;

/**
 * Transport seam: delivers one event to one connection.
 */
public interface EventPublisher {

    void publish(String userId, String connectionId, OutboundEvent event);
}
