package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * Fan-out of events to connections, interest groups, or everyone attached.
 *
 * A delivery failure to one connection is logged and does not stop delivery to the rest.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventBroadcaster {

    private final ConnectionRegistry connectionRegistry;
    private final InterestGroupRegistry groupRegistry;
    private final EventPublisher publisher;
    private final Clock clock;

    public void toConnection(String connectionId, EventType type, Object payload) {
        connectionRegistry.find(connectionId)
                .ifPresentOrElse(
                        connection -> deliver(connection, envelope(type, payload)),
                        () -> log.debug("Dropping {} for detached connection {}", type.getWireName(), connectionId)
                );
    }

    public void toConnection(Connection connection, EventType type, Object payload) {
        deliver(connection, envelope(type, payload));
    }

    /**
     * @return number of connections the event was handed to
     */
    public int toGroup(InterestGroup group, EventType type, Object payload) {
        return toGroupExcept(group, null, type, payload);
    }

    public int toGroupExcept(InterestGroup group, String excludedConnectionId, EventType type, Object payload) {
        List<String> members = groupRegistry.members(group);
        OutboundEvent event = envelope(type, payload);
        int delivered = 0;
        for (String connectionId : members) {
            if (connectionId.equals(excludedConnectionId)) {
                continue;
            }
            Connection connection = connectionRegistry.find(connectionId).orElse(null);
            if (connection != null && deliver(connection, event)) {
                delivered++;
            }
        }
        log.debug("📡 {} -> {} ({} connections)", type.getWireName(), group, delivered);
        return delivered;
    }

    public void toAll(EventType type, Object payload) {
        Collection<Connection> everyone = connectionRegistry.all();
        OutboundEvent event = envelope(type, payload);
        for (Connection connection : everyone) {
            deliver(connection, event);
        }
        log.debug("📡 {} -> all ({} connections)", type.getWireName(), everyone.size());
    }

    private OutboundEvent envelope(EventType type, Object payload) {
        return new OutboundEvent(type, payload, clock.millis());
    }

    private boolean deliver(Connection connection, OutboundEvent event) {
        try {
            publisher.publish(connection.getUserId(), connection.getConnectionId(), event);
            return true;
        } catch (MessagingException e) {
            log.error("❌ Failed to deliver {} to {}: {}",
                    event.getType().getWireName(), connection.getConnectionId(), e.getMessage());
            return false;
        }
    }
}
