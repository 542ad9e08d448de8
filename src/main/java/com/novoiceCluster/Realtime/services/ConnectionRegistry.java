package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.Connection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attached connections, indexed by connection id and by user (multi-device).
 *
 * {@link #register} and {@link #unregister} report the user's offline/online transitions so
 * presence is broadcast once per user, not once per device.
 *
 * Closed connection ids are remembered (most recent {@value #CLOSED_HISTORY}) because the
 * transport reports a disconnect outside the ordered inbound channel: a frame already in flight
 * for that session may still try to attach it or put it in a voice room afterwards.
 */
@Component
public class ConnectionRegistry {

    static final int CLOSED_HISTORY = 10_000;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();
    private final Set<String> closed = Collections.synchronizedSet(Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > CLOSED_HISTORY;
                }
            }));

    /**
     * @return true when this is the user's first connection (offline -> online)
     */
    public boolean register(Connection connection) {
        connections.put(connection.getConnectionId(), connection);

        boolean[] first = {false};
        connectionsByUser.compute(connection.getUserId(), (userId, ids) -> {
            if (ids == null) {
                ids = ConcurrentHashMap.newKeySet();
                first[0] = true;
            }
            ids.add(connection.getConnectionId());
            return ids;
        });
        return first[0];
    }

    /**
     * @return true when this was the user's last connection (online -> offline)
     */
    public boolean unregister(Connection connection) {
        connections.remove(connection.getConnectionId());

        boolean[] last = {false};
        connectionsByUser.computeIfPresent(connection.getUserId(), (userId, ids) -> {
            ids.remove(connection.getConnectionId());
            if (ids.isEmpty()) {
                last[0] = true;
                return null;
            }
            return ids;
        });
        return last[0];
    }

    /**
     * Record that the transport session is gone. Must happen before any cleanup, so that an
     * attach or voice join racing the disconnect either sees the tombstone or is seen by the
     * cleanup.
     */
    public void markClosed(String connectionId) {
        if (connectionId != null) {
            closed.add(connectionId);
        }
    }

    public boolean isClosed(String connectionId) {
        return connectionId != null && closed.contains(connectionId);
    }

    public Optional<Connection> find(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * The attached connection behind an inbound frame. Frames sent before the events
     * subscription completes the attach are refused.
     */
    public Connection require(String connectionId) {
        return find(connectionId)
                .orElseThrow(() -> RealtimeException.authentication("Connection is not attached"));
    }

    public boolean isOnline(String userId) {
        return userId != null && connectionsByUser.containsKey(userId);
    }

    public List<String> connectionIdsOf(String userId) {
        Set<String> ids = connectionsByUser.get(userId);
        return ids == null ? List.of() : new ArrayList<>(ids);
    }

    public Collection<Connection> all() {
        return new ArrayList<>(connections.values());
    }

    public int onlineUserCount() {
        return connectionsByUser.size();
    }
}
