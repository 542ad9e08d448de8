package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.PresenceChange;
import com.novoiceCluster.Realtime.model.PresenceStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Attach / detach lifecycle of authenticated connections.
 *
 * Attach: register the connection, join its personal and server groups, announce the user
 * online on the first connection, flush pending direct messages.
 * Detach: leave any voice room, unregister, announce the user offline on the last connection.
 *
 * Presence transitions for one user are serialized by the user lock, so online/offline is
 * broadcast exactly once per transition regardless of how many devices connect or drop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RealtimeSessionService {

    private final ConnectionRegistry connectionRegistry;
    private final InterestGroupRegistry groupRegistry;
    private final MembershipDirectory directory;
    private final VoiceRoomCoordinator voiceRooms;
    private final DirectMessageService directMessages;
    private final EventBroadcaster broadcaster;
    private final KeyedLocks locks;

    /**
     * @return false when the connection was already attached or its session has closed
     */
    public boolean attach(Connection connection) {
        if (connectionRegistry.find(connection.getConnectionId()).isPresent()
                || connectionRegistry.isClosed(connection.getConnectionId())) {
            return false;
        }
        List<String> serverIds = directory.serverIdsOf(connection.getUserId());

        return locks.call(KeyedLocks.userKey(connection.getUserId()), () -> {
            if (connectionRegistry.find(connection.getConnectionId()).isPresent()) {
                return false;
            }
            boolean firstConnection = connectionRegistry.register(connection);
            // registered before the check: a concurrent detach either sees the entry or left a tombstone
            if (connectionRegistry.isClosed(connection.getConnectionId())) {
                connectionRegistry.unregister(connection);
                log.info("⏭️ Not attaching {}: session already closed", connection.getConnectionId());
                return false;
            }

            groupRegistry.join(connection.getConnectionId(), InterestGroup.user(connection.getUserId()));
            for (String serverId : serverIds) {
                groupRegistry.join(connection.getConnectionId(), InterestGroup.server(serverId));
            }
            log.info("✅ Connection attached: {} (user: {}, servers: {})",
                    connection.getConnectionId(), connection.getUserId(), serverIds.size());

            if (firstConnection) {
                broadcaster.toAll(EventType.PRESENCE_CHANGED,
                        new PresenceChange(connection.getUserId(), PresenceStatus.ONLINE));
                log.info("🟢 {} is online", connection.getUserId());
            }

            try {
                directMessages.deliverPending(connection);
            } catch (DataAccessException e) {
                // messages stay stored and are retried on the next attach
                log.error("❌ Pending DM delivery failed for {}: {}", connection.getUserId(), e.getMessage());
            }
            return true;
        });
    }

    /**
     * Cleanup is unconditional: registry removal and the presence transition run even when
     * leaving the voice room fails.
     *
     * @return false when the connection was not attached
     */
    public boolean detach(String connectionId) {
        connectionRegistry.markClosed(connectionId);
        Optional<Connection> attached = connectionRegistry.find(connectionId);
        if (attached.isEmpty()) {
            return false;
        }
        Connection connection = attached.get();

        try {
            voiceRooms.leave(connectionId);
        } catch (RuntimeException e) {
            log.error("❌ Voice cleanup failed for {}: {}", connectionId, e.getMessage(), e);
        } finally {
            locks.run(KeyedLocks.userKey(connection.getUserId()), () -> {
                groupRegistry.leaveAll(connectionId);
                boolean lastConnection = connectionRegistry.unregister(connection);
                log.info("❌ Connection detached: {} (user: {})", connectionId, connection.getUserId());

                if (lastConnection) {
                    broadcaster.toAll(EventType.PRESENCE_CHANGED,
                            new PresenceChange(connection.getUserId(), PresenceStatus.OFFLINE));
                    log.info("⚪ {} is offline", connection.getUserId());
                }
            });
        }
        return true;
    }
}
