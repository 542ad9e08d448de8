package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.ChannelInfo;
import com.novoiceCluster.Realtime.model.ChannelOccupancy;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.Participant;
import com.novoiceCluster.Realtime.model.RosterUpdate;
import com.novoiceCluster.Realtime.model.VoiceRoom;
import com.novoiceCluster.Realtime.model.VoiceRoomClosedEvent;
import com.novoiceCluster.Realtime.model.VoiceRoomJoinedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Voice room membership.
 *
 * A connection occupies at most one room. Rooms are created on first join and destroyed when
 * their roster empties, together with their playback session ({@link VoiceRoomClosedEvent}).
 * Unauthorized or malformed requests are dropped without telling the room.
 *
 * Each roster change is broadcast as {@code voice.roster} to the room's group and as
 * {@code voice.channelUpdate} (count only) to the owning server's group.
 */
@Service
@Slf4j
public class VoiceRoomCoordinator {

    private final MembershipDirectory directory;
    private final ConnectionRegistry connectionRegistry;
    private final InterestGroupRegistry groupRegistry;
    private final EventBroadcaster broadcaster;
    private final KeyedLocks locks;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, VoiceRoom> rooms = new ConcurrentHashMap<>();
    // connectionId -> channelId
    private final Map<String, String> connectionRooms = new ConcurrentHashMap<>();

    public VoiceRoomCoordinator(MembershipDirectory directory,
                                ConnectionRegistry connectionRegistry,
                                InterestGroupRegistry groupRegistry,
                                EventBroadcaster broadcaster,
                                KeyedLocks locks,
                                ApplicationEventPublisher eventPublisher) {
        this.directory = directory;
        this.connectionRegistry = connectionRegistry;
        this.groupRegistry = groupRegistry;
        this.broadcaster = broadcaster;
        this.locks = locks;
        this.eventPublisher = eventPublisher;
    }

    // ============ JOIN / LEAVE ============

    /**
     * @return true when the connection is in the room afterwards
     */
    public boolean join(Connection connection, String channelId) {
        Optional<ChannelInfo> channel = authorizedVoiceChannel(connection, channelId);
        if (channel.isEmpty()) {
            return false;
        }
        String serverId = channel.get().getServerId();
        Participant participant = directory.findUser(connection.getUserId())
                .orElseGet(() -> Participant.fallback(connection));

        String current = connectionRooms.get(connection.getConnectionId());
        if (channelId.equals(current)) {
            // re-join: re-emit, no side effects
            locks.run(KeyedLocks.voiceKey(channelId), () -> {
                VoiceRoom room = rooms.get(channelId);
                if (room != null) {
                    broadcastRoster(room);
                }
            });
            return true;
        }
        if (current != null) {
            leave(connection.getConnectionId());
        }

        return locks.call(KeyedLocks.voiceKey(channelId), () -> {
            // claim the seat before the tombstone check: a detach racing this join either
            // finds the claim and leaves the room, or has closed the session and we back out
            connectionRooms.put(connection.getConnectionId(), channelId);
            if (connectionRegistry.isClosed(connection.getConnectionId())) {
                connectionRooms.remove(connection.getConnectionId(), channelId);
                log.debug("Dropping voice join from closed session {}", connection.getConnectionId());
                return false;
            }

            VoiceRoom room = rooms.computeIfAbsent(channelId, id -> {
                log.info("🔊 Voice room opened: {}", id);
                return new VoiceRoom(id, serverId);
            });
            room.admit(connection.getConnectionId(), participant);
            groupRegistry.join(connection.getConnectionId(), InterestGroup.voice(channelId));

            log.info("🎧 {} ({}) joined voice {}", connection.getUserId(), connection.getConnectionId(), channelId);
            broadcastRoster(room);
            eventPublisher.publishEvent(new VoiceRoomJoinedEvent(connection, channelId));
            return true;
        });
    }

    /**
     * Remove the connection from whatever room it occupies. Safe to call for connections
     * that are in no room.
     *
     * @return true when the connection was in a room
     */
    public boolean leave(String connectionId) {
        String channelId = connectionRooms.remove(connectionId);
        if (channelId == null) {
            return false;
        }

        locks.run(KeyedLocks.voiceKey(channelId), () -> {
            groupRegistry.leave(connectionId, InterestGroup.voice(channelId));

            VoiceRoom room = rooms.get(channelId);
            if (room == null || !room.hasConnection(connectionId)) {
                return;
            }
            room.release(connectionId);
            log.info("👋 {} left voice {}", connectionId, channelId);

            broadcastRoster(room);
            if (room.isEmpty()) {
                rooms.remove(channelId);
                eventPublisher.publishEvent(new VoiceRoomClosedEvent(channelId));
                log.info("🔇 Voice room closed: {}", channelId);
            }
        });
        return true;
    }

    /**
     * Send the current roster to the requester only.
     */
    public boolean requestState(Connection connection, String channelId) {
        if (authorizedVoiceChannel(connection, channelId).isEmpty()) {
            return false;
        }
        List<Participant> participants = locks.call(KeyedLocks.voiceKey(channelId), () -> participantsOf(channelId));
        broadcaster.toConnection(connection, EventType.VOICE_ROSTER, new RosterUpdate(channelId, participants));
        return true;
    }

    // ============ QUERIES ============
    // Callers that act on the answer should hold the room lock.

    public Optional<String> roomOf(String connectionId) {
        return Optional.ofNullable(connectionRooms.get(connectionId));
    }

    public boolean isConnectionIn(String connectionId, String channelId) {
        return channelId != null && channelId.equals(connectionRooms.get(connectionId));
    }

    public boolean isUserIn(String userId, String channelId) {
        VoiceRoom room = rooms.get(channelId);
        return room != null && room.hasUser(userId);
    }

    public boolean hasRoom(String channelId) {
        return channelId != null && rooms.containsKey(channelId);
    }

    public List<Participant> participantsOf(String channelId) {
        VoiceRoom room = rooms.get(channelId);
        return room == null ? List.of() : room.getParticipants();
    }

    public int activeRoomCount() {
        return rooms.size();
    }

    // ============ HELPERS ============

    private Optional<ChannelInfo> authorizedVoiceChannel(Connection connection, String channelId) {
        if (channelId == null || channelId.isBlank()) {
            return Optional.empty();
        }
        Optional<ChannelInfo> channel = directory.findChannel(channelId).filter(ChannelInfo::isVoice);
        if (channel.isEmpty()) {
            log.debug("Dropping voice request for unknown or non-voice channel {}", channelId);
            return Optional.empty();
        }
        if (!directory.isMember(connection.getUserId(), channel.get().getServerId())) {
            log.warn("🚫 {} is not a member of server {}", connection.getUserId(), channel.get().getServerId());
            return Optional.empty();
        }
        return channel;
    }

    private void broadcastRoster(VoiceRoom room) {
        List<Participant> participants = room.getParticipants();
        broadcaster.toGroup(InterestGroup.voice(room.getChannelId()), EventType.VOICE_ROSTER,
                new RosterUpdate(room.getChannelId(), participants));
        broadcaster.toGroup(InterestGroup.server(room.getServerId()), EventType.VOICE_CHANNEL_UPDATE,
                new ChannelOccupancy(room.getChannelId(), room.getParticipantCount()));
    }
}
