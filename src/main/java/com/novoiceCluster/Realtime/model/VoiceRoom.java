package com.novoiceCluster.Realtime.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Presence in one voice channel: which connections are in it and the per-user roster.
 *
 * The roster holds one entry per user no matter how many of that user's connections are
 * present. Not thread-safe; callers hold the room lock.
 */
public class VoiceRoom {

    private final String channelId;
    private final String serverId;

    // connectionId -> userId
    private final Map<String, String> connections = new LinkedHashMap<>();
    // userId -> summary, in join order
    private final Map<String, Participant> roster = new LinkedHashMap<>();

    public VoiceRoom(String channelId, String serverId) {
        this.channelId = channelId;
        this.serverId = serverId;
    }

    /**
     * @return true when the user was not on the roster before
     */
    public boolean admit(String connectionId, Participant participant) {
        connections.put(connectionId, participant.getUserId());
        return roster.putIfAbsent(participant.getUserId(), participant) == null;
    }

    /**
     * Remove one connection. The user leaves the roster only when none of their connections
     * remain in the room.
     *
     * @return true when the roster changed
     */
    public boolean release(String connectionId) {
        String userId = connections.remove(connectionId);
        if (userId == null) {
            return false;
        }
        if (connections.containsValue(userId)) {
            return false;
        }
        roster.remove(userId);
        return true;
    }

    public boolean hasConnection(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public boolean hasUser(String userId) {
        return roster.containsKey(userId);
    }

    public boolean isEmpty() {
        return roster.isEmpty();
    }

    public List<Participant> getParticipants() {
        return new ArrayList<>(roster.values());
    }

    public int getParticipantCount() {
        return roster.size();
    }

    public String getChannelId() {
        return channelId;
    }

    public String getServerId() {
        return serverId;
    }
}
