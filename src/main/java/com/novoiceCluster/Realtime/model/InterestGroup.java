package com.novoiceCluster.Realtime.model;

import lombok.Value;

import java.util.Optional;

/**
 * Named multicast destination, written as {@code <kind>:<id>} (e.g. {@code server:42}).
 */
@Value
public class InterestGroup {

    GroupKind kind;
    String id;

    public static InterestGroup user(String userId) {
        return new InterestGroup(GroupKind.USER, userId);
    }

    public static InterestGroup server(String serverId) {
        return new InterestGroup(GroupKind.SERVER, serverId);
    }

    public static InterestGroup channel(String channelId) {
        return new InterestGroup(GroupKind.CHANNEL, channelId);
    }

    public static InterestGroup voice(String channelId) {
        return new InterestGroup(GroupKind.VOICE, channelId);
    }

    /**
     * Parse a group id as sent by clients. Unknown kinds and blank ids yield empty.
     */
    public static Optional<InterestGroup> parse(String groupId) {
        if (groupId == null) {
            return Optional.empty();
        }
        int separator = groupId.indexOf(':');
        if (separator <= 0 || separator == groupId.length() - 1) {
            return Optional.empty();
        }
        GroupKind kind = GroupKind.fromPrefix(groupId.substring(0, separator));
        String id = groupId.substring(separator + 1).trim();
        if (kind == null || id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new InterestGroup(kind, id));
    }

    public String name() {
        return kind.getPrefix() + ":" + id;
    }

    @Override
    public String toString() {
        return name();
    }
}
