package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.InterestGroup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Which connections belong to which interest group. Server-initiated events are fanned out to
 * the members of a group, so a connection only receives what it joined.
 */
@Component
public class InterestGroupRegistry {

    private final Map<String, Set<String>> membersByGroup = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> groupsByConnection = new ConcurrentHashMap<>();

    public void join(String connectionId, InterestGroup group) {
        membersByGroup.computeIfAbsent(group.name(), g -> ConcurrentHashMap.newKeySet()).add(connectionId);
        groupsByConnection.computeIfAbsent(connectionId, c -> ConcurrentHashMap.newKeySet()).add(group.name());
    }

    public void leave(String connectionId, InterestGroup group) {
        removeMember(group.name(), connectionId);
        Set<String> groups = groupsByConnection.get(connectionId);
        if (groups != null) {
            groups.remove(group.name());
        }
    }

    public void leaveAll(String connectionId) {
        Set<String> groups = groupsByConnection.remove(connectionId);
        if (groups == null) {
            return;
        }
        for (String group : groups) {
            removeMember(group, connectionId);
        }
    }

    public List<String> members(InterestGroup group) {
        Set<String> members = membersByGroup.get(group.name());
        return members == null ? List.of() : new ArrayList<>(members);
    }

    public boolean isMember(String connectionId, InterestGroup group) {
        Set<String> members = membersByGroup.get(group.name());
        return members != null && members.contains(connectionId);
    }

    private void removeMember(String group, String connectionId) {
        membersByGroup.computeIfPresent(group, (g, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }
}
