package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.ChannelInfo;
import com.novoiceCluster.Realtime.model.Participant;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of servers, channels and users, owned by the surrounding application.
 * These lookups are the only blocking calls of the core and are made before any room lock is taken.
 */
public interface MembershipDirectory {

    boolean isMember(String userId, String serverId);

    boolean isOwner(String userId, String serverId);

    Optional<ChannelInfo> findChannel(String channelId);

    List<String> serverIdsOf(String userId);

    Optional<Participant> findUser(String userId);
}
