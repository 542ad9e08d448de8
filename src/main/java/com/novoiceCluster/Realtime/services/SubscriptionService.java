package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.ChannelInfo;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.GroupKind;
import com.novoiceCluster.Realtime.model.InterestGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Client-requested joins and leaves of {@code server:} and {@code channel:} groups.
 * Requests that fail validation are ignored; the client is not told.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final InterestGroupRegistry groupRegistry;
    private final MembershipDirectory directory;

    /**
     * @return true when the connection is a member of the group afterwards
     */
    public boolean subscribe(Connection connection, String groupId) {
        Optional<InterestGroup> group = clientManaged(groupId);
        if (group.isEmpty()) {
            log.debug("Ignoring subscribe to {} from {}", groupId, connection.getConnectionId());
            return false;
        }
        if (!mayJoin(connection.getUserId(), group.get())) {
            log.warn("🚫 {} may not subscribe to {}", connection.getUserId(), group.get());
            return false;
        }
        groupRegistry.join(connection.getConnectionId(), group.get());
        log.debug("{} subscribed to {}", connection.getConnectionId(), group.get());
        return true;
    }

    public boolean unsubscribe(Connection connection, String groupId) {
        Optional<InterestGroup> group = clientManaged(groupId);
        if (group.isEmpty()) {
            log.debug("Ignoring unsubscribe from {} by {}", groupId, connection.getConnectionId());
            return false;
        }
        groupRegistry.leave(connection.getConnectionId(), group.get());
        return true;
    }

    private Optional<InterestGroup> clientManaged(String groupId) {
        return InterestGroup.parse(groupId).filter(group -> group.getKind().isClientManaged());
    }

    private boolean mayJoin(String userId, InterestGroup group) {
        if (group.getKind() == GroupKind.SERVER) {
            return directory.isMember(userId, group.getId());
        }
        return directory.findChannel(group.getId())
                .map(ChannelInfo::getServerId)
                .map(serverId -> directory.isMember(userId, serverId))
                .orElse(false);
    }
}
