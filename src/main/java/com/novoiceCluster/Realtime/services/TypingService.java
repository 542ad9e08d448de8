package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.ChannelInfo;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.Participant;
import com.novoiceCluster.Realtime.model.TypingRequest;
import com.novoiceCluster.Realtime.model.TypingUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Relays typing indicators. Nothing is stored; invalid requests are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TypingService {

    private final MembershipDirectory directory;
    private final EventBroadcaster broadcaster;

    /**
     * @return true when the indicator was relayed
     */
    public boolean relay(Connection sender, TypingRequest request, boolean typing) {
        String displayName = directory.findUser(sender.getUserId())
                .map(Participant::getDisplayName)
                .orElse(sender.getUsername());

        if (request.isDirect()) {
            String targetUserId = request.getTargetUserId();
            if (targetUserId == null || targetUserId.isBlank() || targetUserId.equals(sender.getUserId())) {
                log.debug("Dropping typing indicator without target from {}", sender.getConnectionId());
                return false;
            }
            broadcaster.toGroup(InterestGroup.user(targetUserId), EventType.TYPING_UPDATE,
                    new TypingUpdate(sender.getUserId(), displayName, targetUserId, true, typing));
            return true;
        }

        Optional<ChannelInfo> channel = Optional.ofNullable(request.getChannelId())
                .flatMap(directory::findChannel);
        if (channel.isEmpty() || !directory.isMember(sender.getUserId(), channel.get().getServerId())) {
            log.debug("Dropping typing indicator for {} from {}", request.getChannelId(), sender.getUserId());
            return false;
        }
        broadcaster.toGroupExcept(InterestGroup.server(channel.get().getServerId()), sender.getConnectionId(),
                EventType.TYPING_UPDATE,
                new TypingUpdate(sender.getUserId(), displayName, channel.get().getId(), false, typing));
        return true;
    }
}
