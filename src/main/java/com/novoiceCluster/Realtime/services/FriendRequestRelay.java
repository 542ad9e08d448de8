package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.FriendRequest;
import com.novoiceCluster.Realtime.model.FriendRequestNotice;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.Participant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pushes {@code friend.requestReceived} to the target's open connections after the client has
 * created the request through the main application. Nothing is stored here: an offline target
 * sees the request from the main application on next load.
 *
 * Shares the direct-message rate limit window with {@code dm.send}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FriendRequestRelay {

    private final MembershipDirectory directory;
    private final MessageRateLimiter rateLimiter;
    private final EventBroadcaster broadcaster;

    /**
     * @return number of target connections notified
     */
    public int relay(Connection sender, FriendRequest request) {
        String targetUserId = request.getTargetUserId() == null ? "" : request.getTargetUserId().trim();
        if (targetUserId.isEmpty()) {
            throw RealtimeException.validation("Target user is required");
        }
        if (targetUserId.equals(sender.getUserId())) {
            throw RealtimeException.validation("Cannot send a friend request to yourself");
        }
        if (directory.findUser(targetUserId).isEmpty()) {
            throw RealtimeException.notFound("User not found");
        }
        if (!rateLimiter.tryAcquire(sender.getUserId())) {
            throw RealtimeException.capacity("Rate limit exceeded. Please slow down.");
        }

        Participant summary = directory.findUser(sender.getUserId())
                .orElseGet(() -> Participant.fallback(sender));
        int notified = broadcaster.toGroup(InterestGroup.user(targetUserId),
                EventType.FRIEND_REQUEST_RECEIVED, FriendRequestNotice.from(summary));
        log.info("🤝 Friend request notice {} -> {} ({} connections)", sender.getUserId(), targetUserId, notified);
        return notified;
    }
}
