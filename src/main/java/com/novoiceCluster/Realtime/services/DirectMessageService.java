package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.config.RealtimeProperties;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.DirectMessage;
import com.novoiceCluster.Realtime.model.DirectMessageDelivery;
import com.novoiceCluster.Realtime.model.DirectMessageRequest;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.Participant;
import com.novoiceCluster.Realtime.model.PendingDirectMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Direct message relay with store-and-forward for offline recipients.
 *
 * Message Flow:
 * 1. Sender posts to /app/dm.send
 * 2. Content is trimmed and checked, sender is rate limited
 * 3. Recipient online: dm.new goes to every recipient connection, nothing is persisted
 * 4. Recipient offline: a pending record is stored until the recipient's next attach
 * 5. The message is echoed to the sender's own connections (multi-device sync)
 *
 * The online check and the store write run under the recipient's user lock, the same lock the
 * attach path holds while it flushes pending messages, so a message is never parked for a user
 * who has just come online.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DirectMessageService {

    private final ConnectionRegistry connectionRegistry;
    private final PendingMessageStore pendingStore;
    private final MessageRateLimiter rateLimiter;
    private final MembershipDirectory directory;
    private final EventBroadcaster broadcaster;
    private final KeyedLocks locks;
    private final RealtimeProperties properties;
    private final Clock clock;

    // ============ SEND ============

    public DirectMessage send(Connection sender, DirectMessageRequest request) {
        String recipientId = request.getRecipientId() == null ? "" : request.getRecipientId().trim();
        String content = request.getContent() == null ? "" : request.getContent().trim();

        if (recipientId.isEmpty()) {
            throw RealtimeException.validation("Recipient is required");
        }
        if (recipientId.equals(sender.getUserId())) {
            throw RealtimeException.validation("Cannot send a message to yourself");
        }
        if (content.isEmpty()) {
            throw RealtimeException.validation("Message cannot be empty");
        }
        if (content.length() > properties.getMaxMessageLength()) {
            throw RealtimeException.validation(
                    "Message exceeds " + properties.getMaxMessageLength() + " characters");
        }
        if (!rateLimiter.tryAcquire(sender.getUserId())) {
            throw RealtimeException.capacity("Rate limit exceeded. Please slow down.");
        }

        Participant summary = directory.findUser(sender.getUserId())
                .orElseGet(() -> Participant.fallback(sender));
        DirectMessage message = DirectMessage.builder()
                .id(UUID.randomUUID().toString())
                .senderId(sender.getUserId())
                .recipientId(recipientId)
                .content(content)
                .createdAt(clock.instant())
                .senderUsername(summary.getUsername())
                .senderDisplayName(summary.getDisplayName())
                .senderAvatarColor(summary.getAvatarColor())
                .build();

        locks.run(KeyedLocks.userKey(recipientId), () -> {
            if (connectionRegistry.isOnline(recipientId)) {
                int delivered = broadcaster.toGroup(InterestGroup.user(recipientId), EventType.DM_NEW,
                        DirectMessageDelivery.live(message));
                log.info("✅ DM {} delivered to {} ({} connections)", message.getId(), recipientId, delivered);
            } else {
                Instant expiresAt = message.getCreatedAt().plus(properties.getPendingMessageTtl());
                boolean stored = pendingStore.insertIfAbsent(PendingDirectMessage.of(message, expiresAt));
                log.info("📦 DM {} for offline user {} {}", message.getId(), recipientId,
                        stored ? "stored until " + expiresAt : "already stored");
            }
        });

        broadcaster.toGroup(InterestGroup.user(sender.getUserId()), EventType.DM_NEW,
                DirectMessageDelivery.live(message));
        return message;
    }

    // ============ STORE-AND-FORWARD ============

    /**
     * Flush everything parked for the connection's user to that connection, then clear the
     * user's pending records. Callers hold the user's lock.
     *
     * @return number of messages delivered
     */
    public int deliverPending(Connection connection) {
        Instant now = clock.instant();
        List<PendingDirectMessage> pending = pendingStore.listNonExpiredFor(connection.getUserId(), now);

        for (PendingDirectMessage message : pending) {
            broadcaster.toConnection(connection, EventType.DM_NEW, DirectMessageDelivery.pending(message.toMessage()));
        }
        if (!pending.isEmpty()) {
            pendingStore.deleteFor(connection.getUserId());
            log.info("📬 Delivered {} pending DMs to {}", pending.size(), connection.getUserId());
        }

        int expired = pendingStore.deleteExpired(now);
        if (expired > 0) {
            log.info("🧹 Removed {} expired pending DMs", expired);
        }
        return pending.size();
    }
}
