package com.novoiceCluster.Realtime.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Store-and-forward record for a recipient who had no connection when the message was sent.
 * Deleted on delivery, or once {@code expiresAt} has passed.
 */
@Value
@Builder
@Jacksonized
public class PendingDirectMessage {

    String id;
    String senderId;
    String recipientId;
    String content;
    Instant createdAt;
    Instant expiresAt;

    String senderUsername;
    String senderDisplayName;
    String senderAvatarColor;

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public static PendingDirectMessage of(DirectMessage message, Instant expiresAt) {
        return PendingDirectMessage.builder()
                .id(message.getId())
                .senderId(message.getSenderId())
                .recipientId(message.getRecipientId())
                .content(message.getContent())
                .createdAt(message.getCreatedAt())
                .expiresAt(expiresAt)
                .senderUsername(message.getSenderUsername())
                .senderDisplayName(message.getSenderDisplayName())
                .senderAvatarColor(message.getSenderAvatarColor())
                .build();
    }

    public DirectMessage toMessage() {
        return DirectMessage.builder()
                .id(id)
                .senderId(senderId)
                .recipientId(recipientId)
                .content(content)
                .createdAt(createdAt)
                .senderUsername(senderUsername)
                .senderDisplayName(senderDisplayName)
                .senderAvatarColor(senderAvatarColor)
                .build();
    }
}
