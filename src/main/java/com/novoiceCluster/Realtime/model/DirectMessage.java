package com.novoiceCluster.Realtime.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A relayed direct message together with the sender's display summary at send time.
 */
@Value
@Builder
public class DirectMessage {

    String id;
    String senderId;
    String recipientId;
    String content;
    Instant createdAt;

    String senderUsername;
    String senderDisplayName;
    String senderAvatarColor;
}
