package com.novoiceCluster.Realtime.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typing indicator. For a direct conversation set {@code direct} and {@code targetUserId};
 * for a text channel set {@code channelId}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TypingRequest {
    private String channelId;
    private String targetUserId;
    private boolean direct;
}
