package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.PendingDirectMessage;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for direct messages addressed to offline recipients.
 */
public interface PendingMessageStore {

    /**
     * Insert unless a message with the same id is already stored (safe against client retry).
     *
     * @return true when the message was stored
     */
    boolean insertIfAbsent(PendingDirectMessage message);

    /**
     * Messages for the recipient that have not expired at {@code now}, oldest first.
     */
    List<PendingDirectMessage> listNonExpiredFor(String recipientId, Instant now);

    void deleteFor(String recipientId);

    /**
     * @return number of expired messages removed
     */
    int deleteExpired(Instant now);
}
