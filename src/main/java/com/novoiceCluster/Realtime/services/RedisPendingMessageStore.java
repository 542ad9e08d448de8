package com.novoiceCluster.Realtime.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoiceCluster.Realtime.model.PendingDirectMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Pending direct messages in Redis.
 *
 * Redis Key Structure:
 * - dm:pending:{RECIPIENT}    : Hash of message id -> message JSON (expires with its newest message)
 * - dm:pending:expiry         : Sorted set of {RECIPIENT}:{MESSAGE_ID} scored by expiresAt (epoch ms)
 *
 * Cleanup reads only the due slice of the expiry index, at most {@value #EXPIRY_BATCH} entries
 * per pass, so its cost does not depend on how many conversations are parked.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class RedisPendingMessageStore implements PendingMessageStore {

    static final String EXPIRY_KEY = "dm:pending:expiry";
    static final int EXPIRY_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public boolean insertIfAbsent(PendingDirectMessage message) {
        String key = keyFor(message.getRecipientId());
        String json = write(message);

        HashOperations<String, String, String> hash = redisTemplate.opsForHash();
        Boolean inserted = hash.putIfAbsent(key, message.getId(), json);
        if (!Boolean.TRUE.equals(inserted)) {
            log.debug("Pending message {} already stored", message.getId());
            return false;
        }
        redisTemplate.expireAt(key, message.getExpiresAt());
        redisTemplate.opsForZSet().add(EXPIRY_KEY,
                indexEntry(message.getRecipientId(), message.getId()),
                message.getExpiresAt().toEpochMilli());
        return true;
    }

    @Override
    public List<PendingDirectMessage> listNonExpiredFor(String recipientId, Instant now) {
        HashOperations<String, String, String> hash = redisTemplate.opsForHash();
        List<String> values = hash.values(keyFor(recipientId));

        List<PendingDirectMessage> messages = new ArrayList<>();
        for (String json : values) {
            PendingDirectMessage message = read(json);
            if (message != null && !message.isExpiredAt(now)) {
                messages.add(message);
            }
        }
        messages.sort(Comparator.comparing(PendingDirectMessage::getCreatedAt));
        return messages;
    }

    @Override
    public void deleteFor(String recipientId) {
        String key = keyFor(recipientId);
        HashOperations<String, String, String> hash = redisTemplate.opsForHash();
        Set<String> messageIds = hash.keys(key);

        redisTemplate.delete(key);
        if (messageIds != null && !messageIds.isEmpty()) {
            Object[] entries = messageIds.stream()
                    .map(messageId -> indexEntry(recipientId, messageId))
                    .toArray();
            redisTemplate.opsForZSet().remove(EXPIRY_KEY, entries);
        }
    }

    @Override
    public int deleteExpired(Instant now) {
        Set<String> due = redisTemplate.opsForZSet()
                .rangeByScore(EXPIRY_KEY, 0, now.toEpochMilli(), 0, EXPIRY_BATCH);
        if (due == null || due.isEmpty()) {
            return 0;
        }

        HashOperations<String, String, String> hash = redisTemplate.opsForHash();
        int removed = 0;
        for (String entry : due) {
            int separator = entry.lastIndexOf(':');
            if (separator <= 0) {
                continue;
            }
            Long deleted = hash.delete(keyFor(entry.substring(0, separator)), entry.substring(separator + 1));
            if (deleted != null) {
                removed += deleted.intValue();
            }
        }
        redisTemplate.opsForZSet().remove(EXPIRY_KEY, due.toArray());

        if (removed > 0) {
            log.info("🧹 Removed {} expired pending messages", removed);
        }
        return removed;
    }

    private static String keyFor(String recipientId) {
        return "dm:pending:" + recipientId;
    }

    // message ids are UUIDs, so the last ':' separates them from the recipient
    static String indexEntry(String recipientId, String messageId) {
        return recipientId + ":" + messageId;
    }

    private String write(PendingDirectMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pending message " + message.getId(), e);
        }
    }

    /**
     * Unreadable entries are skipped; they go away with the recipient's hash.
     */
    private PendingDirectMessage read(String json) {
        try {
            return objectMapper.readValue(json, PendingDirectMessage.class);
        } catch (JsonProcessingException e) {
            log.error("❌ Unreadable pending message: {}", e.getMessage());
            return null;
        }
    }
}
