package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.config.RealtimeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Fixed-window rate limiting for direct messages.
 *
 * Redis Key Structure:
 * - msg:rate:{USER_ID} : messages sent in the current one-minute window
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageRateLimiter {

    private static final int RATE_LIMIT_WINDOW_SECONDS = 60;

    private final StringRedisTemplate redisTemplate;
    private final RealtimeProperties properties;

    /**
     * @return true if the user may send another message in the current window
     */
    public boolean tryAcquire(String userId) {
        if (userId == null) {
            return false;
        }

        String rateLimitKey = "msg:rate:" + userId;
        Long count = redisTemplate.opsForValue().increment(rateLimitKey);
        if (count == null) {
            count = 0L;
        }

        // window starts with the first message
        if (count == 1) {
            redisTemplate.expire(rateLimitKey, RATE_LIMIT_WINDOW_SECONDS, TimeUnit.SECONDS);
        }

        if (count > properties.getMessagesPerMinute()) {
            log.warn("🚫 Message rate limit exceeded for user: {} (count: {})", userId, count);
            return false;
        }
        return true;
    }
}
