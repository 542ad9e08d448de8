package com.novoiceCluster.Realtime.controller;

import com.novoiceCluster.Realtime.services.ConnectionRegistry;
import com.novoiceCluster.Realtime.services.VoiceRoomCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Public status endpoints for monitoring and load balancers.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final String SERVICE_NAME = "Novoice Realtime";

    private final RedisConnectionFactory redisConnectionFactory;
    private final ConnectionRegistry connectionRegistry;
    private final VoiceRoomCoordinator voiceRooms;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = baseResponse();
        response.put("status", "UP");
        return ResponseEntity.ok(response);
    }

    /**
     * Adds Redis reachability. The service keeps running without Redis, degraded: no
     * membership lookups, no offline messages.
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> response = baseResponse();
        boolean redisHealthy = checkRedisHealth();
        response.put("redis", redisHealthy ? "UP" : "DOWN");
        response.put("status", redisHealthy ? "UP" : "DEGRADED");
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> baseResponse() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", SERVICE_NAME);
        response.put("timestamp", clock.millis());
        response.put("onlineUsers", connectionRegistry.onlineUserCount());
        response.put("activeVoiceRooms", voiceRooms.activeRoomCount());
        return response;
    }

    private boolean checkRedisHealth() {
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            connection.ping();
            return true;
        } catch (DataAccessException e) {
            log.warn("🔴 Redis health check failed: {}", e.getMessage());
            return false;
        }
    }
}
