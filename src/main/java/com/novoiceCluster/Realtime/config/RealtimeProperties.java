package com.novoiceCluster.Realtime.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    /**
     * Maximum number of tracks in one room's queue.
     */
    private int queueCapacity = 100;

    /**
     * Upper bound for any playback position (12 hours).
     */
    private double maxPositionSeconds = 12 * 60 * 60;

    /**
     * Past this many seconds, "previous" restarts the current track instead of stepping back.
     */
    private double restartThresholdSeconds = 5;

    /**
     * How long a direct message for an offline recipient is kept.
     */
    private Duration pendingMessageTtl = Duration.ofDays(7);

    private int maxMessageLength = 4000;

    private int messagesPerMinute = 30;

    /**
     * Origins allowed to open the WebSocket endpoint.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
}
