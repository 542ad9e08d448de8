package com.novoiceCluster.Realtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RealtimeConfig {

    /**
     * The only time source of the core; playback positions and DM expiry are derived from it.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
