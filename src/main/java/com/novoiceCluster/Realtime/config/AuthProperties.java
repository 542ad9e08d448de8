package com.novoiceCluster.Realtime.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "realtime.auth")
public class AuthProperties {

    /**
     * HS256 secret shared with the service that issues session tokens. At least 32 bytes.
     */
    private String jwtSecret = "novoice-secret-key-change-in-production";

    /**
     * When set, tokens are validated by the central server's {@code /api/auth/me} instead of locally.
     */
    private String centralUrl;

    private Duration centralTimeout = Duration.ofSeconds(5);
}
