package com.novoiceCluster.Realtime.config;

import com.novoiceCluster.Realtime.services.CentralAuthTokenVerifier;
import com.novoiceCluster.Realtime.services.JwtTokenVerifier;
import com.novoiceCluster.Realtime.services.TokenVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Clock;

/**
 * Chooses how session tokens are verified: locally (shared HS256 secret) or by the central
 * server when {@code realtime.auth.central-url} is set.
 */
@Configuration
@Slf4j
public class AuthConfig {

    @Bean
    public TokenVerifier tokenVerifier(AuthProperties properties, Clock clock, RestTemplateBuilder builder) {
        if (StringUtils.hasText(properties.getCentralUrl())) {
            log.info("🔐 Verifying tokens against central server {}", properties.getCentralUrl());
            return new CentralAuthTokenVerifier(
                    builder.setConnectTimeout(properties.getCentralTimeout())
                            .setReadTimeout(properties.getCentralTimeout())
                            .build(),
                    properties.getCentralUrl()
            );
        }
        log.info("🔐 Verifying tokens locally (HS256)");
        return new JwtTokenVerifier(properties.getJwtSecret(), clock);
    }
}
