package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.config.TurnProperties;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import com.novoiceCluster.Realtime.model.IceConfiguration;
import com.novoiceCluster.Realtime.model.IceServer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * ICE servers handed to clients before they open peer connections.
 *
 * STUN is always offered. TURN is added when enabled and configured, preferably with
 * time-limited credentials derived from a shared secret (the coturn REST API scheme):
 * {@code username = "<expiresAt>:<userId>"}, {@code credential = base64(HMAC-SHA1(secret, username))}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IceServerService {

    static final int MIN_TTL_SECONDS = 300;
    static final int MAX_TTL_SECONDS = 86400;
    private static final String HMAC_ALGORITHM = "HmacSHA1";

    private final TurnProperties properties;
    private final Clock clock;

    public IceConfiguration configurationFor(AuthenticatedUser user) {
        List<IceServer> servers = new ArrayList<>();
        servers.add(IceServer.stun(properties.getStunUrls().isEmpty()
                ? TurnProperties.DEFAULT_STUN_URLS
                : List.copyOf(properties.getStunUrls())));

        List<String> turnUrls = List.copyOf(properties.getUrls());
        if (!properties.isEnabled() || turnUrls.isEmpty()) {
            return IceConfiguration.builder()
                    .turnEnabled(false)
                    .credentialType(IceConfiguration.CREDENTIAL_NONE)
                    .iceServers(servers)
                    .build();
        }

        if (hasText(properties.getStaticAuthSecret())) {
            int ttlSeconds = clampTtl(properties.getCredentialTtlSeconds());
            long expiresAt = clock.instant().getEpochSecond() + ttlSeconds;
            String username = expiresAt + ":" + user.getUserId();
            servers.add(new IceServer(turnUrls, username, sign(properties.getStaticAuthSecret().trim(), username)));

            return IceConfiguration.builder()
                    .turnEnabled(true)
                    .credentialType(IceConfiguration.CREDENTIAL_HMAC)
                    .ttlSeconds(ttlSeconds)
                    .expiresAt(expiresAt)
                    .iceServers(servers)
                    .build();
        }

        if (hasText(properties.getUsername()) && hasText(properties.getPassword())) {
            servers.add(new IceServer(turnUrls, properties.getUsername().trim(), properties.getPassword().trim()));
            return IceConfiguration.builder()
                    .turnEnabled(true)
                    .credentialType(IceConfiguration.CREDENTIAL_STATIC)
                    .iceServers(servers)
                    .build();
        }

        log.warn("⚠️ TURN is enabled but neither a shared secret nor static credentials are configured");
        return IceConfiguration.builder()
                .turnEnabled(false)
                .credentialType(IceConfiguration.CREDENTIAL_MISSING)
                .iceServers(servers)
                .build();
    }

    static int clampTtl(int ttlSeconds) {
        return Math.max(MIN_TTL_SECONDS, Math.min(MAX_TTL_SECONDS, ttlSeconds));
    }

    static String sign(String secret, String username) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(username.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 is not available", e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
