package com.novoiceCluster.Realtime.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "realtime.turn")
public class TurnProperties {

    public static final List<String> DEFAULT_STUN_URLS = List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302"
    );

    private boolean enabled = false;

    private List<String> stunUrls = new ArrayList<>();

    private List<String> urls = new ArrayList<>();

    /**
     * Secret for time-limited HMAC credentials (coturn {@code static-auth-secret}).
     */
    private String staticAuthSecret;

    private String username;

    private String password;

    private int credentialTtlSeconds = 3600;
}
