package com.novoiceCluster.Realtime.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.novoiceCluster.Realtime.Exception.FailureKind;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Federated verification: self-hosted servers accept central accounts by asking the central
 * server who the token belongs to, without sharing its signing secret.
 */
@Slf4j
public class CentralAuthTokenVerifier implements TokenVerifier {

    private final RestTemplate restTemplate;
    private final String meUrl;

    public CentralAuthTokenVerifier(RestTemplate restTemplate, String centralUrl) {
        this.restTemplate = restTemplate;
        this.meUrl = stripTrailingSlash(centralUrl) + "/api/auth/me";
    }

    @Override
    public AuthenticatedUser verify(String token) {
        if (token == null || token.isBlank()) {
            throw RealtimeException.authentication("Authentication required");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);

        JsonNode body;
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    meUrl,
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    JsonNode.class
            );
            body = response.getBody();
        } catch (RestClientException e) {
            log.warn("🚫 Central auth rejected token: {}", e.getMessage());
            throw new RealtimeException(FailureKind.AUTHENTICATION, "Central auth rejected token", e);
        }

        return toUser(body);
    }

    /**
     * The central server answers either {@code {"user": {...}}} or the user object itself.
     */
    static AuthenticatedUser toUser(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw RealtimeException.authentication("Central auth returned no user");
        }
        JsonNode user = body.path("user").isObject() ? body.get("user") : body;
        JsonNode id = user.get("id");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            throw RealtimeException.authentication("Central auth returned no user id");
        }
        JsonNode username = user.get("username");
        String userId = id.asText();
        return new AuthenticatedUser(userId,
                username != null && !username.isNull() ? username.asText() : userId);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
