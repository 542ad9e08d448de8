package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.FailureKind;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * Local HS256 verification of session tokens issued by the account service.
 * Claims: {@code id} (falls back to {@code sub}) and {@code username}.
 */
@Slf4j
public class JwtTokenVerifier implements TokenVerifier {

    private final JwtParser parser;

    public JwtTokenVerifier(String secret, Clock clock) {
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public AuthenticatedUser verify(String token) {
        if (token == null || token.isBlank()) {
            throw RealtimeException.authentication("Authentication required");
        }
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            String userId = claims.get("id") != null ? String.valueOf(claims.get("id")) : claims.getSubject();
            if (userId == null || userId.isBlank()) {
                throw RealtimeException.authentication("Token carries no user id");
            }
            String username = claims.get("username", String.class);
            return new AuthenticatedUser(userId, username != null ? username : userId);
        } catch (ExpiredJwtException e) {
            log.debug("Expired token for subject {}", e.getClaims().getSubject());
            throw new RealtimeException(FailureKind.AUTHENTICATION, "Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new RealtimeException(FailureKind.AUTHENTICATION, "Invalid token", e);
        }
    }
}
