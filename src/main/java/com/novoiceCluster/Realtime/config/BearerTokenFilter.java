package com.novoiceCluster.Realtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import com.novoiceCluster.Realtime.services.TokenVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authenticates REST calls with the same session token the WebSocket handshake uses.
 *
 * - No token: the request proceeds unauthenticated (public endpoints accept it, Spring Security
 *   rejects the rest)
 * - Invalid token: 401 with a JSON body, the chain is not continued
 * - Valid token: the {@link AuthenticatedUser} becomes the request principal
 */
@Slf4j
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final List<String> PUBLIC_PREFIXES = List.of("/ws", "/api/health", "/error");

    private final TokenVerifier tokenVerifier;
    private final ObjectMapper objectMapper;

    public BearerTokenFilter(TokenVerifier tokenVerifier, ObjectMapper objectMapper) {
        this.tokenVerifier = tokenVerifier;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestUri = request.getRequestURI();

        if (isPublicEndpoint(requestUri)) {
            filterChain.doFilter(request, response);
            return;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith("Bearer ")) {
            log.debug("⚠️ No bearer token for: {}", requestUri);
            filterChain.doFilter(request, response);
            return;
        }

        try {
            AuthenticatedUser user = tokenVerifier.verify(header.substring("Bearer ".length()).trim());
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(user, null, Collections.emptyList());
            SecurityContextHolder.getContext().setAuthentication(authentication);
            log.debug("✅ Authenticated {} for {}", user.getUserId(), requestUri);
        } catch (RealtimeException e) {
            log.warn("❌ Authentication failed for {}: {}", requestUri, e.getMessage());
            writeUnauthorized(response, requestUri, e.getMessage());
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void writeUnauthorized(HttpServletResponse response, String path, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", HttpServletResponse.SC_UNAUTHORIZED);
        body.put("error", "Unauthorized");
        body.put("message", message);
        body.put("path", path);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private boolean isPublicEndpoint(String requestUri) {
        for (String prefix : PUBLIC_PREFIXES) {
            if (requestUri.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
