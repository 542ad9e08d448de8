package com.novoiceCluster.Realtime.config;

import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.services.RealtimeSessionService;
import com.novoiceCluster.Realtime.services.StompEventPublisher;
import com.novoiceCluster.Realtime.services.TokenVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.MessageHandler;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.simp.user.UserDestinationMessageHandler;
import org.springframework.messaging.support.ExecutorChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;

import java.security.Principal;
import java.time.Clock;

/**
 * Guards the client inbound channel.
 *
 * CONNECT: the session token ({@code Authorization: Bearer <token>} or {@code token} native
 * header) must verify, otherwise the connection is refused. There is no anonymous access.
 * SUBSCRIBE: only the session's own {@code /user/queue/**} destinations are allowed.
 * Everything after CONNECT requires the authenticated principal.
 *
 * The connection is attached once its events subscription has been registered with the broker,
 * so presence and pending messages emitted on attach reach it.
 */
@Slf4j
public class StompSessionInterceptor implements ExecutorChannelInterceptor {

    static final String USER_QUEUE_PREFIX = "/user/queue/";
    static final String EVENTS_SUBSCRIPTION = "/user" + StompEventPublisher.EVENTS_DESTINATION;

    private final TokenVerifier tokenVerifier;
    private final ObjectProvider<RealtimeSessionService> sessionService;
    private final Clock clock;

    public StompSessionInterceptor(TokenVerifier tokenVerifier,
                                   ObjectProvider<RealtimeSessionService> sessionService,
                                   Clock clock) {
        this.tokenVerifier = tokenVerifier;
        this.sessionService = sessionService;
        this.clock = clock;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getCommand() == null) {
            return message;
        }

        StompCommand command = accessor.getCommand();
        if (StompCommand.CONNECT.equals(command)) {
            authenticate(accessor);
            return message;
        }

        if (StompCommand.SUBSCRIBE.equals(command) || StompCommand.SEND.equals(command)) {
            if (!(accessor.getUser() instanceof AuthenticatedUser)) {
                log.warn("🚫 {} without authentication on session {}", command, accessor.getSessionId());
                throw new MessageDeliveryException("Not authenticated");
            }
        }
        if (StompCommand.SUBSCRIBE.equals(command)) {
            String destination = accessor.getDestination();
            if (destination == null || !destination.startsWith(USER_QUEUE_PREFIX)) {
                log.warn("🚫 Refused subscription to {} on session {}", destination, accessor.getSessionId());
                throw new MessageDeliveryException("Subscription to " + destination + " is not allowed");
            }
        }
        return message;
    }

    @Override
    public void afterMessageHandled(Message<?> message, MessageChannel channel, MessageHandler handler, Exception ex) {
        if (ex != null || !(handler instanceof UserDestinationMessageHandler)) {
            return;
        }
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        if (!StompCommand.SUBSCRIBE.equals(accessor.getCommand())
                || !EVENTS_SUBSCRIPTION.equals(accessor.getDestination())) {
            return;
        }

        Principal principal = accessor.getUser();
        if (principal instanceof AuthenticatedUser) {
            AuthenticatedUser user = (AuthenticatedUser) principal;
            Connection connection = Connection.of(accessor.getSessionId(), user, clock.instant());
            sessionService.getObject().attach(connection);
        }
    }

    private void authenticate(StompHeaderAccessor accessor) {
        String token = extractToken(accessor);
        if (token == null) {
            log.warn("❌ WebSocket authentication failed: no token (session {})", accessor.getSessionId());
            throw new MessageDeliveryException("Authentication required");
        }
        try {
            AuthenticatedUser user = tokenVerifier.verify(token);
            accessor.setUser(user);
            log.info("✅ WebSocket authenticated: {} (session {})", user.getUserId(), accessor.getSessionId());
        } catch (RealtimeException e) {
            log.warn("❌ WebSocket authentication failed: {} (session {})", e.getMessage(), accessor.getSessionId());
            throw new MessageDeliveryException(e.getMessage());
        }
    }

    static String extractToken(StompHeaderAccessor accessor) {
        String authorization = accessor.getFirstNativeHeader("Authorization");
        if (authorization != null && authorization.startsWith("Bearer ")) {
            String token = authorization.substring("Bearer ".length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String token = accessor.getFirstNativeHeader("token");
        return token == null || token.isBlank() ? null : token.trim();
    }
}
