package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Sends an event to exactly one STOMP session.
 *
 * {@code convertAndSendToUser} with a session id header resolves to that session's
 * {@code /user/queue/events} subscription only, not to the user's other devices.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompEventPublisher implements EventPublisher {

    public static final String EVENTS_DESTINATION = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void publish(String userId, String connectionId, OutboundEvent event) {
        messagingTemplate.convertAndSendToUser(userId, EVENTS_DESTINATION, event, sessionHeaders(connectionId));
        log.debug("📤 {} -> {} ({})", event.getType().getWireName(), connectionId, userId);
    }

    private MessageHeaders sessionHeaders(String connectionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(connectionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
