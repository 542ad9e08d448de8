package com.novoiceCluster.Realtime.controller;

import com.novoiceCluster.Realtime.services.RealtimeSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Transport-level disconnects (closed socket, heartbeat timeout, DISCONNECT frame).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionEventListener {

    private final RealtimeSessionService sessionService;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        if (!sessionService.detach(event.getSessionId())) {
            log.debug("Session {} closed before it was attached ({})", event.getSessionId(), event.getCloseStatus());
        }
    }
}
