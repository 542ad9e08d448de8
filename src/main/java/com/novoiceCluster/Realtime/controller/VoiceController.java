package com.novoiceCluster.Realtime.controller;

import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.SignalRequest;
import com.novoiceCluster.Realtime.model.VoiceRequest;
import com.novoiceCluster.Realtime.services.ConnectionRegistry;
import com.novoiceCluster.Realtime.services.SignalingRelay;
import com.novoiceCluster.Realtime.services.VoiceRoomCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * Voice room membership and WebRTC signaling.
 *
 * Requests the coordinator refuses are dropped; the room never hears about them.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class VoiceController {

    private final ConnectionRegistry connectionRegistry;
    private final VoiceRoomCoordinator voiceRooms;
    private final SignalingRelay signalingRelay;

    @MessageMapping("/voice.join")
    public void join(@Payload VoiceRequest request,
                     @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Connection connection = connectionRegistry.require(sessionId);
        voiceRooms.join(connection, request.getChannelId());
    }

    @MessageMapping("/voice.leave")
    public void leave(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Connection connection = connectionRegistry.require(sessionId);
        voiceRooms.leave(connection.getConnectionId());
    }

    @MessageMapping("/voice.requestState")
    public void requestState(@Payload VoiceRequest request,
                             @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Connection connection = connectionRegistry.require(sessionId);
        voiceRooms.requestState(connection, request.getChannelId());
    }

    @MessageMapping("/voice.signal")
    public void signal(@Payload SignalRequest request,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Connection connection = connectionRegistry.require(sessionId);
        signalingRelay.relay(connection, request);
    }
}
