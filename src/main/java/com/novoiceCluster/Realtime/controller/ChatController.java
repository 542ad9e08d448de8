package com.novoiceCluster.Realtime.controller;

import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.DirectMessageRequest;
import com.novoiceCluster.Realtime.model.FriendRequest;
import com.novoiceCluster.Realtime.model.TypingRequest;
import com.novoiceCluster.Realtime.services.ConnectionRegistry;
import com.novoiceCluster.Realtime.services.DirectMessageService;
import com.novoiceCluster.Realtime.services.FriendRequestRelay;
import com.novoiceCluster.Realtime.services.TypingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * Direct messages, typing indicators and friend request notices.
 *
 * Message Flow:
 * 1. Client sends to /app/dm.send
 * 2. Sender is resolved from the attached connection, never from the payload
 * 3. Delivery (live or store-and-forward) is handled by {@link DirectMessageService}
 * 4. Validation and rate-limit failures come back to the sender as an error event
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ConnectionRegistry connectionRegistry;
    private final DirectMessageService directMessageService;
    private final TypingService typingService;
    private final FriendRequestRelay friendRequestRelay;

    @MessageMapping("/dm.send")
    public void sendDirectMessage(@Valid @Payload DirectMessageRequest request,
                                  @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Connection sender = connectionRegistry.require(sessionId);
        log.info("📨 DM from {} to {}", sender.getUserId(), request.getRecipientId());
        directMessageService.send(sender, request);
    }

    @MessageMapping("/typing.start")
    public void typingStart(@Payload TypingRequest request,
                            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        typingService.relay(connectionRegistry.require(sessionId), request, true);
    }

    @MessageMapping("/typing.stop")
    public void typingStop(@Payload TypingRequest request,
                           @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        typingService.relay(connectionRegistry.require(sessionId), request, false);
    }

    @MessageMapping("/friend.request")
    public void friendRequest(@Valid @Payload FriendRequest request,
                              @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        friendRequestRelay.relay(connectionRegistry.require(sessionId), request);
    }
}
