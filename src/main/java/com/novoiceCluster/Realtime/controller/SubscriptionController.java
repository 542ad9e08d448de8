package com.novoiceCluster.Realtime.controller;

import com.novoiceCluster.Realtime.model.SubscriptionRequest;
import com.novoiceCluster.Realtime.services.ConnectionRegistry;
import com.novoiceCluster.Realtime.services.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

@Controller
@RequiredArgsConstructor
public class SubscriptionController {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionService subscriptionService;

    @MessageMapping("/subscribe")
    public void subscribe(@Payload SubscriptionRequest request,
                          @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        subscriptionService.subscribe(connectionRegistry.require(sessionId), request.getGroupId());
    }

    @MessageMapping("/unsubscribe")
    public void unsubscribe(@Payload SubscriptionRequest request,
                            @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        subscriptionService.unsubscribe(connectionRegistry.require(sessionId), request.getGroupId());
    }
}
