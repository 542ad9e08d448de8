package com.novoiceCluster.Realtime.Exception;

import com.novoiceCluster.Realtime.model.ErrorNotice;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.services.EventBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ControllerAdvice;

/**
 * Exceptions escaping @MessageMapping handlers. The requester gets an {@code error} event on its
 * own stream; nothing is broadcast.
 */
@ControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class StompExceptionHandler {

    private final EventBroadcaster broadcaster;

    @MessageExceptionHandler(RealtimeException.class)
    public void handleRealtime(RealtimeException ex,
                               @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        if (ex.getKind() == FailureKind.AUTHORIZATION || ex.getKind() == FailureKind.CAPACITY) {
            log.warn("🚫 Request refused for {}: {}", sessionId, ex.getMessage());
        } else {
            log.debug("Request refused for {}: {}", sessionId, ex.getMessage());
        }
        reply(sessionId, ex.getKind(), ex.getMessage());
    }

    @MessageExceptionHandler(MethodArgumentNotValidException.class)
    public void handleInvalid(MethodArgumentNotValidException ex,
                              @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        String message = "Invalid request";
        if (ex.getBindingResult() != null && ex.getBindingResult().getFieldError() != null) {
            FieldError fieldError = ex.getBindingResult().getFieldError();
            message = fieldError.getDefaultMessage();
        }
        log.debug("❌ Invalid payload from {}: {}", sessionId, message);
        reply(sessionId, FailureKind.VALIDATION, message);
    }

    @MessageExceptionHandler(MessageConversionException.class)
    public void handleUnreadable(MessageConversionException ex,
                                 @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        log.debug("❌ Unreadable payload from {}: {}", sessionId, ex.getMessage());
        reply(sessionId, FailureKind.VALIDATION, "Malformed payload");
    }

    @MessageExceptionHandler(Exception.class)
    public void handleUnexpected(Exception ex,
                                 @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        log.error("💥 Unexpected error handling frame from {}: {}", sessionId, ex.getMessage(), ex);
        reply(sessionId, null, "An unexpected error occurred. Please try again later.");
    }

    private void reply(String sessionId, FailureKind kind, String message) {
        broadcaster.toConnection(sessionId, EventType.ERROR, new ErrorNotice(null, kind, message));
    }
}
