package com.novoiceCluster.Realtime.controller;

import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.MusicAction;
import com.novoiceCluster.Realtime.model.MusicCommand;
import com.novoiceCluster.Realtime.services.ConnectionRegistry;
import com.novoiceCluster.Realtime.services.MusicSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * Music Sync Controller for synchronized listening in voice rooms.
 *
 * Every action arrives on /app/music.{action}; accepted changes are broadcast by the session
 * service as music.state to the room, rejections come back as music.error to the sender.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class MusicSyncController {

    private final ConnectionRegistry connectionRegistry;
    private final MusicSessionService musicSessionService;

    @MessageMapping("/music.{action}")
    public void handle(@DestinationVariable String action,
                       @Payload MusicCommand command,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        Connection connection = connectionRegistry.require(sessionId);
        MusicAction musicAction = MusicAction.fromWireName(action)
                .orElseThrow(() -> RealtimeException.validation("Unknown music action: " + action));

        log.debug("🎵 music.{} from {} for {}", action, connection.getUserId(), command.getChannelId());
        musicSessionService.dispatch(connection, musicAction, command);
    }
}
