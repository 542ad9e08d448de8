package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.SignalDelivery;
import com.novoiceCluster.Realtime.model.SignalRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Forwards WebRTC negotiation payloads between two participants of the same voice room.
 *
 * The payload is never inspected. The only contract is: deliver to an authorized target that is
 * currently present, or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalingRelay {

    private final VoiceRoomCoordinator voiceRooms;
    private final EventBroadcaster broadcaster;
    private final KeyedLocks locks;

    /**
     * @return true when the signal was forwarded
     */
    public boolean relay(Connection sender, SignalRequest request) {
        String channelId = request.getChannelId();
        String targetUserId = request.getTargetUserId();

        if (channelId == null || targetUserId == null || request.getPayload() == null
                || request.getPayload().isNull()) {
            log.debug("Dropping malformed signal from {}", sender.getConnectionId());
            return false;
        }
        if (targetUserId.equals(sender.getUserId())) {
            log.debug("Dropping self-addressed signal from {}", sender.getUserId());
            return false;
        }

        return locks.call(KeyedLocks.voiceKey(channelId), () -> {
            if (!voiceRooms.isConnectionIn(sender.getConnectionId(), channelId)) {
                log.warn("🚫 Signal from {} who is not in voice {}", sender.getUserId(), channelId);
                return false;
            }
            if (!voiceRooms.isUserIn(targetUserId, channelId)) {
                log.debug("Dropping signal to {} who is not in voice {}", targetUserId, channelId);
                return false;
            }
            broadcaster.toGroup(InterestGroup.user(targetUserId), EventType.VOICE_SIGNAL,
                    new SignalDelivery(channelId, sender.getUserId(), request.getPayload()));
            return true;
        });
    }
}
