package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.config.RealtimeProperties;
import com.novoiceCluster.Realtime.model.ChannelInfo;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.ErrorNotice;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.model.MusicAction;
import com.novoiceCluster.Realtime.model.MusicCommand;
import com.novoiceCluster.Realtime.model.MusicCommandResult;
import com.novoiceCluster.Realtime.model.MusicStateSnapshot;
import com.novoiceCluster.Realtime.model.Mutator;
import com.novoiceCluster.Realtime.model.PlaybackSession;
import com.novoiceCluster.Realtime.model.Track;
import com.novoiceCluster.Realtime.model.VoiceRoomClosedEvent;
import com.novoiceCluster.Realtime.model.VoiceRoomJoinedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Synchronized group playback, one {@link PlaybackSession} per occupied voice room.
 *
 * Flow for every command:
 * 1. Validate the request and resolve the channel (directory lookups, no lock held)
 * 2. Take the room lock, check the actor may control playback, apply the action
 * 3. If the session changed, broadcast one {@code music.state} snapshot to the room, still under the lock
 *
 * Any present listener, and the server owner, may control playback. Rejections are answered to
 * the requesting connection only ({@code music.error}); nothing is broadcast for them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MusicSessionService {

    private final VoiceRoomCoordinator voiceRooms;
    private final MembershipDirectory directory;
    private final TrackNormalizer trackNormalizer;
    private final EventBroadcaster broadcaster;
    private final KeyedLocks locks;
    private final RealtimeProperties properties;
    private final Clock clock;

    private final Map<String, PlaybackSession> sessions = new ConcurrentHashMap<>();

    // ============ DISPATCH ============

    public MusicCommandResult dispatch(Connection actor, MusicAction action, MusicCommand command) {
        MusicCommandResult result;
        try {
            result = execute(actor, action, command);
        } catch (RealtimeException e) {
            log.warn("🚫 music.{} from {} rejected: {}", action.getWireName(), actor.getUserId(), e.getMessage());
            result = MusicCommandResult.rejected(e);
        }

        if (result.isRejected()) {
            String channelId = command == null ? null : command.getChannelId();
            broadcaster.toConnection(actor, EventType.MUSIC_ERROR,
                    new ErrorNotice(channelId, result.getFailure(), result.getMessage()));
        }
        return result;
    }

    private MusicCommandResult execute(Connection actor, MusicAction action, MusicCommand command) {
        if (command == null || command.getChannelId() == null || command.getChannelId().isBlank()) {
            throw RealtimeException.validation("Channel is required");
        }
        String channelId = command.getChannelId();
        ChannelInfo channel = directory.findChannel(channelId)
                .filter(ChannelInfo::isVoice)
                .orElseThrow(() -> RealtimeException.notFound("Voice channel not found"));

        if (!action.isMutation()) {
            if (!directory.isMember(actor.getUserId(), channel.getServerId())) {
                throw RealtimeException.authorization("Not a member of this server");
            }
            sendState(actor, channelId);
            return MusicCommandResult.unchanged();
        }

        // lookups and track construction complete before the room lock is taken
        boolean owner = directory.isOwner(actor.getUserId(), channel.getServerId());
        Track track = action == MusicAction.ENQUEUE ? trackNormalizer.normalize(command, actor, clock.instant()) : null;

        return locks.call(KeyedLocks.voiceKey(channelId), () -> {
            if (!owner && !voiceRooms.isConnectionIn(actor.getConnectionId(), channelId)) {
                throw RealtimeException.authorization("Join the voice channel to control music");
            }
            if (!voiceRooms.hasRoom(channelId)) {
                throw RealtimeException.notFound("Nobody is listening in this channel");
            }

            PlaybackSession session = sessions.computeIfAbsent(channelId, this::newSession);
            Instant now = clock.instant();
            boolean changed = apply(session, action, command, track, Mutator.of(actor), now);
            if (!changed) {
                log.debug("music.{} in {} was a no-op", action.getWireName(), channelId);
                return MusicCommandResult.unchanged();
            }

            log.info("🎵 music.{} by {} in {}", action.getWireName(), actor.getUserId(), channelId);
            broadcaster.toGroup(InterestGroup.voice(channelId), EventType.MUSIC_STATE, session.snapshot(now));
            return MusicCommandResult.changed();
        });
    }

    private boolean apply(PlaybackSession session, MusicAction action, MusicCommand command,
                          Track track, Mutator actor, Instant now) {
        switch (action) {
            case ENQUEUE:
                return session.enqueue(track, actor, now);
            case PLAY:
                return session.play(actor, now);
            case PAUSE:
                return session.pause(actor, now);
            case SEEK:
                if (command.getPositionSeconds() == null || command.getPositionSeconds().isNaN()) {
                    throw RealtimeException.validation("Seek position is required");
                }
                return session.seek(command.getPositionSeconds(), actor, now);
            case NEXT:
                return session.next(actor, now);
            case PREVIOUS:
                return session.previous(actor, now);
            case SET_CURRENT:
                return session.setCurrent(requireTrackId(command), actor, now);
            case REMOVE:
                return session.remove(requireTrackId(command), actor, now);
            case CLEAR:
                return session.clear(actor, now);
            case REPORT_DURATION:
                return command.getTrackId() != null && command.getSeconds() != null
                        && session.reportDuration(command.getTrackId(), command.getSeconds());
            case TRACK_ENDED:
                return command.getTrackId() != null && session.trackEnded(command.getTrackId(), actor, now);
            default:
                throw RealtimeException.validation("Unsupported action " + action.getWireName());
        }
    }

    // ============ ROOM LIFECYCLE ============

    /**
     * A listener entering the room gets the current state straight away.
     */
    @EventListener
    public void onRoomJoined(VoiceRoomJoinedEvent event) {
        PlaybackSession session = sessions.get(event.getChannelId());
        if (session != null) {
            broadcaster.toConnection(event.getConnection(), EventType.MUSIC_STATE, session.snapshot(clock.instant()));
        }
    }

    @EventListener
    public void onRoomClosed(VoiceRoomClosedEvent event) {
        if (sessions.remove(event.getChannelId()) != null) {
            log.info("⏹️ Playback session discarded for {}", event.getChannelId());
        }
    }

    public boolean hasSession(String channelId) {
        return sessions.containsKey(channelId);
    }

    // ============ HELPERS ============

    private void sendState(Connection actor, String channelId) {
        MusicStateSnapshot snapshot = locks.call(KeyedLocks.voiceKey(channelId), () -> {
            PlaybackSession session = sessions.get(channelId);
            return session != null
                    ? session.snapshot(clock.instant())
                    : MusicStateSnapshot.empty(channelId, clock.millis());
        });
        broadcaster.toConnection(actor, EventType.MUSIC_STATE, snapshot);
    }

    private PlaybackSession newSession(String channelId) {
        log.info("▶️ Playback session created for {}", channelId);
        return new PlaybackSession(
                channelId,
                properties.getQueueCapacity(),
                properties.getMaxPositionSeconds(),
                properties.getRestartThresholdSeconds(),
                clock.instant()
        );
    }

    private static String requireTrackId(MusicCommand command) {
        if (command.getTrackId() == null || command.getTrackId().isBlank()) {
            throw RealtimeException.validation("Track is required");
        }
        return command.getTrackId();
    }
}
