package com.novoiceCluster.Realtime.model;

import com.novoiceCluster.Realtime.Exception.RealtimeException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Server-authoritative playback state of one voice room.
 *
 * There is no ticking clock. While playing, the position at instant {@code t} is
 * {@code basePositionSeconds + (t - anchor)}, clamped to the seek bound; otherwise it is exactly
 * {@code basePositionSeconds}. Every client reconstructs the same value from a snapshot.
 *
 * Mutators return {@code true} when state changed and a snapshot must be broadcast, {@code false}
 * for no-ops. Requests that cannot be honoured throw {@link RealtimeException}.
 *
 * Invariants:
 * <ul>
 *   <li>{@code currentIndex} is null or a valid index into {@code queue}</li>
 *   <li>{@code state} is IDLE whenever {@code currentIndex} is null</li>
 * </ul>
 *
 * Not thread-safe. Callers hold the room lock.
 */
public class PlaybackSession {

    private final String channelId;
    private final int queueCapacity;
    private final double maxPositionSeconds;
    private final double restartThresholdSeconds;

    private final List<Track> queue = new ArrayList<>();
    private Integer currentIndex;
    private PlaybackState state = PlaybackState.IDLE;
    private double basePositionSeconds;
    private Instant anchor;

    private Mutator lastMutatedBy;
    private Instant lastMutatedAt;

    public PlaybackSession(String channelId, int queueCapacity, double maxPositionSeconds,
                           double restartThresholdSeconds, Instant createdAt) {
        this.channelId = channelId;
        this.queueCapacity = queueCapacity;
        this.maxPositionSeconds = maxPositionSeconds;
        this.restartThresholdSeconds = restartThresholdSeconds;
        this.anchor = createdAt;
    }

    // ============ POSITION ============

    public double positionAt(Instant now) {
        if (state != PlaybackState.PLAYING) {
            return basePositionSeconds;
        }
        double elapsed = Duration.between(anchor, now).toMillis() / 1000.0;
        return clampPosition(basePositionSeconds + elapsed);
    }

    private double clampPosition(double seconds) {
        double upper = maxPositionSeconds;
        Track current = getCurrentTrack();
        if (current != null && current.hasKnownDuration()) {
            upper = Math.min(upper, current.getDurationSeconds());
        }
        return Math.max(0, Math.min(upper, seconds));
    }

    // ============ QUEUE ============

    public boolean enqueue(Track track, Mutator actor, Instant now) {
        if (queue.size() >= queueCapacity) {
            throw RealtimeException.capacity("Queue is full (" + queueCapacity + " tracks)");
        }
        queue.add(track);
        if (currentIndex == null) {
            currentIndex = 0;
            state = PlaybackState.PAUSED;
            resetPosition(now);
        }
        touch(actor, now);
        return true;
    }

    public boolean remove(String trackId, Mutator actor, Instant now) {
        int index = requireIndexOf(trackId);
        queue.remove(index);

        if (queue.isEmpty()) {
            currentIndex = null;
            state = PlaybackState.IDLE;
            resetPosition(now);
        } else if (currentIndex != null && index == currentIndex) {
            currentIndex = Math.min(index, queue.size() - 1);
            resetPosition(now);
        } else if (currentIndex != null && index < currentIndex) {
            // keep the same logical track current
            currentIndex = currentIndex - 1;
        }
        touch(actor, now);
        return true;
    }

    public boolean clear(Mutator actor, Instant now) {
        if (queue.isEmpty() && currentIndex == null) {
            return false;
        }
        queue.clear();
        currentIndex = null;
        state = PlaybackState.IDLE;
        resetPosition(now);
        touch(actor, now);
        return true;
    }

    // ============ TRANSPORT ============

    public boolean play(Mutator actor, Instant now) {
        requireCurrentTrack();
        if (state == PlaybackState.PLAYING) {
            return false;
        }
        anchor = now;
        state = PlaybackState.PLAYING;
        touch(actor, now);
        return true;
    }

    public boolean pause(Mutator actor, Instant now) {
        if (state != PlaybackState.PLAYING) {
            return false;
        }
        basePositionSeconds = positionAt(now);
        anchor = now;
        state = PlaybackState.PAUSED;
        touch(actor, now);
        return true;
    }

    public boolean seek(double positionSeconds, Mutator actor, Instant now) {
        requireCurrentTrack();
        basePositionSeconds = clampPosition(positionSeconds);
        anchor = now;
        if (state == PlaybackState.IDLE) {
            state = PlaybackState.PAUSED;
        }
        touch(actor, now);
        return true;
    }

    /**
     * Advance to the next entry. Past the last entry the pointer stays on the last index and
     * the session goes idle at position 0; there is no wraparound.
     */
    public boolean next(Mutator actor, Instant now) {
        if (currentIndex == null) {
            return false;
        }
        if (currentIndex < queue.size() - 1) {
            currentIndex = currentIndex + 1;
            moved(now);
        } else {
            if (state == PlaybackState.IDLE && basePositionSeconds == 0) {
                return false;
            }
            state = PlaybackState.IDLE;
            resetPosition(now);
        }
        touch(actor, now);
        return true;
    }

    /**
     * Step back one entry, or restart the current one when more than the restart threshold
     * has already been played.
     */
    public boolean previous(Mutator actor, Instant now) {
        if (currentIndex == null) {
            return false;
        }
        if (positionAt(now) > restartThresholdSeconds) {
            resetPosition(now);
        } else if (currentIndex > 0) {
            currentIndex = currentIndex - 1;
            moved(now);
        } else {
            if (state != PlaybackState.PLAYING && basePositionSeconds == 0) {
                return false;
            }
            resetPosition(now);
        }
        touch(actor, now);
        return true;
    }

    public boolean setCurrent(String trackId, Mutator actor, Instant now) {
        currentIndex = requireIndexOf(trackId);
        moved(now);
        touch(actor, now);
        return true;
    }

    /**
     * Completion report from the client rendering the track. Reports for anything other than
     * the current track are stale and ignored.
     */
    public boolean trackEnded(String trackId, Mutator actor, Instant now) {
        Track current = getCurrentTrack();
        if (current == null || !current.getId().equals(trackId)) {
            return false;
        }
        return next(actor, now);
    }

    /**
     * Back-fill a duration the first time a client measures it. Attribution is left alone since
     * this is a measurement, not a user action.
     */
    public boolean reportDuration(String trackId, double seconds) {
        int index = indexOf(trackId);
        if (index < 0 || seconds <= 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            return false;
        }
        Track track = queue.get(index);
        if (track.hasKnownDuration()) {
            return false;
        }
        queue.set(index, track.withDurationSeconds(Math.min(seconds, maxPositionSeconds)));
        return true;
    }

    // ============ SNAPSHOT ============

    public MusicStateSnapshot snapshot(Instant now) {
        return MusicStateSnapshot.builder()
                .channelId(channelId)
                .queue(List.copyOf(queue))
                .currentIndex(currentIndex)
                .currentTrack(getCurrentTrack())
                .playbackState(state)
                .positionSeconds(positionAt(now))
                .serverNow(now.toEpochMilli())
                .lastMutatedBy(lastMutatedBy)
                .lastMutatedAt(lastMutatedAt == null ? null : lastMutatedAt.toEpochMilli())
                .build();
    }

    // ============ ACCESSORS ============

    public String getChannelId() {
        return channelId;
    }

    public List<Track> getQueue() {
        return List.copyOf(queue);
    }

    public Integer getCurrentIndex() {
        return currentIndex;
    }

    public Track getCurrentTrack() {
        return currentIndex == null ? null : queue.get(currentIndex);
    }

    public PlaybackState getState() {
        return state;
    }

    public double getBasePositionSeconds() {
        return basePositionSeconds;
    }

    public Instant getAnchor() {
        return anchor;
    }

    public Mutator getLastMutatedBy() {
        return lastMutatedBy;
    }

    public Instant getLastMutatedAt() {
        return lastMutatedAt;
    }

    // ============ HELPERS ============

    private void moved(Instant now) {
        resetPosition(now);
        if (state == PlaybackState.IDLE) {
            state = PlaybackState.PAUSED;
        }
    }

    private void resetPosition(Instant now) {
        basePositionSeconds = 0;
        anchor = now;
    }

    private void touch(Mutator actor, Instant now) {
        lastMutatedBy = actor;
        lastMutatedAt = now;
    }

    private void requireCurrentTrack() {
        if (currentIndex == null) {
            throw RealtimeException.validation("Nothing is queued");
        }
    }

    private int requireIndexOf(String trackId) {
        int index = indexOf(trackId);
        if (index < 0) {
            throw RealtimeException.validation("Track is no longer in the queue");
        }
        return index;
    }

    private int indexOf(String trackId) {
        if (trackId == null) {
            return -1;
        }
        for (int i = 0; i < queue.size(); i++) {
            if (trackId.equals(queue.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }
}
