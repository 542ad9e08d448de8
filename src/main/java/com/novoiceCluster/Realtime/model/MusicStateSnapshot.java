package com.novoiceCluster.Realtime.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Full playback state as broadcast after every accepted mutation.
 *
 * {@code positionSeconds} is derived at {@code serverNow} (epoch millis); receivers add their own
 * elapsed time when {@code playbackState} is playing.
 */
@Value
@Builder
public class MusicStateSnapshot {

    String channelId;
    List<Track> queue;
    Integer currentIndex;
    Track currentTrack;
    PlaybackState playbackState;
    double positionSeconds;
    long serverNow;
    Mutator lastMutatedBy;
    Long lastMutatedAt;

    public static MusicStateSnapshot empty(String channelId, long serverNow) {
        return MusicStateSnapshot.builder()
                .channelId(channelId)
                .queue(List.of())
                .playbackState(PlaybackState.IDLE)
                .positionSeconds(0)
                .serverNow(serverNow)
                .build();
    }
}
