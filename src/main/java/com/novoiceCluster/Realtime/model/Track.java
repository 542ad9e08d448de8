package com.novoiceCluster.Realtime.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One queued media reference. Immutable: a back-filled duration produces a new instance
 * via {@link #withDurationSeconds(Double)}, so a track handed to an outgoing snapshot never changes.
 */
@Value
@Builder(toBuilder = true)
public class Track {

    String id;
    String url;
    String title;
    SourceKind source;
    String sourceLabel;
    String coverUrl;

    /** Null while unknown. */
    @With
    Double durationSeconds;

    String requestedBy;
    String requestedByName;
    Instant addedAt;

    public boolean hasKnownDuration() {
        return durationSeconds != null && durationSeconds > 0;
    }
}
