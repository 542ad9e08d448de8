package com.novoiceCluster.Realtime.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of every {@code /app/music.*} message. Which optional fields are required depends on
 * the action; {@link com.novoiceCluster.Realtime.services.MusicSessionService} checks them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MusicCommand {

    private String channelId;

    // enqueue
    private String url;
    private String title;
    private String coverUrl;
    private Double durationSeconds;

    // seek
    private Double positionSeconds;

    // setCurrent, remove, reportDuration, trackEnded
    private String trackId;

    // reportDuration
    private Double seconds;
}
