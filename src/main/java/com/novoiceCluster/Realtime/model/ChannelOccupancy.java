package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Sidebar badge for a voice channel, sent to the owning server's group.
 */
@Value
public class ChannelOccupancy {
    String channelId;
    int participantCount;
}
