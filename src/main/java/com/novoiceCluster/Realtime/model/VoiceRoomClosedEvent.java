package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Published synchronously, under the room lock, when the last participant leaves.
 */
@Value
public class VoiceRoomClosedEvent {
    String channelId;
}
