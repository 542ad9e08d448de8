package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Published synchronously, under the room lock, after a connection entered a voice room.
 */
@Value
public class VoiceRoomJoinedEvent {
    Connection connection;
    String channelId;
}
