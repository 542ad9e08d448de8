package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Names of outbound events, used as the {@code type} tag of {@link OutboundEvent}.
 */
public enum EventType {
    PRESENCE_CHANGED("presence.changed"),
    VOICE_ROSTER("voice.roster"),
    VOICE_CHANNEL_UPDATE("voice.channelUpdate"),
    VOICE_SIGNAL("voice.signal"),
    MUSIC_STATE("music.state"),
    MUSIC_ERROR("music.error"),
    DM_NEW("dm.new"),
    TYPING_UPDATE("typing.update"),
    FRIEND_REQUEST_RECEIVED("friend.requestReceived"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
