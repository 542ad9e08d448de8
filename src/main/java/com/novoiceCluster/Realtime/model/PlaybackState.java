package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlaybackState {
    IDLE,
    PAUSED,
    PLAYING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
