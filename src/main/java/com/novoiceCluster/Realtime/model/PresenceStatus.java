package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PresenceStatus {
    ONLINE,
    OFFLINE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
