package com.novoiceCluster.Realtime.model;

import java.util.Optional;

/**
 * Music control actions, addressed as {@code /app/music.<wireName>}.
 */
public enum MusicAction {
    ENQUEUE("enqueue"),
    PLAY("play"),
    PAUSE("pause"),
    SEEK("seek"),
    NEXT("next"),
    PREVIOUS("previous"),
    SET_CURRENT("setCurrent"),
    REMOVE("remove"),
    CLEAR("clear"),
    REPORT_DURATION("reportDuration"),
    TRACK_ENDED("trackEnded"),
    REQUEST_STATE("requestState");

    private final String wireName;

    MusicAction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Read-only actions never change the session and skip the permission gate.
     */
    public boolean isMutation() {
        return this != REQUEST_STATE;
    }

    public static Optional<MusicAction> fromWireName(String wireName) {
        for (MusicAction action : values()) {
            if (action.wireName.equals(wireName)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
