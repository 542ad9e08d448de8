package com.novoiceCluster.Realtime.Exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure taxonomy of the real-time core. None of these is retried server-side.
 */
public enum FailureKind {
    /** Bad or expired token at handshake; the connection is refused. */
    AUTHENTICATION,
    /** Not a member, not present in the room, or not the owner. */
    AUTHORIZATION,
    /** Malformed URL, unknown track id, empty content. */
    VALIDATION,
    /** Queue full or rate limit hit. */
    CAPACITY,
    /** Channel, track or room no longer exists. */
    NOT_FOUND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
