package com.novoiceCluster.Realtime.model;

import lombok.Value;

import java.time.Instant;

/**
 * An attached real-time session. One user may own several at once (multi-device).
 * The connection id is the STOMP session id.
 */
@Value
public class Connection {

    String connectionId;
    String userId;
    String username;
    Instant connectedAt;

    public static Connection of(String connectionId, AuthenticatedUser user, Instant connectedAt) {
        return new Connection(connectionId, user.getUserId(), user.getUsername(), connectedAt);
    }
}
