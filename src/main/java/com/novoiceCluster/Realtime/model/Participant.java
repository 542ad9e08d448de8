package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Display summary of a user, used in voice rosters and on delivered direct messages.
 */
@Value
public class Participant {

    String userId;
    String username;
    String displayName;
    String avatarColor;

    /**
     * Summary built from the token claims alone, for users the directory has no profile for.
     */
    public static Participant fallback(Connection connection) {
        return new Participant(
                connection.getUserId(),
                connection.getUsername(),
                connection.getUsername(),
                null
        );
    }
}
