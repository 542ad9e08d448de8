package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Attribution of the most recent accepted playback mutation.
 */
@Value
public class Mutator {

    String userId;
    String displayName;

    public static Mutator of(Connection connection) {
        return new Mutator(connection.getUserId(), connection.getUsername());
    }
}
