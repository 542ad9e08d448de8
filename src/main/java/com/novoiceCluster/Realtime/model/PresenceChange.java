package com.novoiceCluster.Realtime.model;

import lombok.Value;

@Value
public class PresenceChange {
    String userId;
    PresenceStatus status;
}
