package com.novoiceCluster.Realtime.model;

import lombok.Value;

@Value
public class TypingUpdate {
    String userId;
    String displayName;
    String channelId;
    boolean direct;
    boolean typing;
}
