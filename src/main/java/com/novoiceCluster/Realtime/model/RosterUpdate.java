package com.novoiceCluster.Realtime.model;

import lombok.Value;

import java.util.List;

@Value
public class RosterUpdate {
    String channelId;
    List<Participant> participants;
}
