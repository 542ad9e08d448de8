package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Channel metadata as seen through the membership directory.
 */
@Value
public class ChannelInfo {

    public static final String TYPE_VOICE = "voice";

    String id;
    String serverId;
    String type;
    String name;

    public boolean isVoice() {
        return TYPE_VOICE.equals(type);
    }
}
