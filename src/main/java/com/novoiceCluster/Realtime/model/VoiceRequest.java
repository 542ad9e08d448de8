package com.novoiceCluster.Realtime.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code voice.join} and {@code voice.requestState}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoiceRequest {
    private String channelId;
}
