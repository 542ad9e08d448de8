package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.novoiceCluster.Realtime.Exception.FailureKind;
import lombok.Value;

/**
 * Requester-only error payload ({@code error} and {@code music.error}).
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorNotice {
    String channelId;
    FailureKind kind;
    String message;
}
