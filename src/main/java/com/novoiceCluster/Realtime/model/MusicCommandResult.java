package com.novoiceCluster.Realtime.model;

import com.novoiceCluster.Realtime.Exception.FailureKind;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import lombok.Value;

/**
 * Outcome of one music command. Only CHANGED results are broadcast; REJECTED results go
 * back to the requester as {@code music.error}.
 */
@Value
public class MusicCommandResult {

    public enum Status { CHANGED, UNCHANGED, REJECTED }

    Status status;
    FailureKind failure;
    String message;

    public static MusicCommandResult changed() {
        return new MusicCommandResult(Status.CHANGED, null, null);
    }

    public static MusicCommandResult unchanged() {
        return new MusicCommandResult(Status.UNCHANGED, null, null);
    }

    public static MusicCommandResult rejected(RealtimeException e) {
        return new MusicCommandResult(Status.REJECTED, e.getKind(), e.getMessage());
    }

    public boolean isChanged() {
        return status == Status.CHANGED;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
