package com.novoiceCluster.Realtime.Exception;

import lombok.Getter;

/**
 * A request the core refuses. The message is safe to show to the requester.
 */
@Getter
public class RealtimeException extends RuntimeException {

    private final FailureKind kind;

    public RealtimeException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RealtimeException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static RealtimeException authentication(String message) {
        return new RealtimeException(FailureKind.AUTHENTICATION, message);
    }

    public static RealtimeException authorization(String message) {
        return new RealtimeException(FailureKind.AUTHORIZATION, message);
    }

    public static RealtimeException validation(String message) {
        return new RealtimeException(FailureKind.VALIDATION, message);
    }

    public static RealtimeException capacity(String message) {
        return new RealtimeException(FailureKind.CAPACITY, message);
    }

    public static RealtimeException notFound(String message) {
        return new RealtimeException(FailureKind.NOT_FOUND, message);
    }
}
