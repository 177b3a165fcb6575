package com.example.mailmerge.exception;

import lombok.Getter;

/**
 * Gmail API call failure. {@code transientFailure} marks rate-limit, server-error and
 * timeout classes that may be retried.
 */
@Getter
public class TransportException extends RecipientException {

    private final int statusCode;
    private final boolean transientFailure;

    public TransportException(String message, int statusCode, boolean transientFailure) {
        super(message);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public TransportException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.statusCode = 0;
        this.transientFailure = transientFailure;
    }

    public static boolean isTransient(Throwable e) {
        return e instanceof TransportException te && te.isTransientFailure();
    }
}
