package com.example.mailmerge.exception;

/**
 * Unrecoverable OAuth failure: revoked consent, invalid refresh token or missing send scope.
 * Aborts the remaining run.
 */
public class AuthException extends MailMergeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
