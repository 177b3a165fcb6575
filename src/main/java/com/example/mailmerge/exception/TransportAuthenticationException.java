package com.example.mailmerge.exception;

/**
 * The API rejected the access token (HTTP 401). Never retried by the transport; the pipeline
 * re-validates the credential instead.
 */
public class TransportAuthenticationException extends TransportException {

    public TransportAuthenticationException(String message) {
        super(message, 401, false);
    }
}
