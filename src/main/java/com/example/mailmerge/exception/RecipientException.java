package com.example.mailmerge.exception;

/**
 * Failure scoped to a single recipient. The pipeline records it as that recipient's result
 * and moves on.
 */
public abstract class RecipientException extends MailMergeException {

    protected RecipientException(String message) {
        super(message);
    }

    protected RecipientException(String message, Throwable cause) {
        super(message, cause);
    }
}
