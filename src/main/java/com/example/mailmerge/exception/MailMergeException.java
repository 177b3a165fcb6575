package com.example.mailmerge.exception;

public abstract class MailMergeException extends RuntimeException {

    protected MailMergeException(String message) {
        super(message);
    }

    protected MailMergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
