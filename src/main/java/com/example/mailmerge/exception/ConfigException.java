package com.example.mailmerge.exception;

/**
 * Missing or malformed run input (recipient table, templates, client secrets).
 * Aborts the run before anything is sent.
 */
public class ConfigException extends MailMergeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
