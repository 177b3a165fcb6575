package com.example.mailmerge.exception;

import lombok.Getter;

@Getter
public class AttachmentException extends RecipientException {

    private final String path;

    public AttachmentException(String path, String reason) {
        super(reason + ": " + path);
        this.path = path;
    }

    public AttachmentException(String path, String reason, Throwable cause) {
        super(reason + ": " + path, cause);
        this.path = path;
    }

    public static AttachmentException notFound(String path) {
        return new AttachmentException(path, "attachment not found");
    }
}
