package com.example.mailmerge.exception;

public class ValidationException extends RecipientException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ValidationException unresolvedPlaceholder(String name) {
        return new ValidationException("unresolved placeholder: {" + name + "}");
    }
}
