package com.example.mailmerge.model;

import lombok.Value;

@Value
public class SendResult {
    String recipientEmail;
    SendStatus status;
    /** Rendered subject, null when rendering never completed. */
    String subject;
    /** Gmail message id of a sent message. */
    String messageId;
    /** Present iff {@code status == FAILED}. */
    String errorReason;

    public static SendResult sent(String email, String subject, String messageId) {
        return new SendResult(email, SendStatus.SENT, subject, messageId, null);
    }

    public static SendResult previewed(String email, String subject) {
        return new SendResult(email, SendStatus.PREVIEWED, subject, null, null);
    }

    public static SendResult failed(String email, String subject, String reason) {
        return new SendResult(email, SendStatus.FAILED, subject, null, reason);
    }

    public boolean isFailed() {
        return status == SendStatus.FAILED;
    }
}
