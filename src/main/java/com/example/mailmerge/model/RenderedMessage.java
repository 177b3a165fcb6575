package com.example.mailmerge.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RenderedMessage {
    /** Null when the authorized account is the sender. */
    String from;
    @Singular("toAddress")
    List<String> to;
    @Singular("ccAddress")
    List<String> cc;
    @Singular("bccAddress")
    List<String> bcc;
    String subject;
    String htmlBody;
    String textBody;
    @Singular
    List<AttachmentPayload> attachmentPayloads;

    public boolean hasAttachments() {
        return !attachmentPayloads.isEmpty();
    }

    public boolean hasTextBody() {
        return textBody != null && !textBody.isEmpty();
    }
}
