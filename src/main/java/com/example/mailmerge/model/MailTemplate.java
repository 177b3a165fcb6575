package com.example.mailmerge.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MailTemplate {
    String subjectTemplate;
    String htmlTemplate;
    /** Optional plain-text alternative, null when absent. */
    String textTemplate;

    public boolean hasText() {
        return textTemplate != null && !textTemplate.isEmpty();
    }
}
