package com.example.mailmerge.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One validated row of the recipient table. {@code fields} holds every column of the row
 * (trimmed) and is the only namespace templates are rendered against.
 */
@Value
@Builder
public class RecipientRecord {
    int rowNumber;
    String email;
    @Builder.Default
    String firstname = "";
    @Builder.Default
    String company = "";
    @Builder.Default
    String cc = "";
    @Builder.Default
    String bcc = "";
    @Singular
    List<String> attachments;
    @Singular
    Map<String, String> fields;
}
