package com.example.mailmerge.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

@Value
public class AttachmentPayload {
    String filename;
    String mimeType;
    @ToString.Exclude
    @Getter(AccessLevel.NONE)
    byte[] content;

    public byte[] getContent() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }
}
