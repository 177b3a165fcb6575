package com.example.mailmerge.model;

import lombok.Value;

@Value
public class RenderedTemplate {
    String subject;
    String htmlBody;
    String textBody;
}
