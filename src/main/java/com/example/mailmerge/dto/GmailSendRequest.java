package com.example.mailmerge.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code users.messages.send} body: the full RFC 822 message, base64url encoded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GmailSendRequest {
    private String raw;
}
