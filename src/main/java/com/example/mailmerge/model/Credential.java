package com.example.mailmerge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * OAuth2 user credential for the Gmail API. Immutable; a refresh produces a new instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Credential {
    public static final String GMAIL_SEND_SCOPE = "https://www.googleapis.com/auth/gmail.send";
    public static final String FULL_MAIL_SCOPE = "https://mail.google.com/";

    @ToString.Exclude
    @JsonProperty("access_token")
    String accessToken;

    @ToString.Exclude
    @JsonProperty("refresh_token")
    String refreshToken;

    @JsonProperty("expiry")
    Instant expiry;

    @JsonProperty("scopes")
    Set<String> scopes;

    public boolean isExpiredAt(Instant now, Duration skew) {
        return accessToken == null || (expiry != null && expiry.isBefore(now.plus(skew)));
    }

    public boolean canSend() {
        return scopes != null && (scopes.contains(GMAIL_SEND_SCOPE) || scopes.contains(FULL_MAIL_SCOPE));
    }
}
