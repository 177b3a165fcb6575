package com.example.mailmerge.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

/**
 * Client identity file downloaded from the Google Cloud console. Desktop clients nest the
 * details under {@code installed}, web clients under {@code web}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoogleClientSecrets {
    Details installed;
    Details web;

    @JsonIgnore
    public Details getDetails() {
        return installed != null ? installed : web;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Details {
        @JsonProperty("client_id")
        String clientId;

        @JsonProperty("client_secret")
        String clientSecret;

        @JsonProperty("auth_uri")
        String authUri;

        @JsonProperty("token_uri")
        String tokenUri;

        @JsonProperty("redirect_uris")
        List<String> redirectUris;
    }
}
