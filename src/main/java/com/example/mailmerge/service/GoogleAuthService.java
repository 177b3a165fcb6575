package com.example.mailmerge.service;

import com.example.mailmerge.dto.GoogleClientSecrets;
import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.model.Credential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Consent-screen side of the installed-application flow: builds the authorization URL and
 * turns the returned code into a credential that can send mail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoogleAuthService {

    static final String DEFAULT_AUTH_URI = "https://accounts.google.com/o/oauth2/auth";
    static final String SCOPE = Credential.GMAIL_SEND_SCOPE;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ClientSecretsService clientSecretsService;
    private final OAuthTokenService oAuthTokenService;

    public URI buildAuthorizationUri(String redirectUri, String state) {
        GoogleClientSecrets.Details client = clientSecretsService.getDetails();
        String base = client.getAuthUri() == null || client.getAuthUri().isBlank()
                ? DEFAULT_AUTH_URI
                : client.getAuthUri();
        StringBuilder sb = new StringBuilder(base).append(base.contains("?") ? "&" : "?")
                .append("client_id=").append(encode(client.getClientId()))
                .append("&redirect_uri=").append(encode(redirectUri))
                .append("&response_type=code")
                .append("&scope=").append(encode(SCOPE))
                .append("&access_type=offline")
                .append("&prompt=consent");
        if (state != null && !state.isBlank()) {
            sb.append("&state=").append(encode(state));
        }
        return URI.create(sb.toString());
    }

    public Credential exchangeCode(String authorizationCode, String redirectUri) {
        if (authorizationCode == null || authorizationCode.isBlank()) {
            throw new AuthException("No authorization code was returned by the consent screen");
        }
        Credential credential = oAuthTokenService.exchangeCodeForTokens(authorizationCode.trim(), redirectUri);
        log.info("Token response scopes: {}", credential.getScopes());
        if (!credential.canSend()) {
            throw new AuthException("Access denied: Google did not grant the Gmail send scope. Re-run and approve it on the consent screen.");
        }
        return credential;
    }

    public static String newState() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
