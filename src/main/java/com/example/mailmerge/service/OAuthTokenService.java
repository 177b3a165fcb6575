package com.example.mailmerge.service;

import com.example.mailmerge.dto.GoogleClientSecrets;
import com.example.mailmerge.dto.GoogleTokenResponse;
import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.model.Credential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Calls the OAuth token endpoint: authorization-code exchange and refresh-token grant.
 */
@Service
@Slf4j
public class OAuthTokenService {

    private final WebClient googleOauthClient;
    private final ClientSecretsService clientSecretsService;
    private final Clock clock;

    public OAuthTokenService(@Qualifier("googleOauthClient") WebClient googleOauthClient,
                             ClientSecretsService clientSecretsService,
                             Clock clock) {
        this.googleOauthClient = googleOauthClient;
        this.clientSecretsService = clientSecretsService;
        this.clock = clock;
    }

    /** Blocking exchange: authorization code -> credential. */
    public Credential exchangeCodeForTokens(String authorizationCode, String redirectUri) {
        GoogleClientSecrets.Details client = clientSecretsService.getDetails();
        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("client_id", client.getClientId());
        formData.add("client_secret", client.getClientSecret());
        formData.add("code", authorizationCode);
        formData.add("grant_type", "authorization_code");
        formData.add("redirect_uri", redirectUri);

        GoogleTokenResponse response = postToken(formData, "exchange authorization code")
                .doOnSuccess(r -> log.info("Successfully exchanged code for tokens"))
                .block();
        return toCredential(response, null);
    }

    /** Blocking refresh. The refresh token and scopes carry over when the response omits them. */
    public Credential refreshAccessToken(Credential current) {
        if (current.getRefreshToken() == null || current.getRefreshToken().isBlank()) {
            throw new AuthException("Access token expired and no refresh token available; delete the token store to re-authorize");
        }
        GoogleClientSecrets.Details client = clientSecretsService.getDetails();
        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("client_id", client.getClientId());
        formData.add("client_secret", client.getClientSecret());
        formData.add("refresh_token", current.getRefreshToken());
        formData.add("grant_type", "refresh_token");

        GoogleTokenResponse response = postToken(formData, "refresh access token")
                .doOnSuccess(r -> log.info("Successfully refreshed access token"))
                .block();
        return toCredential(response, current);
    }

    Credential toCredential(GoogleTokenResponse response, Credential previous) {
        if (response == null || response.getAccessToken() == null) {
            throw new AuthException("Token endpoint returned no access token");
        }
        Credential.CredentialBuilder builder = previous != null ? previous.toBuilder() : Credential.builder();
        builder.accessToken(response.getAccessToken());
        if (response.getRefreshToken() != null) {
            builder.refreshToken(response.getRefreshToken());
        }
        builder.expiry(response.getExpiresIn() != null
                ? clock.instant().plusSeconds(response.getExpiresIn())
                : null);
        if (response.getScope() != null) {
            builder.scopes(parseScopes(response.getScope()));
        } else if (previous == null) {
            builder.scopes(Set.of());
        }
        return builder.build();
    }

    static Set<String> parseScopes(String scope) {
        return Arrays.stream(scope.trim().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private Mono<GoogleTokenResponse> postToken(MultiValueMap<String, String> formData, String action) {
        return googleOauthClient.post()
                .uri("/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(formData))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .doOnNext(b -> log.error("Google token endpoint error: {} - {}", resp.statusCode(), b))
                                .map(b -> new AuthException("Failed to " + action + ": " + resp.statusCode() + describe(b))))
                .bodyToMono(GoogleTokenResponse.class)
                .onErrorMap(e -> !(e instanceof AuthException),
                        e -> new AuthException("Failed to " + action + ": " + e.getMessage(), e));
    }

    private static String describe(String body) {
        if (body.contains("invalid_grant")) {
            return " (refresh token expired or revoked)";
        }
        return body.isBlank() ? "" : " " + body.trim();
    }
}
