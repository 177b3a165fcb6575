package com.example.mailmerge.security;

import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.model.Credential;
import com.example.mailmerge.service.GoogleAuthService;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Headless variant: the owner opens the URL on any machine, and pastes back either the code
 * or the whole address the browser was redirected to.
 */
@Slf4j
public class ConsoleConsentFlow implements ConsentFlow {
    static final String REDIRECT_URI = "http://127.0.0.1:1/";

    private final GoogleAuthService googleAuthService;
    private final BufferedReader input;

    public ConsoleConsentFlow(GoogleAuthService googleAuthService) {
        this(googleAuthService, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    ConsoleConsentFlow(GoogleAuthService googleAuthService, BufferedReader input) {
        this.googleAuthService = googleAuthService;
        this.input = input;
    }

    @Override
    public Credential authorize() {
        String state = GoogleAuthService.newState();
        log.info("Open this URL in a browser to authorize sending mail:\n\n    {}\n",
                googleAuthService.buildAuthorizationUri(REDIRECT_URI, state));
        log.info("After approving, the browser is sent to an address that will not load. "
                + "Paste that address (or just its 'code' value) here and press Enter:");

        String line;
        try {
            line = input.readLine();
        } catch (IOException e) {
            throw new AuthException("Failed to read the authorization code", e);
        }
        if (line == null || line.isBlank()) {
            throw new AuthException("No authorization code entered");
        }
        return googleAuthService.exchangeCode(extractCode(line.trim(), state), REDIRECT_URI);
    }

    static String extractCode(String pasted, String expectedState) {
        if (!pasted.contains("?")) {
            return pasted;
        }
        QueryStringDecoder decoder = new QueryStringDecoder(pasted);
        List<String> error = decoder.parameters().get("error");
        if (error != null && !error.isEmpty()) {
            throw new AuthException("Consent was not granted: " + error.get(0));
        }
        List<String> state = decoder.parameters().get("state");
        if (state != null && !state.isEmpty() && !state.get(0).equals(expectedState)) {
            throw new AuthException("Pasted address carried an unexpected state parameter");
        }
        List<String> code = decoder.parameters().get("code");
        if (code == null || code.isEmpty()) {
            throw new AuthException("Pasted address has no 'code' parameter");
        }
        return code.get(0);
    }
}
