package com.example.mailmerge.security;

import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.model.Credential;
import com.example.mailmerge.service.GoogleAuthService;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Installed-application flow: listens on an ephemeral 127.0.0.1 port and waits for the browser
 * redirect that carries the authorization code.
 */
@Slf4j
public class LoopbackConsentFlow implements ConsentFlow {
    static final String CALLBACK_PATH = "/";

    private static final String DONE_PAGE = "<html><body><p>Authorization complete. You can close this window.</p></body></html>";
    private static final String DENIED_PAGE = "<html><body><p>Authorization failed. Check the terminal for details.</p></body></html>";

    private final GoogleAuthService googleAuthService;
    private final Consumer<URI> urlPresenter;

    public LoopbackConsentFlow(GoogleAuthService googleAuthService) {
        this(googleAuthService, uri -> log.info("Open this URL in a browser to authorize sending mail:\n\n    {}\n", uri));
    }

    LoopbackConsentFlow(GoogleAuthService googleAuthService, Consumer<URI> urlPresenter) {
        this.googleAuthService = googleAuthService;
        this.urlPresenter = urlPresenter;
    }

    @Override
    public Credential authorize() {
        String state = GoogleAuthService.newState();
        Sinks.One<Map<String, String>> callback = Sinks.one();

        DisposableServer server = HttpServer.create()
                .host("127.0.0.1")
                .port(0)
                .handle((request, response) -> {
                    QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
                    Map<String, String> params = firstValues(decoder.parameters());
                    if (!CALLBACK_PATH.equals(decoder.path()) || (!params.containsKey("code") && !params.containsKey("error"))) {
                        return response.status(HttpResponseStatus.NOT_FOUND).send();
                    }
                    callback.tryEmitValue(params);
                    return response.header("Content-Type", "text/html; charset=UTF-8")
                            .sendString(Mono.just(params.containsKey("code") ? DONE_PAGE : DENIED_PAGE));
                })
                .bindNow();

        try {
            String redirectUri = "http://127.0.0.1:" + server.port() + CALLBACK_PATH;
            urlPresenter.accept(googleAuthService.buildAuthorizationUri(redirectUri, state));
            log.info("Waiting for the consent redirect on {}", redirectUri);

            Map<String, String> params = callback.asMono().block();
            if (params == null) {
                throw new AuthException("Consent flow ended without a response");
            }
            if (params.containsKey("error")) {
                throw new AuthException("Consent was not granted: " + params.get("error"));
            }
            if (!state.equals(params.get("state"))) {
                throw new AuthException("Consent redirect carried an unexpected state parameter");
            }
            return googleAuthService.exchangeCode(params.get("code"), redirectUri);
        } finally {
            server.disposeNow();
        }
    }

    private static Map<String, String> firstValues(Map<String, List<String>> parameters) {
        Map<String, String> values = new HashMap<>();
        parameters.forEach((name, list) -> {
            if (!list.isEmpty()) {
                values.put(name, list.get(0));
            }
        });
        return values;
    }
}
