package com.example.mailmerge.service;

import com.example.mailmerge.dto.GmailSendRequest;
import com.example.mailmerge.dto.GmailSendResponse;
import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.exception.MailMergeException;
import com.example.mailmerge.exception.TransportAuthenticationException;
import com.example.mailmerge.exception.TransportException;
import com.example.mailmerge.model.Credential;
import com.example.mailmerge.model.RenderedMessage;
import com.example.mailmerge.model.SendResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Live delivery through {@code users.messages.send}. Rate-limit, server-error and timeout
 * failures are retried with exponential backoff; 401 is handed back to the caller untouched.
 */
@Service
@Slf4j
public class GmailMailTransport implements MailTransport {
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);
    private static final int MAX_BODY_IN_REASON = 300;

    private final WebClient gmailWebClient;
    private final MimeMessageFactory mimeMessageFactory;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration timeout;

    public GmailMailTransport(@Qualifier("gmailWebClient") WebClient gmailWebClient,
                              MimeMessageFactory mimeMessageFactory,
                              @Value("${mailmerge.transport.max-attempts:3}") int maxAttempts,
                              @Value("${mailmerge.transport.initial-backoff:1s}") Duration initialBackoff,
                              @Value("${mailmerge.transport.max-backoff:16s}") Duration maxBackoff,
                              @Value("${mailmerge.transport.timeout:60s}") Duration timeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("mailmerge.transport.max-attempts must be at least 1");
        }
        this.gmailWebClient = gmailWebClient;
        this.mimeMessageFactory = mimeMessageFactory;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.timeout = timeout;
    }

    @Override
    public Mono<SendResult> send(RenderedMessage message, Credential credential) {
        String recipient = String.join(", ", message.getTo());
        return Mono.fromCallable(() -> new GmailSendRequest(mimeMessageFactory.toRawBase64Url(message)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(payload -> sendWithRetry(payload, credential.getAccessToken(), recipient))
                .map(response -> {
                    log.info("Sent to {} (Gmail id {})", recipient, response.getId());
                    return SendResult.sent(recipient, message.getSubject(), response.getId());
                })
                .onErrorResume(e -> e instanceof TransportException && !(e instanceof TransportAuthenticationException),
                        e -> {
                            log.warn("Delivery to {} failed: {}", recipient, e.getMessage());
                            return Mono.just(SendResult.failed(recipient, message.getSubject(), e.getMessage()));
                        });
    }

    private Mono<GmailSendResponse> sendWithRetry(GmailSendRequest payload, String accessToken, String recipient) {
        return gmailWebClient.post()
                .uri("/messages/send")
                .headers(h -> h.setBearerAuth(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toException)
                .bodyToMono(GmailSendResponse.class)
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof MailMergeException), GmailMailTransport::toTransportException)
                .retryWhen(Retry.backoff(maxAttempts - 1L, initialBackoff)
                        .maxBackoff(maxBackoff)
                        .filter(TransportException::isTransient)
                        .doBeforeRetry(signal -> log.warn("[retry] {} for {} (attempt {} of {})",
                                signal.failure().getMessage(), recipient, signal.totalRetries() + 2, maxAttempts))
                        .onRetryExhaustedThrow((backoff, signal) -> new TransportException(
                                "gave up after " + maxAttempts + " attempts: " + signal.failure().getMessage(),
                                signal.failure(), false)));
    }

    private Mono<MailMergeException> toException(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> classify(status.value(), body));
    }

    static MailMergeException classify(int status, String body) {
        String reason = "Gmail API returned " + status + abbreviate(body);
        if (status == 401) {
            return new TransportAuthenticationException(reason);
        }
        if (status == 403) {
            if (body.contains("rateLimitExceeded") || body.contains("userRateLimitExceeded")) {
                return new TransportException(reason, status, true);
            }
            if (body.contains("insufficientPermissions") || body.contains("ACCESS_TOKEN_SCOPE_INSUFFICIENT")) {
                return new AuthException("Credential lacks permission to send mail: " + reason);
            }
            return new TransportException(reason, status, false);
        }
        return new TransportException(reason, status, TRANSIENT_STATUSES.contains(status));
    }

    private static TransportException toTransportException(Throwable e) {
        if (e instanceof TimeoutException) {
            return new TransportException("Gmail API call timed out", e, true);
        }
        if (e instanceof WebClientRequestException) {
            return new TransportException("Gmail API request failed: " + e.getMessage(), e, true);
        }
        return new TransportException("Gmail API call failed: " + e.getMessage(), e, false);
    }

    private static String abbreviate(String body) {
        String flat = body.replaceAll("\\s+", " ").trim();
        if (flat.isEmpty()) {
            return "";
        }
        return ": " + (flat.length() > MAX_BODY_IN_REASON ? flat.substring(0, MAX_BODY_IN_REASON) + "..." : flat);
    }
}
