package com.example.mailmerge.service;

import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.model.Credential;
import com.example.mailmerge.repository.CredentialRepository;
import com.example.mailmerge.security.ConsentFlow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Sole owner of the run's {@link Credential}.
 * <pre>
 * UNINITIALIZED --stored--------------------> VALID
 * UNINITIALIZED --none stored, consent------> VALID   (persisted)
 * VALID --expired, refresh ok---------------> VALID   (persisted)
 * any   --refresh fails / scope missing-----> FATAL   (every later call rethrows)
 * </pre>
 * All methods are synchronized so a refresh can never run twice concurrently.
 */
@Service
@Slf4j
public class CredentialManager {

    enum State { UNINITIALIZED, VALID, FATAL }

    private final CredentialRepository credentialRepository;
    private final OAuthTokenService oAuthTokenService;
    private final ConsentFlow consentFlow;
    private final Clock clock;
    private final Duration expirySkew;

    private State state = State.UNINITIALIZED;
    private Credential credential;
    /** When the current credential was issued in this run, null for one loaded from the store. */
    private Instant issuedAt;
    private AuthException fatalError;

    public CredentialManager(CredentialRepository credentialRepository,
                             OAuthTokenService oAuthTokenService,
                             ConsentFlow consentFlow,
                             Clock clock,
                             @Value("${mailmerge.oauth.expiry-skew:300s}") Duration expirySkew) {
        this.credentialRepository = credentialRepository;
        this.oAuthTokenService = oAuthTokenService;
        this.consentFlow = consentFlow;
        this.clock = clock;
        this.expirySkew = expirySkew;
    }

    /**
     * Run-start setup: loads the stored credential or, when there is none, runs the blocking
     * consent flow. Then behaves like {@link #current()}.
     */
    public synchronized Credential acquire() {
        failIfFatal();
        if (state == State.UNINITIALIZED) {
            Optional<Credential> stored = credentialRepository.load();
            if (stored.isPresent()) {
                credential = stored.get();
            } else {
                log.info("No stored credential; starting the consent flow");
                credential = consent();
                issuedAt = clock.instant();
                credentialRepository.save(credential);
            }
        }
        return current();
    }

    /** The credential to send with, refreshed first when it is about to expire. */
    public synchronized Credential current() {
        failIfFatal();
        if (credential == null) {
            return acquire();
        }
        if (credential.isExpiredAt(clock.instant(), effectiveSkew())) {
            log.info("Access token expired, refreshing");
            refresh();
        }
        if (!credential.canSend()) {
            throw fail(new AuthException("Stored credential lacks the Gmail send scope " + Credential.GMAIL_SEND_SCOPE
                    + "; delete the token store and authorize again"));
        }
        state = State.VALID;
        return credential;
    }

    /** Called after the API rejected the access token: forces one refresh regardless of expiry. */
    public synchronized Credential revalidate() {
        failIfFatal();
        if (credential == null) {
            return acquire();
        }
        log.info("Re-validating credential after the API rejected the access token");
        refresh();
        return current();
    }

    synchronized State getState() {
        return state;
    }

    private Credential consent() {
        try {
            Credential granted = consentFlow.authorize();
            if (!granted.canSend()) {
                throw new AuthException("Consent did not grant the Gmail send scope");
            }
            return granted;
        } catch (AuthException e) {
            throw fail(e);
        }
    }

    private void refresh() {
        try {
            Credential refreshed = oAuthTokenService.refreshAccessToken(credential);
            credentialRepository.save(refreshed);
            credential = refreshed;
            issuedAt = clock.instant();
        } catch (AuthException e) {
            throw fail(e);
        }
    }

    /**
     * The configured skew, capped at half the lifetime of a token issued in this run, so a
     * token shorter-lived than the skew is not refreshed again on every call.
     */
    private Duration effectiveSkew() {
        if (issuedAt == null || credential.getExpiry() == null) {
            return expirySkew;
        }
        Duration halfLife = Duration.between(issuedAt, credential.getExpiry()).dividedBy(2);
        if (halfLife.isNegative()) {
            return Duration.ZERO;
        }
        return halfLife.compareTo(expirySkew) < 0 ? halfLife : expirySkew;
    }

    private void failIfFatal() {
        if (state == State.FATAL) {
            throw fatalError;
        }
    }

    private AuthException fail(AuthException e) {
        log.error("Credential unusable: {}", e.getMessage());
        state = State.FATAL;
        fatalError = e;
        return e;
    }
}
