package com.example.mailmerge.service;

import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.exception.RecipientException;
import com.example.mailmerge.exception.TransportAuthenticationException;
import com.example.mailmerge.model.Credential;
import com.example.mailmerge.model.MergeRequest;
import com.example.mailmerge.model.RecipientRecord;
import com.example.mailmerge.model.RenderedMessage;
import com.example.mailmerge.model.RenderedTemplate;
import com.example.mailmerge.model.RunSummary;
import com.example.mailmerge.model.SendResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one run: load, then render, build and dispatch each recipient strictly in order.
 * <p>
 * Only {@link com.example.mailmerge.exception.ConfigException} (while loading) and
 * {@link AuthException} leave {@link #run}; every {@link RecipientException} becomes that
 * recipient's failed {@link SendResult}.
 */
@Service
@Slf4j
public class MailMergePipeline {

    private final RecipientLoader recipientLoader;
    private final TemplateRenderer templateRenderer;
    private final MessageBuilder messageBuilder;
    private final CredentialManager credentialManager;
    private final MailTransport liveTransport;
    private final MailTransport previewTransport;
    private final Duration sendInterval;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    @Autowired
    public MailMergePipeline(RecipientLoader recipientLoader,
                             TemplateRenderer templateRenderer,
                             MessageBuilder messageBuilder,
                             CredentialManager credentialManager,
                             GmailMailTransport liveTransport,
                             PreviewMailTransport previewTransport,
                             @Value("${mailmerge.transport.send-interval:200ms}") Duration sendInterval) {
        this(recipientLoader, templateRenderer, messageBuilder, credentialManager,
                (MailTransport) liveTransport, previewTransport, sendInterval);
    }

    MailMergePipeline(RecipientLoader recipientLoader,
                      TemplateRenderer templateRenderer,
                      MessageBuilder messageBuilder,
                      CredentialManager credentialManager,
                      MailTransport liveTransport,
                      MailTransport previewTransport,
                      Duration sendInterval) {
        this.recipientLoader = recipientLoader;
        this.templateRenderer = templateRenderer;
        this.messageBuilder = messageBuilder;
        this.credentialManager = credentialManager;
        this.liveTransport = liveTransport;
        this.previewTransport = previewTransport;
        this.sendInterval = sendInterval;
    }

    public RunSummary run(MergeRequest request) {
        List<RecipientRecord> recipients = recipientLoader.load(request.getCsvPath());
        if (request.getLimit() > 0 && recipients.size() > request.getLimit()) {
            log.info("Limiting run to the first {} of {} recipient(s)", request.getLimit(), recipients.size());
            recipients = recipients.subList(0, request.getLimit());
        }

        boolean dryRun = request.isDryRun();
        if (!dryRun) {
            credentialManager.acquire();
        }
        MailTransport transport = dryRun ? previewTransport : liveTransport;

        List<SendResult> results = new ArrayList<>(recipients.size());
        for (int i = 0; i < recipients.size(); i++) {
            if (i > 0 && !dryRun) {
                pause();
            }
            if (isCancelled()) {
                log.warn("Run cancelled after {} of {} recipient(s)", results.size(), recipients.size());
                return new RunSummary(results, true);
            }
            results.add(process(recipients.get(i), request, transport, dryRun));
        }
        return new RunSummary(results, isCancelled());
    }

    /** Stops the loop before the next recipient. Results produced so far are kept. */
    public void cancel() {
        cancelled.set(true);
    }

    SendResult process(RecipientRecord recipient, MergeRequest request, MailTransport transport, boolean dryRun) {
        String subject = null;
        try {
            RenderedTemplate rendered = templateRenderer.render(request.getTemplate(), recipient);
            subject = rendered.getSubject();
            RenderedMessage message = messageBuilder.build(recipient, rendered, request);
            return dispatch(message, transport, dryRun);
        } catch (RecipientException e) {
            log.warn("Row {} ({}) failed: {}", recipient.getRowNumber(), recipient.getEmail(), e.getMessage());
            return SendResult.failed(recipient.getEmail(), subject, e.getMessage());
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                log.warn("Interrupted while delivering to {}", recipient.getEmail());
                cancel();
                Thread.currentThread().interrupt();
                return SendResult.failed(recipient.getEmail(), subject, "interrupted before delivery was confirmed");
            }
            throw e;
        }
    }

    private SendResult dispatch(RenderedMessage message, MailTransport transport, boolean dryRun) {
        Credential credential = dryRun ? null : credentialManager.current();
        try {
            return transport.send(message, credential).block();
        } catch (TransportAuthenticationException e) {
            log.warn("Gmail rejected the access token: {}", e.getMessage());
            Credential renewed = credentialManager.revalidate();
            try {
                return transport.send(message, renewed).block();
            } catch (TransportAuthenticationException again) {
                throw new AuthException("Gmail rejected a freshly refreshed access token", again);
            }
        }
    }

    private void pause() {
        if (sendInterval.isZero() || sendInterval.isNegative()) {
            return;
        }
        try {
            Thread.sleep(sendInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }
}
