package com.example.mailmerge.service;

import com.example.mailmerge.model.Credential;
import com.example.mailmerge.model.RenderedMessage;
import com.example.mailmerge.model.SendResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Dry-run transport. Serializes exactly what the live transport would submit, so encoding
 * problems surface the same way, then logs a preview instead of sending. Holds no HTTP client.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PreviewMailTransport implements MailTransport {
    static final int PREVIEW_LENGTH = 200;

    private final MimeMessageFactory mimeMessageFactory;

    @Override
    public Mono<SendResult> send(RenderedMessage message, Credential credential) {
        return Mono.fromCallable(() -> {
            byte[] raw = mimeMessageFactory.toRawBytes(message);
            String recipient = String.join(", ", message.getTo());

            StringBuilder preview = new StringBuilder("\n--- DRY RUN ---\n")
                    .append("To: ").append(recipient).append('\n');
            if (!message.getCc().isEmpty()) {
                preview.append("Cc: ").append(String.join(", ", message.getCc())).append('\n');
            }
            if (!message.getBcc().isEmpty()) {
                preview.append("Bcc: ").append(String.join(", ", message.getBcc())).append('\n');
            }
            preview.append("Subject: ").append(message.getSubject()).append('\n')
                    .append("Body preview: ").append(bodyPreview(message)).append('\n');
            message.getAttachmentPayloads().forEach(a ->
                    preview.append("Attachment: ").append(a.getFilename())
                            .append(" (").append(a.getMimeType()).append(", ").append(a.size()).append(" bytes)\n"));
            preview.append("Encoded size: ").append(raw.length).append(" bytes");
            log.info(preview.toString());

            return SendResult.previewed(recipient, message.getSubject());
        });
    }

    static String bodyPreview(RenderedMessage message) {
        String source = message.hasTextBody() ? message.getTextBody() : message.getHtmlBody();
        String flat = source == null ? "" : source.replace("\r", "").replace('\n', ' ');
        return flat.length() > PREVIEW_LENGTH ? flat.substring(0, PREVIEW_LENGTH) + "…" : flat;
    }
}
