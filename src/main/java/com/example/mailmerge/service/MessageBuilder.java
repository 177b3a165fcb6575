package com.example.mailmerge.service;

import com.example.mailmerge.exception.AttachmentException;
import com.example.mailmerge.exception.ValidationException;
import com.example.mailmerge.helper.MimeTypeHelper;
import com.example.mailmerge.model.AttachmentPayload;
import com.example.mailmerge.model.MergeRequest;
import com.example.mailmerge.model.RecipientRecord;
import com.example.mailmerge.model.RenderedMessage;
import com.example.mailmerge.model.RenderedTemplate;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a rendered template and its recipient into a {@link RenderedMessage}: resolves the
 * address lists and loads every attachment into memory. Any attachment problem fails the
 * whole recipient.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageBuilder {
    private final MimeTypeHelper mimeTypeHelper;

    public RenderedMessage build(RecipientRecord recipient, RenderedTemplate rendered, MergeRequest request) {
        RenderedMessage.RenderedMessageBuilder message = RenderedMessage.builder()
                .toAddress(validAddress(recipient.getEmail()))
                .cc(parseAddressList(recipient.getCc()))
                .bcc(parseAddressList(recipient.getBcc()))
                .subject(rendered.getSubject())
                .htmlBody(rendered.getHtmlBody())
                .textBody(rendered.getTextBody());

        String sender = request.getSender();
        if (sender != null && !sender.isBlank() && !MergeRequest.AUTHORIZED_ACCOUNT.equals(sender)) {
            message.from(validAddress(sender));
        }

        List<String> paths = new ArrayList<>(request.getCommonAttachments());
        paths.addAll(recipient.getAttachments());
        for (String path : paths) {
            message.attachmentPayload(loadAttachment(path));
        }
        return message.build();
    }

    /** Comma separated list to trimmed, validated addresses. A blank list is empty, not an error. */
    public List<String> parseAddressList(String raw) {
        List<String> addresses = new ArrayList<>();
        for (String address : RecipientLoader.splitList(raw)) {
            addresses.add(validAddress(address));
        }
        return addresses;
    }

    AttachmentPayload loadAttachment(String rawPath) {
        Path path = resolve(rawPath);
        if (!Files.exists(path)) {
            throw AttachmentException.notFound(rawPath);
        }
        if (!Files.isRegularFile(path)) {
            throw new AttachmentException(rawPath, "attachment is not a regular file");
        }
        if (!Files.isReadable(path)) {
            throw new AttachmentException(rawPath, "attachment is not readable");
        }
        try {
            byte[] content = Files.readAllBytes(path);
            String mimeType = mimeTypeHelper.contentType(path);
            log.debug("Attached {} ({}, {} bytes)", path, mimeType, content.length);
            return new AttachmentPayload(path.getFileName().toString(), mimeType, content);
        } catch (IOException e) {
            throw new AttachmentException(rawPath, "failed to read attachment", e);
        }
    }

    private static Path resolve(String rawPath) {
        String expanded = rawPath;
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = System.getProperty("user.home") + expanded.substring(1);
        }
        try {
            return Path.of(expanded).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new AttachmentException(rawPath, "invalid attachment path", e);
        }
    }

    private static String validAddress(String address) {
        try {
            new InternetAddress(address, true);
            return address;
        } catch (AddressException e) {
            throw new ValidationException("invalid address: " + address, e);
        }
    }
}
