package com.example.mailmerge.service;

import com.example.mailmerge.exception.ValidationException;
import com.example.mailmerge.model.AttachmentPayload;
import com.example.mailmerge.model.RenderedMessage;
import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.util.ByteArrayDataSource;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.Base64;
import java.util.List;
import java.util.Properties;

/**
 * RFC 822 serialization of a {@link RenderedMessage}.
 * <ul>
 *     <li>no attachments: a single {@code text/html} part, or {@code multipart/alternative}
 *     when a plain-text body exists</li>
 *     <li>attachments: {@code multipart/mixed} holding the body followed by one part per file</li>
 * </ul>
 */
@Component
public class MimeMessageFactory {
    private static final String UTF_8 = "UTF-8";

    private final Session session = Session.getInstance(new Properties());

    public MimeMessage create(RenderedMessage message) throws MessagingException {
        MimeMessage email = new MimeMessage(session);
        if (message.getFrom() != null) {
            email.setFrom(new InternetAddress(message.getFrom()));
        }
        addRecipients(email, Message.RecipientType.TO, message.getTo());
        addRecipients(email, Message.RecipientType.CC, message.getCc());
        addRecipients(email, Message.RecipientType.BCC, message.getBcc());
        email.setSubject(message.getSubject(), UTF_8);

        if (!message.hasAttachments()) {
            if (message.hasTextBody()) {
                email.setContent(alternative(message));
            } else {
                email.setText(message.getHtmlBody(), UTF_8, "html");
            }
        } else {
            MimeMultipart mixed = new MimeMultipart("mixed");
            mixed.addBodyPart(bodyPart(message));
            for (AttachmentPayload attachment : message.getAttachmentPayloads()) {
                mixed.addBodyPart(attachmentPart(attachment));
            }
            email.setContent(mixed);
        }
        email.saveChanges();
        return email;
    }

    public byte[] toRawBytes(RenderedMessage message) {
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            create(message).writeTo(buffer);
            return buffer.toByteArray();
        } catch (MessagingException | IOException e) {
            throw new ValidationException("Failed to encode message: " + e.getMessage(), e);
        }
    }

    /** The Gmail {@code raw} field. */
    public String toRawBase64Url(RenderedMessage message) {
        return Base64.getUrlEncoder().encodeToString(toRawBytes(message));
    }

    private static void addRecipients(MimeMessage email, Message.RecipientType type, List<String> addresses)
            throws MessagingException {
        if (!addresses.isEmpty()) {
            email.addRecipients(type, InternetAddress.parse(String.join(",", addresses)));
        }
    }

    private static MimeBodyPart bodyPart(RenderedMessage message) throws MessagingException {
        MimeBodyPart body = new MimeBodyPart();
        if (message.hasTextBody()) {
            body.setContent(alternative(message));
        } else {
            body.setText(message.getHtmlBody(), UTF_8, "html");
        }
        return body;
    }

    private static MimeMultipart alternative(RenderedMessage message) throws MessagingException {
        MimeMultipart alternative = new MimeMultipart("alternative");
        MimeBodyPart textPart = new MimeBodyPart();
        textPart.setText(message.getTextBody(), UTF_8, "plain");
        alternative.addBodyPart(textPart);
        MimeBodyPart htmlPart = new MimeBodyPart();
        htmlPart.setText(message.getHtmlBody(), UTF_8, "html");
        alternative.addBodyPart(htmlPart);
        return alternative;
    }

    private static MimeBodyPart attachmentPart(AttachmentPayload attachment) throws MessagingException {
        MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(new ByteArrayDataSource(attachment.getContent(), attachment.getMimeType())));
        try {
            part.setFileName(MimeUtility.encodeText(attachment.getFilename(), UTF_8, null));
        } catch (UnsupportedEncodingException e) {
            part.setFileName(attachment.getFilename());
        }
        part.setDisposition(Part.ATTACHMENT);
        return part;
    }
}
