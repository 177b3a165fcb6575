package com.example.mailmerge.service;

import com.example.mailmerge.exception.ValidationException;
import com.example.mailmerge.model.MailTemplate;
import com.example.mailmerge.model.RecipientRecord;
import com.example.mailmerge.model.RenderedTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flat {@code {key}} substitution. Only identifier-shaped keys are placeholders, so CSS such as
 * {@code p {color: red}} in an HTML template passes through untouched.
 */
@Service
public class TemplateRenderer {
    static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

    public RenderedTemplate render(MailTemplate template, RecipientRecord recipient) {
        Map<String, String> values = recipient.getFields();
        String subject = render(template.getSubjectTemplate(), values);
        String html = render(template.getHtmlTemplate(), values);
        String text = template.hasText() ? render(template.getTextTemplate(), values) : null;
        return new RenderedTemplate(subject, html, text);
    }

    public String render(String template, Map<String, String> values) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String key = matcher.group(1);
            String value = values.get(key);
            if (value == null) {
                throw ValidationException.unresolvedPlaceholder(key);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
