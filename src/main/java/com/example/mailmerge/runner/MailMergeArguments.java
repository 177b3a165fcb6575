package com.example.mailmerge.runner;

import com.example.mailmerge.exception.ConfigException;
import com.example.mailmerge.helper.TemplateSourceHelper;
import com.example.mailmerge.model.MailTemplate;
import com.example.mailmerge.model.MergeRequest;
import com.example.mailmerge.service.RecipientLoader;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import lombok.Builder;
import lombok.Value;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Command line contract:
 * <pre>
 * --csv &lt;path&gt; --subject &lt;text|@file&gt; --html &lt;text|@file&gt;
 * [--text &lt;text|@file&gt;] [--sender &lt;address&gt;] [--attach &lt;p1,p2&gt;] [--limit N] [--dry_run]
 * </pre>
 * Values may follow the option or be joined with {@code =}. Dotted options such as
 * {@code --logging.level.root=debug} belong to Spring and are skipped.
 */
@Value
@Builder
public class MailMergeArguments {
    private static final Set<String> VALUE_OPTIONS = Set.of("csv", "subject", "html", "text", "sender", "attach", "limit");
    private static final String DRY_RUN = "dry_run";

    String csv;
    String subject;
    String html;
    String text;
    String sender;
    String attach;
    String limit;
    boolean dryRun;

    public static MailMergeArguments parse(String... args) {
        MailMergeArgumentsBuilder builder = builder();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new ConfigException("Unexpected argument '" + arg + "'");
            }
            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (name.contains(".")) {
                continue;
            }
            if (DRY_RUN.equals(name)) {
                builder.dryRun(value == null || Boolean.parseBoolean(value));
                continue;
            }
            if (!VALUE_OPTIONS.contains(name)) {
                throw new ConfigException("Unknown option --" + name);
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new ConfigException("Option --" + name + " requires a value");
                }
                value = args[++i];
            }
            set(builder, name, value);
        }
        return builder.build();
    }

    public MergeRequest toRequest(TemplateSourceHelper templateSources) {
        require("csv", csv);
        require("subject", subject);
        require("html", html);

        MergeRequest.MergeRequestBuilder request = MergeRequest.builder()
                .csvPath(toPath(csv))
                .template(MailTemplate.builder()
                        .subjectTemplate(templateSources.read(subject))
                        .htmlTemplate(templateSources.read(html))
                        .textTemplate(text == null ? null : templateSources.read(text))
                        .build())
                .commonAttachments(RecipientLoader.splitList(attach))
                .limit(parseLimit())
                .dryRun(dryRun);
        if (sender != null && !sender.isBlank()) {
            request.sender(validSender(sender.trim()));
        }
        return request.build();
    }

    private static String validSender(String value) {
        if (MergeRequest.AUTHORIZED_ACCOUNT.equals(value)) {
            return value;
        }
        try {
            new InternetAddress(value, true);
            return value;
        } catch (AddressException e) {
            throw new ConfigException("Invalid --sender address '" + value + "'", e);
        }
    }

    private int parseLimit() {
        if (limit == null || limit.isBlank()) {
            return 0;
        }
        try {
            int parsed = Integer.parseInt(limit.trim());
            if (parsed < 0) {
                throw new ConfigException("--limit must not be negative");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigException("--limit must be a number, got '" + limit + "'");
        }
    }

    private static Path toPath(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid --csv path '" + value + "'", e);
        }
    }

    private static void require(String name, String value) {
        if (value == null || value.isEmpty()) {
            throw new ConfigException("Missing required option --" + name);
        }
    }

    private static void set(MailMergeArgumentsBuilder builder, String name, String value) {
        switch (name) {
            case "csv":
                builder.csv(value);
                break;
            case "subject":
                builder.subject(value);
                break;
            case "html":
                builder.html(value);
                break;
            case "text":
                builder.text(value);
                break;
            case "sender":
                builder.sender(value);
                break;
            case "attach":
                builder.attach(value);
                break;
            case "limit":
                builder.limit(value);
                break;
            default:
                throw new ConfigException("Unknown option --" + name);
        }
    }
}
