package com.example.mailmerge.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything one run needs, resolved from the command line.
 */
@Value
@Builder
public class MergeRequest {
    public static final String AUTHORIZED_ACCOUNT = "me";

    Path csvPath;
    MailTemplate template;
    @Builder.Default
    String sender = AUTHORIZED_ACCOUNT;
    @Singular
    List<String> commonAttachments;
    /** 0 means no limit. */
    int limit;
    boolean dryRun;
}
