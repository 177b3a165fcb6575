package com.example.mailmerge.runner;

import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.exception.ConfigException;
import com.example.mailmerge.helper.TemplateSourceHelper;
import com.example.mailmerge.model.MergeRequest;
import com.example.mailmerge.model.RunSummary;
import com.example.mailmerge.model.SendResult;
import com.example.mailmerge.model.SendStatus;
import com.example.mailmerge.service.MailMergePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one merge per process. Exit codes: 0 completed (even with failed recipients),
 * 1 run-fatal error, 2 cancelled.
 * <p>
 * Spring's shutdown hook is disabled in {@code main}. On an interrupt this runner's hook
 * cancels the pipeline, waits for the in-flight recipient and the summary, closes the context
 * and halts with the run's exit code.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailMergeRunner implements ApplicationRunner, ExitCodeGenerator {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_CANCELLED = 2;
    static final int NOT_RUNNING = -1;

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final MailMergePipeline pipeline;
    private final TemplateSourceHelper templateSources;
    private final ConfigurableApplicationContext context;

    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        Thread hook = new Thread(this::onShutdown, "mailmerge-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            exitCode = execute(args.getSourceArgs());
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    int execute(String... args) {
        try {
            MergeRequest request = MailMergeArguments.parse(args).toRequest(templateSources);
            log.info("Starting {} run for {}", request.isDryRun() ? "dry" : "live", request.getCsvPath());
            RunSummary summary = pipeline.run(request);
            report(summary);
            return summary.isCancelled() ? EXIT_CANCELLED : EXIT_OK;
        } catch (ConfigException e) {
            log.error("Run aborted, configuration error: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (AuthException e) {
            log.error("Run aborted, authorization error: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static void report(RunSummary summary) {
        log.info("Done{}. sent={}, previewed={}, failed={}",
                summary.isCancelled() ? " (cancelled)" : "",
                summary.count(SendStatus.SENT),
                summary.count(SendStatus.PREVIEWED),
                summary.count(SendStatus.FAILED));
        for (SendResult failure : summary.getFailures()) {
            log.info("  FAILED {}: {}", failure.getRecipientEmail(), failure.getErrorReason());
        }
    }

    private void onShutdown() {
        int status = stopRun();
        if (status != NOT_RUNNING) {
            // System.exit blocks once shutdown has begun
            Runtime.getRuntime().halt(status);
        }
    }

    /**
     * Cancels a run in progress, waits for it to finish reporting, then closes the context.
     * Returns the exit status, or {@value #NOT_RUNNING} when no run was in progress.
     */
    int stopRun() {
        if (finished.getCount() == 0) {
            return NOT_RUNNING;
        }
        log.warn("Interrupt received, stopping after the current recipient");
        pipeline.cancel();
        int status = EXIT_CANCELLED;
        try {
            if (finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                status = exitCode;
            } else {
                log.warn("Current recipient did not finish within {}s", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        context.close();
        return status;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, keeping shutdown hook");
        }
    }
}
