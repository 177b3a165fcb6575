package com.example.mailmerge.runner;

import com.example.mailmerge.exception.AuthException;
import com.example.mailmerge.helper.TemplateSourceHelper;
import com.example.mailmerge.model.MergeRequest;
import com.example.mailmerge.model.RunSummary;
import com.example.mailmerge.model.SendResult;
import com.example.mailmerge.service.MailMergePipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MailMergeRunnerTest {
    private static final String[] ARGS = {"--csv", "people.csv", "--subject", "Hi {firstname}", "--html", "<p>x</p>", "--dry_run"};

    @Mock
    private MailMergePipeline pipeline;

    @Mock
    private ConfigurableApplicationContext context;

    private MailMergeRunner runner;

    @BeforeEach
    void setup() {
        runner = new MailMergeRunner(pipeline, new TemplateSourceHelper(), context);
    }

    @Test
    void givenRunWithFailedRecipients_whenExecuting_thenExitCodeIsZero() {
        when(pipeline.run(any())).thenReturn(new RunSummary(List.of(
                SendResult.previewed("a@x.com", "Hi Alice"),
                SendResult.failed("b@y.com", "Hi Bob", "attachment not found: /missing.pdf")), false));

        assertThat(runner.execute(ARGS)).isEqualTo(MailMergeRunner.EXIT_OK);

        ArgumentCaptor<MergeRequest> captor = ArgumentCaptor.forClass(MergeRequest.class);
        verify(pipeline).run(captor.capture());
        assertThat(captor.getValue().isDryRun()).isTrue();
    }

    @Test
    void givenCancelledRun_whenExecuting_thenExitCodeIsTwo() {
        when(pipeline.run(any())).thenReturn(new RunSummary(List.of(), true));

        assertThat(runner.execute(ARGS)).isEqualTo(MailMergeRunner.EXIT_CANCELLED);
    }

    @Test
    void givenAuthError_whenExecuting_thenExitCodeIsOne() {
        when(pipeline.run(any())).thenThrow(new AuthException("invalid_grant"));

        assertThat(runner.execute(ARGS)).isEqualTo(MailMergeRunner.EXIT_FATAL);
    }

    @Test
    void givenMissingOptions_whenExecuting_thenExitCodeIsOneWithoutRunning() {
        assertThat(runner.execute()).isEqualTo(MailMergeRunner.EXIT_FATAL);
        verifyNoInteractions(pipeline);
    }

    @Test
    void givenRunInProgress_whenShuttingDown_thenRunIsCancelledAndContextClosedAfterItFinishes() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean cancelRequested = new AtomicBoolean();
        doAnswer(inv -> {
            cancelRequested.set(true);
            return null;
        }).when(pipeline).cancel();
        when(pipeline.run(any())).thenAnswer(inv -> {
            started.countDown();
            while (!cancelRequested.get()) {
                Thread.sleep(10);
            }
            return new RunSummary(List.of(SendResult.sent("a@x.com", "Hi Alice", "id-1")), true);
        });
        Thread main = new Thread(() -> runner.run(new DefaultApplicationArguments(ARGS)), "run");
        main.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        int status = runner.stopRun();

        main.join(5000);
        assertThat(main.isAlive()).isFalse();
        assertThat(status).isEqualTo(MailMergeRunner.EXIT_CANCELLED);
        assertThat(runner.getExitCode()).isEqualTo(MailMergeRunner.EXIT_CANCELLED);
        InOrder order = inOrder(pipeline, context);
        order.verify(pipeline).run(any());
        order.verify(pipeline).cancel();
        order.verify(context).close();
    }

    @Test
    void givenFinishedRun_whenShuttingDown_thenNothingIsCancelledOrClosed() {
        when(pipeline.run(any())).thenReturn(new RunSummary(List.of(), false));
        runner.run(new DefaultApplicationArguments(ARGS));

        assertThat(runner.stopRun()).isEqualTo(MailMergeRunner.NOT_RUNNING);
        verify(pipeline, never()).cancel();
        verify(context, never()).close();
    }
}
