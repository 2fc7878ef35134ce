package com.eainde.literature.stage;

import com.eainde.literature.execution.JdbcStageExecutionStore;
import com.eainde.literature.execution.StageExecutionRecord;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.StageStatus;
import com.eainde.literature.thread.MdcAwareExecutor;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a stage body under a timeout and converts its outcome into a status.
 *
 * <p>Every failure, timeout included, becomes {@code "<label> failed: <message>"}.
 * Interruption of the calling worker is the one exception: the body is cancelled
 * and {@link InterruptedException} propagates, leaving the stage status untouched.
 * In both cases the run's {@link StageContext} is abandoned before returning, so a
 * body that ignores interruption can no longer persist anything.</p>
 */
@Log4j2
@Component
public class StageExecutor {

    private final JdbcStageExecutionStore executionStore;
    private final Clock clock;
    private final ExecutorService callExecutor;

    public StageExecutor(JdbcStageExecutionStore executionStore, Clock clock) {
        this.executionStore = executionStore;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.callExecutor = new MdcAwareExecutor(Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stage-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }));
    }

    public StageStatus execute(PipelineStage stage, Document document, Duration timeout) throws InterruptedException {
        String label = stage.stage().label();
        String executionId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        recordStart(StageExecutionRecord.running(executionId, document.id(), stage.stage(), startedAt));

        MDC.put("stage", stage.stage().name());
        StageContext context = StageContext.open();
        Future<StageReport> future = callExecutor.submit(() -> stage.run(document, context));
        try {
            StageReport report = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("{} completed{}{}", label,
                    report.modelUsed() != null ? " with " + report.modelUsed() : "",
                    report.summary() != null ? ": " + report.summary() : "");
            recordSuccess(executionId, report, startedAt);
            return StageStatus.completed();
        } catch (TimeoutException e) {
            context.abandon();
            future.cancel(true);
            return fail(executionId, startedAt, label + " failed: timed out after " + formatTimeout(timeout));
        } catch (ExecutionException e) {
            return fail(executionId, startedAt, label + " failed: " + buildErrorMessage(e.getCause()));
        } catch (InterruptedException e) {
            context.abandon();
            future.cancel(true);
            log.warn("{} cancelled; status left unchanged", label);
            throw e;
        } finally {
            MDC.remove("stage");
        }
    }

    private StageStatus fail(String executionId, Instant startedAt, String message) {
        log.error(message);
        recordFailure(executionId, message, startedAt);
        return StageStatus.failed(message);
    }

    // =========================================================================
    //  Execution ledger (best effort: never changes the stage outcome)
    // =========================================================================

    private void recordStart(StageExecutionRecord record) {
        try {
            executionStore.insertRunning(record);
        } catch (RuntimeException e) {
            log.warn("Failed to persist RUNNING execution record for {}: {}", record.stage(), e.getMessage());
        }
    }

    private void recordSuccess(String executionId, StageReport report, Instant startedAt) {
        try {
            executionStore.markSuccess(executionId, report.modelUsed(), report.attemptLog(), startedAt, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to persist SUCCESS for execution {}: {}", executionId, e.getMessage());
        }
    }

    private void recordFailure(String executionId, String message, Instant startedAt) {
        try {
            executionStore.markFailed(executionId, message, startedAt, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to persist FAILED for execution {}: {}", executionId, e.getMessage());
        }
    }

    static String formatTimeout(Duration timeout) {
        return timeout.toMillis() < 1000 ? timeout.toMillis() + "ms" : timeout.toSeconds() + "s";
    }

    static String buildErrorMessage(Throwable error) {
        if (error == null) return "unknown error";
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        Throwable cause = error.getCause();
        if (cause != null && cause.getMessage() != null && !message.contains(cause.getMessage())) {
            message += " (caused by: " + cause.getMessage() + ")";
        }
        return message;
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }
}
