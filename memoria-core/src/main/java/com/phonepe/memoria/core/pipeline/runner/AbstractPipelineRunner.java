package com.phonepe.memoria.core.pipeline.runner;

import com.google.common.base.Stopwatch;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaError;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.pipeline.RunContext;
import com.phonepe.memoria.core.pipeline.StepBinding;
import com.phonepe.memoria.core.runlog.StepRecord;
import com.phonepe.memoria.core.runlog.StepStatus;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import dev.failsafe.TimeoutExceededException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Step level plumbing common to the runners: retry policy, error classification and step records
 */
@Slf4j
public abstract class AbstractPipelineRunner implements PipelineRunner {
    protected final RetrySetup retrySetup;

    protected AbstractPipelineRunner(RetrySetup retrySetup) {
        this.retrySetup = Objects.requireNonNullElse(retrySetup, RetrySetup.DEFAULT);
    }

    protected RetryPolicy<Object> buildRetryPolicy(StepBinding binding, boolean backoff) {
        final var builder = RetryPolicy.builder()
                .withMaxAttempts(retrySetup.getStopAfterAttempt())
                .handleIf(this::isRetryable)
                .onRetry(event -> log.warn("Retrying step {} (attempt {}) after: {}",
                                           binding.id(),
                                           event.getAttemptCount() + 1,
                                           event.getLastException() != null
                                           ? event.getLastException().getMessage()
                                           : "unknown error"));
        if (backoff && retrySetup.getMaxDelay().compareTo(retrySetup.getDelayAfterFailedAttempt()) > 0) {
            builder.withBackoff(retrySetup.getDelayAfterFailedAttempt(), retrySetup.getMaxDelay());
        }
        else {
            builder.withDelay(retrySetup.getDelayAfterFailedAttempt());
        }
        return builder.build();
    }

    protected boolean isRetryable(Throwable throwable) {
        final var cause = unwrap(throwable);
        if (cause instanceof MemoriaException memoriaException) {
            return retrySetup.getRetriableErrorTypes().contains(memoriaException.getErrorType());
        }
        return cause instanceof TimeoutExceededException;
    }

    protected StepRecord completed(StepBinding binding, StepStatus status, int attempts, Stopwatch stopwatch) {
        final var finalStatus = Objects.requireNonNullElse(status, StepStatus.COMPLETED);
        log.debug("Step {} finished with {} in {} ms after {} attempt(s)",
                  binding.id(), finalStatus, stopwatch.elapsed(TimeUnit.MILLISECONDS), attempts);
        return StepRecord.builder()
                .stepId(binding.id())
                .status(finalStatus)
                .attempts(attempts)
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                .build();
    }

    protected StepRecord failed(
            RunContext context,
            StepBinding binding,
            Throwable throwable,
            int attempts,
            Stopwatch stopwatch) {
        final var error = toError(throwable)
                .withRunId(context.getRunId())
                .withStepId(binding.id())
                .withScope(context.scopeDescription());
        log.error("Step {} of run {} failed after {} attempt(s): {}",
                  binding.id(), context.getRunId(), attempts, error.getMessage());
        return StepRecord.builder()
                .stepId(binding.id())
                .status(StepStatus.FAILED)
                .attempts(attempts)
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                .error(error)
                .build();
    }

    protected static StepRecord notRun(StepBinding binding) {
        return StepRecord.builder()
                .stepId(binding.id())
                .status(StepStatus.NOT_RUN)
                .build();
    }

    private static MemoriaError toError(Throwable throwable) {
        final var cause = unwrap(throwable);
        if (cause instanceof MemoriaException memoriaException) {
            return memoriaException.getError();
        }
        if (cause instanceof TimeoutExceededException) {
            return MemoriaError.error(ErrorType.TRANSIENT_CAPABILITY_ERROR, "step timed out");
        }
        log.error("Unexpected error in pipeline step", cause);
        return MemoriaError.error(ErrorType.INTERNAL_ERROR, cause);
    }

    private static Throwable unwrap(Throwable throwable) {
        var current = throwable;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof FailsafeException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
