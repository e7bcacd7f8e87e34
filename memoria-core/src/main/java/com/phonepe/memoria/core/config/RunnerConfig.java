package com.phonepe.memoria.core.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Execution settings shared by both runners
 */
@Value
@Builder
@Jacksonized
public class RunnerConfig {
    public static final RunnerConfig DEFAULT = RunnerConfig.builder().build();

    @Builder.Default
    RunnerMode mode = RunnerMode.INLINE;

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration retryDelay = Duration.ofMillis(200);

    @Builder.Default
    Duration maxRetryDelay = Duration.ofSeconds(2);

    /**
     * Per step limit, durable runner only
     */
    @Builder.Default
    Duration stepTimeout = Duration.ofSeconds(60);

    @Builder.Default
    Duration capabilityTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration storeTimeout = Duration.ofSeconds(10);

    /**
     * Max steps of one run executing at the same time, durable runner only
     */
    @Builder.Default
    int maxParallelSteps = 4;
}
