package com.phonepe.memoria.core.config;

public enum RunnerMode {
    /**
     * Steps run one after the other on the calling thread
     */
    INLINE,
    /**
     * Steps run with per step retries and timeouts, independent steps in parallel, state checkpointed after
     * every stage
     */
    DURABLE
}
