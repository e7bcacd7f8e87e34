package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller owned flag to stop a run. Runners check it before every step, never in the middle of one.
 */
public class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String nextStepId) {
        if (isCancelled()) {
            throw MemoriaException.of(ErrorType.CANCELLED, nextStepId);
        }
    }
}
