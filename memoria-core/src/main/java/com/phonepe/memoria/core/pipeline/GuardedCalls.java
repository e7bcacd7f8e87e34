package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.capability.CapabilityResponse;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import dev.failsafe.Failsafe;
import dev.failsafe.Timeout;
import dev.failsafe.TimeoutExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Puts a time limit on capability, store and vector index calls made by steps and classifies what comes out of
 * them. A timeout is reported as a transient error so that the runner retries the step.
 */
@Slf4j
public class GuardedCalls {
    private final Duration capabilityTimeout;
    private final Duration storeTimeout;

    public GuardedCalls(Duration capabilityTimeout, Duration storeTimeout) {
        this.capabilityTimeout = capabilityTimeout;
        this.storeTimeout = storeTimeout;
    }

    /**
     * Call a capability and unwrap its response
     *
     * @throws MemoriaException with the error type reported by the capability, or a transient error on timeout
     */
    public <T> T capability(String operation, Supplier<CapabilityResponse<T>> call) {
        final CapabilityResponse<T> response;
        try {
            response = Failsafe.with(Timeout.<CapabilityResponse<T>>builder(capabilityTimeout)
                                             .withInterrupt()
                                             .build())
                    .get(call::get);
        }
        catch (TimeoutExceededException e) {
            log.warn("Capability call {} timed out after {}", operation, capabilityTimeout);
            throw MemoriaException.of(ErrorType.TRANSIENT_CAPABILITY_ERROR,
                                      operation + " timed out after " + capabilityTimeout);
        }
        catch (MemoriaException e) {
            throw e;
        }
        catch (RuntimeException e) {
            log.error("Capability call {} failed: {}", operation, e.getMessage());
            throw MemoriaException.wrap(ErrorType.CAPABILITY_FAILURE, e);
        }
        if (response == null) {
            throw MemoriaException.of(ErrorType.CAPABILITY_FAILURE, operation + " returned nothing");
        }
        if (!response.isSuccess()) {
            log.warn("Capability call {} reported {}: {}",
                     operation, response.getError().getErrorType(), response.getError().getMessage());
        }
        return response.orThrow();
    }

    /**
     * Call a metadata store or vector index
     */
    public <T> T store(String operation, Supplier<T> call) {
        try {
            return Failsafe.with(Timeout.<T>builder(storeTimeout).withInterrupt().build())
                    .get(call::get);
        }
        catch (TimeoutExceededException e) {
            log.warn("Store call {} timed out after {}", operation, storeTimeout);
            throw MemoriaException.of(ErrorType.TRANSIENT_STORE_ERROR, operation + " timed out after " + storeTimeout);
        }
        catch (MemoriaException e) {
            throw e;
        }
        catch (RuntimeException e) {
            log.error("Store call {} failed: {}", operation, e.getMessage());
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    public void write(String operation, Runnable call) {
        store(operation, () -> {
            call.run();
            return Boolean.TRUE;
        });
    }
}
