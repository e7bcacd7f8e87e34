package com.phonepe.memoria.core.pipeline;

import com.phonepe.memoria.core.capability.CapabilityResponse;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GuardedCallsTest {
    private final GuardedCalls calls = new GuardedCalls(Duration.ofMillis(200), Duration.ofMillis(200));

    @Test
    void testCapabilityResponsesAreUnwrapped() {
        assertEquals("ok", calls.capability("describe", () -> CapabilityResponse.success("ok")));
        final var failed = assertThrows(MemoriaException.class,
                                        () -> calls.capability("describe",
                                                               () -> CapabilityResponse.failure(
                                                                       ErrorType.TRANSIENT_CAPABILITY_ERROR,
                                                                       "rate limited")));
        assertEquals(ErrorType.TRANSIENT_CAPABILITY_ERROR, failed.getErrorType());
        assertEquals(ErrorType.CAPABILITY_FAILURE,
                     assertThrows(MemoriaException.class,
                                  () -> calls.capability("describe", () -> null)).getErrorType());
    }

    @Test
    void testUnexpectedExceptionsAreClassified() {
        assertEquals(ErrorType.CAPABILITY_FAILURE,
                     assertThrows(MemoriaException.class,
                                  () -> calls.capability("extract", () -> {
                                      throw new IllegalStateException("bad output");
                                  })).getErrorType());
        assertEquals(ErrorType.STORE_FAILURE,
                     assertThrows(MemoriaException.class,
                                  () -> calls.store("list items", () -> {
                                      throw new IllegalStateException("corrupt row");
                                  })).getErrorType());
        assertEquals(ErrorType.NOT_FOUND,
                     assertThrows(MemoriaException.class,
                                  () -> calls.write("put item", () -> {
                                      throw MemoriaException.of(ErrorType.NOT_FOUND, "item");
                                  })).getErrorType());
    }

    @Test
    void testSlowCallsTimeOutAsTransient() {
        assertEquals(ErrorType.TRANSIENT_CAPABILITY_ERROR,
                     assertThrows(MemoriaException.class,
                                  () -> calls.capability("summarize", () -> {
                                      sleep();
                                      return CapabilityResponse.success("late");
                                  })).getErrorType());
        assertEquals(ErrorType.TRANSIENT_STORE_ERROR,
                     assertThrows(MemoriaException.class, () -> calls.store("commit", () -> {
                         sleep();
                         return 1;
                     })).getErrorType());
    }

    private static void sleep() {
        final var deadline = System.nanoTime() + Duration.ofMillis(600).toNanos();
        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(20);
            }
            catch (InterruptedException e) {
                //Interrupted by the timeout, keep running past it
            }
        }
    }
}
