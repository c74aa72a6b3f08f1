package io.wafgate.core.spi;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Per-request options handed to a {@link ContextAwareInspectionEngine}.
 *
 * @param requestId    correlation id of the request (also in the MDC)
 * @param cancellation returns {@code true} once the request has been cancelled
 */
public record TransactionOptions(String requestId, BooleanSupplier cancellation) {

    public TransactionOptions {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    /** Options whose cancellation probe is the calling thread's interrupt flag. */
    public static TransactionOptions forCurrentThread(String requestId) {
        Thread thread = Thread.currentThread();
        return new TransactionOptions(requestId, thread::isInterrupted);
    }

    /** True if the request has been cancelled. */
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }
}
