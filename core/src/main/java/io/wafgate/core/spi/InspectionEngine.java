package io.wafgate.core.spi;

/**
 * A rule-evaluation engine, built once at startup and shared by every request.
 *
 * <p>
 * Implementations must be thread-safe: {@link #newTransaction()} is called
 * concurrently from the container's request threads. Each returned
 * {@link Transaction} is used by a single thread only.
 */
public interface InspectionEngine {

    /** Starts the per-request state for one inbound request. */
    Transaction newTransaction();
}
