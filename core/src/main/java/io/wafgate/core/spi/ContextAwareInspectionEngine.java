package io.wafgate.core.spi;

/**
 * Optional capability: an engine that accepts per-request options when a
 * transaction is created, so it can tag its logs with the request id and stop
 * early when the request is cancelled.
 *
 * <p>
 * Whether an engine has this capability is checked once, at initialization.
 */
public interface ContextAwareInspectionEngine extends InspectionEngine {

    /** Starts a transaction bound to the given request options. */
    Transaction newTransaction(TransactionOptions options);
}
