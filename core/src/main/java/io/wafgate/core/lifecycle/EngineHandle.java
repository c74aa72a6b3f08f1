package io.wafgate.core.lifecycle;

import io.wafgate.core.spi.ContextAwareInspectionEngine;
import io.wafgate.core.spi.InspectionEngine;
import io.wafgate.core.spi.Transaction;
import io.wafgate.core.spi.TransactionOptions;
import java.util.Objects;
import java.util.function.Function;

/**
 * The built engine plus the way transactions are created from it. The
 * capability check happens once, in {@link #of(InspectionEngine)}, never per
 * request.
 *
 * @param engine       the engine
 * @param transactions creates a transaction for one request
 * @param contextAware whether the engine receives the request options
 */
public record EngineHandle(
        InspectionEngine engine, Function<TransactionOptions, Transaction> transactions, boolean contextAware) {

    public EngineHandle {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(transactions, "transactions must not be null");
    }

    static EngineHandle of(InspectionEngine engine) {
        if (engine instanceof ContextAwareInspectionEngine) {
            ContextAwareInspectionEngine aware = (ContextAwareInspectionEngine) engine;
            return new EngineHandle(engine, aware::newTransaction, true);
        }
        return new EngineHandle(engine, options -> engine.newTransaction(), false);
    }

    /** Starts a transaction; {@code options} are ignored by engines that are not context-aware. */
    public Transaction newTransaction(TransactionOptions options) {
        Transaction tx = transactions.apply(options);
        if (tx == null) {
            throw new IllegalStateException("Engine returned no transaction");
        }
        return tx;
    }
}
