package io.wafgate.core.pipeline;

import io.wafgate.core.spi.Transaction;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one {@link Transaction} for the duration of a request and releases it
 * exactly once: {@link Transaction#processLogging()} first, then
 * {@link Transaction#close()}.
 *
 * <p>
 * Meant for try-with-resources. Failures during release are logged and never
 * propagated, so they cannot replace the request's real outcome. Further
 * calls to {@link #close()} are no-ops.
 */
public final class TransactionScope implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionScope.class);

    private final Transaction transaction;
    private final AtomicBoolean released = new AtomicBoolean();

    public TransactionScope(Transaction transaction) {
        this.transaction = Objects.requireNonNull(transaction, "transaction must not be null");
    }

    public Transaction transaction() {
        return transaction;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            transaction.processLogging();
        } catch (RuntimeException e) {
            LOG.warn("Transaction logging failed: {}", e.getMessage(), e);
        }
        try {
            transaction.close();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Transaction close failed: {}", e.getMessage(), e);
        }
    }
}
