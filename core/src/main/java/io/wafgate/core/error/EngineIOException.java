package io.wafgate.core.error;

import java.io.IOException;

/**
 * Reading the request body into the engine, or processing the ingested body,
 * failed with an I/O error. Request-scoped: the transaction is still released.
 */
public final class EngineIOException extends WafException {

    private static final long serialVersionUID = 1L;

    public EngineIOException(String message, IOException cause) {
        super(message, cause, Scope.REQUEST);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
