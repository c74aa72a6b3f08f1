package io.wafgate.core.error;

/**
 * Permanent failure to build the inspection engine. Recorded once by
 * {@code WafLifecycle}; every request after it is answered with a 500 and
 * construction is never attempted again.
 */
public class InitializationException extends WafException {

    private static final long serialVersionUID = 1L;

    public InitializationException(String message) {
        super(message, Scope.PROCESS);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause, Scope.PROCESS);
    }
}
