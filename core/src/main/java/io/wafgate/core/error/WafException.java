package io.wafgate.core.error;

/**
 * Abstract base for all waf-gate exceptions. Never thrown directly; use the
 * concrete subclasses.
 *
 * <p>
 * Every exception carries a {@link Scope}: a {@code PROCESS} failure changes
 * the behaviour of every later request (the engine could not be built), a
 * {@code REQUEST} failure ends only the request that raised it.
 */
public abstract class WafException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** How far the failure reaches. */
    public enum Scope {
        PROCESS,
        REQUEST
    }

    private final Scope scope;

    protected WafException(String message, Scope scope) {
        super(message);
        this.scope = scope;
    }

    protected WafException(String message, Throwable cause, Scope scope) {
        super(message, cause);
        this.scope = scope;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The reach of this failure. */
    public Scope scope() {
        return scope;
    }
}
