package io.wafgate.core.error;

/**
 * A configured rule source is missing or unreadable. Starting with a partial
 * rule set is never acceptable, so this aborts initialization.
 */
public final class RuleSourceException extends InitializationException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public RuleSourceException(String message, String source) {
        super(message);
        this.source = source;
    }

    public RuleSourceException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /** The rule source location as configured, or {@code null} for list-level errors. */
    public String source() {
        return source;
    }
}
