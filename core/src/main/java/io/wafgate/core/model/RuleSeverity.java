package io.wafgate.core.model;

import java.util.Locale;

/** Rule severity levels, most severe first (syslog order). */
public enum RuleSeverity {
    EMERGENCY,
    ALERT,
    CRITICAL,
    ERROR,
    WARNING,
    NOTICE,
    INFO,
    DEBUG;

    /** Lowercase label as it appears in logs, e.g. {@code critical}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
