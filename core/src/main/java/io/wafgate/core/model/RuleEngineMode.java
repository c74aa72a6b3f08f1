package io.wafgate.core.model;

/**
 * Operating mode of the rule engine.
 *
 * <ul>
 * <li>{@link #ON}: rules are evaluated and disruptive actions enforced</li>
 * <li>{@link #DETECTION_ONLY}: rules are evaluated and logged, nothing is
 * blocked</li>
 * <li>{@link #OFF}: no evaluation; every request passes</li>
 * </ul>
 */
public enum RuleEngineMode {
    ON("On"),
    DETECTION_ONLY("DetectionOnly"),
    OFF("Off");

    private final String directive;

    RuleEngineMode(String directive) {
        this.directive = directive;
    }

    /** The mode as written in configuration, e.g. {@code DetectionOnly}. */
    public String directive() {
        return directive;
    }

    /**
     * Parses a configuration value (case-insensitive).
     *
     * @throws IllegalArgumentException for anything other than On, Off or
     *                                  DetectionOnly
     */
    public static RuleEngineMode parse(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (RuleEngineMode mode : values()) {
                if (mode.directive.equalsIgnoreCase(trimmed)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException(
                "Invalid rule engine mode '" + value + "': expected On, Off or DetectionOnly");
    }
}
