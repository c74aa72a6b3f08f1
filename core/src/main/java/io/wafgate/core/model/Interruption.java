package io.wafgate.core.model;

import java.util.Objects;

/**
 * An engine's decision to stop processing a request. Produced by a phase,
 * consumed once when the response is built.
 *
 * @param action the disruptive action, e.g. {@code deny}, {@code drop},
 *               {@code redirect}; vocabulary is engine-defined
 * @param status explicit HTTP status requested by the rule, {@code 0} if none
 * @param ruleId id of the rule that interrupted, {@code 0} if unknown
 * @param data   free-form detail for logging (redirect target, message);
 *               never sent to the client
 */
public record Interruption(String action, int status, int ruleId, String data) {

    public static final String DENY = "deny";

    public Interruption {
        Objects.requireNonNull(action, "action must not be null");
        data = data != null ? data : "";
    }

    /** A {@code deny} interruption. */
    public static Interruption deny(int ruleId, int status) {
        return new Interruption(DENY, status, ruleId, "");
    }

    /** True if the action is {@code deny}. */
    public boolean isDeny() {
        return DENY.equals(action);
    }

    /** True if the rule asked for a specific status code. */
    public boolean hasStatus() {
        return status != 0;
    }
}
