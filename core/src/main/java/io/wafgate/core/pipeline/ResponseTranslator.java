package io.wafgate.core.pipeline;

import io.wafgate.core.model.Interruption;

/**
 * Maps an engine interruption to the HTTP status of the rejection response.
 *
 * <ul>
 * <li>{@code deny} with an explicit status: that status</li>
 * <li>{@code deny} without one: 403</li>
 * <li>any other action: the caller's default</li>
 * </ul>
 */
public final class ResponseTranslator {

    public static final int DENY_STATUS = 403;

    private ResponseTranslator() {
        // utility class
    }

    public static int translate(Interruption interruption, int defaultStatus) {
        if (interruption == null || !interruption.isDeny()) {
            return defaultStatus;
        }
        return interruption.hasStatus() ? interruption.status() : DENY_STATUS;
    }
}
