package io.wafgate.core.spi;

import io.wafgate.core.model.Interruption;

/**
 * Outcome of {@link Transaction#readRequestBodyFrom(java.io.InputStream)}.
 *
 * @param interruption set when body ingestion itself triggered a rule, else
 *                     {@code null}
 * @param bytesRead    number of bytes the engine consumed from the stream
 */
public record BodyReadResult(Interruption interruption, long bytesRead) {

    public static BodyReadResult completed(long bytesRead) {
        return new BodyReadResult(null, bytesRead);
    }

    public static BodyReadResult interrupted(Interruption interruption, long bytesRead) {
        return new BodyReadResult(interruption, bytesRead);
    }

    public boolean isInterrupted() {
        return interruption != null;
    }
}
