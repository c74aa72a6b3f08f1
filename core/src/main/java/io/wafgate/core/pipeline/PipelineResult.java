package io.wafgate.core.pipeline;

import io.wafgate.core.model.Interruption;
import java.io.InputStream;
import java.util.Objects;

/**
 * Outcome of {@link TransactionPipeline#run}: either the request may proceed
 * (with its body, possibly rebuilt) or a phase interrupted it.
 */
public final class PipelineResult {

    /** Inspection phases, in the order they run. */
    public enum Phase {
        CONNECTION,
        URI,
        REQUEST_HEADERS,
        REQUEST_BODY
    }

    private final Interruption interruption;
    private final Phase phase;
    private final InputStream body;

    private PipelineResult(Interruption interruption, Phase phase, InputStream body) {
        this.interruption = interruption;
        this.phase = phase;
        this.body = body;
    }

    /** The request may proceed; {@code body} is what downstream should read, or {@code null}. */
    public static PipelineResult allowed(InputStream body) {
        return new PipelineResult(null, null, body);
    }

    /** The request was stopped by {@code interruption} during {@code phase}. */
    public static PipelineResult interrupted(Interruption interruption, Phase phase) {
        return new PipelineResult(
                Objects.requireNonNull(interruption, "interruption must not be null"),
                Objects.requireNonNull(phase, "phase must not be null"),
                null);
    }

    public boolean isInterrupted() {
        return interruption != null;
    }

    /** The interruption, or {@code null} when allowed. */
    public Interruption interruption() {
        return interruption;
    }

    /** The interrupting phase, or {@code null} when allowed. */
    public Phase phase() {
        return phase;
    }

    /** Body for downstream handlers, or {@code null} (interrupted, or no body). */
    public InputStream body() {
        return body;
    }

    @Override
    public String toString() {
        return isInterrupted()
                ? "PipelineResult[interrupted in " + phase + ": " + interruption + "]"
                : "PipelineResult[allowed]";
    }
}
