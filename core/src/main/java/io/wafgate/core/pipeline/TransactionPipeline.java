package io.wafgate.core.pipeline;

import io.wafgate.core.error.EngineIOException;
import io.wafgate.core.model.Endpoint;
import io.wafgate.core.model.Interruption;
import io.wafgate.core.model.RequestView;
import io.wafgate.core.pipeline.PipelineResult.Phase;
import io.wafgate.core.spi.BodyReadResult;
import io.wafgate.core.spi.Transaction;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one request through the inspection phases: connection, URI, request
 * headers, request body. The first interruption ends the run; later phases
 * are not entered.
 *
 * <p>
 * The body phase always runs, since engines evaluate request arguments there.
 * Only body ingestion depends on the transaction accepting a body and the
 * request carrying one.
 *
 * <p>
 * The pipeline does not release the transaction. Callers own it through a
 * {@link TransactionScope}. Stateless and thread-safe.
 */
public final class TransactionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionPipeline.class);

    static final String HOST_HEADER = "Host";
    static final String TRANSFER_ENCODING_HEADER = "Transfer-Encoding";

    /**
     * Runs all phases against {@code tx}.
     *
     * @throws EngineIOException if reading or processing the body fails with an
     *                           I/O error
     */
    public PipelineResult run(Transaction tx, RequestView view) {
        Endpoint remote = view.remote();
        Endpoint local = view.local();
        tx.processConnection(remote.host(), remote.portOrZero(), local.host(), local.portOrZero());

        tx.processUri(view.uri(), view.method(), view.protocol());

        for (Map.Entry<String, List<String>> header : view.headers().entrySet()) {
            for (String value : header.getValue()) {
                tx.addRequestHeader(header.getKey(), value);
            }
        }
        if (!view.host().isEmpty() && !view.hasHeader(HOST_HEADER)) {
            tx.addRequestHeader(HOST_HEADER, view.host());
        }
        if (view.transferEncoding() != null && !view.hasHeader(TRANSFER_ENCODING_HEADER)) {
            tx.addRequestHeader(TRANSFER_ENCODING_HEADER, view.transferEncoding());
        }
        if (!view.host().isEmpty()) {
            tx.setServerName(view.host());
        }

        Optional<Interruption> headers = tx.processRequestHeaders();
        if (headers.isPresent()) {
            return interrupted(headers.get(), Phase.REQUEST_HEADERS, view);
        }

        InputStream downstream = view.body();
        if (tx.isRequestBodyAccessible() && view.hasBody()) {
            PipelineResult ingested = ingestBody(tx, view);
            if (ingested.isInterrupted()) {
                return ingested;
            }
            downstream = ingested.body();
        }

        Optional<Interruption> body;
        try {
            body = tx.processRequestBody();
        } catch (IOException e) {
            throw new EngineIOException("Failed to process request body", e);
        }
        if (body.isPresent()) {
            return interrupted(body.get(), Phase.REQUEST_BODY, view);
        }
        return PipelineResult.allowed(downstream);
    }

    /** Feeds the body to the engine; an allowed result carries the replay stream. */
    private PipelineResult ingestBody(Transaction tx, RequestView view) {
        BodyCaptureStream capture = new BodyCaptureStream(view.body());
        BodyReadResult read;
        try {
            read = tx.readRequestBodyFrom(capture);
        } catch (IOException e) {
            throw new EngineIOException("Failed to read request body into engine", e);
        }
        if (read.bytesRead() != capture.consumed()) {
            LOG.warn(
                    "Engine reported {} body bytes read but {} were consumed: uri={}",
                    read.bytesRead(),
                    capture.consumed(),
                    view.uri());
        }
        if (read.isInterrupted()) {
            return interrupted(read.interruption(), Phase.REQUEST_BODY, view);
        }

        InputStream replay;
        try {
            replay = capture.replay(tx.requestBodyReader());
        } catch (IOException e) {
            throw new EngineIOException("Failed to read request body into engine", e);
        }
        LOG.debug("Request body ingested: bytes={}, uri={}", capture.consumed(), view.uri());
        return PipelineResult.allowed(replay);
    }

    private static PipelineResult interrupted(Interruption interruption, Phase phase, RequestView view) {
        LOG.info(
                "Request interrupted: phase={}, action={}, rule_id={}, status={}, method={}, uri={}",
                phase,
                interruption.action(),
                interruption.ruleId(),
                interruption.status(),
                view.method(),
                view.uri());
        return PipelineResult.interrupted(interruption, phase);
    }
}
