package io.wafgate.core.spi;

import io.wafgate.core.model.Interruption;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Per-request engine state. Driven only by the inspection pipeline, in phase
 * order: connection, URI, headers, body.
 *
 * <p>
 * A transaction is confined to the thread serving its request. It is released
 * exactly once at the end of the request by calling {@link #processLogging()}
 * and then {@link #close()}.
 */
public interface Transaction extends Closeable {

    /** Records both ends of the connection. Ports are {@code 0} when unknown. */
    void processConnection(String clientHost, int clientPort, String serverHost, int serverPort);

    /** Records the request line. */
    void processUri(String uri, String method, String protocol);

    /** Adds one request header; called once per value, in arrival order. */
    void addRequestHeader(String name, String value);

    /** Sets the effective host the request was addressed to. */
    void setServerName(String host);

    /** Evaluates the request-headers phase. */
    Optional<Interruption> processRequestHeaders();

    /** True if the engine wants to see the request body. */
    boolean isRequestBodyAccessible();

    /**
     * Consumes the body from {@code body}, up to the engine's configured limit.
     * The engine must not close the stream.
     */
    BodyReadResult readRequestBodyFrom(InputStream body) throws IOException;

    /**
     * Returns a fresh stream over exactly the bytes consumed by
     * {@link #readRequestBodyFrom(InputStream)}, in the order they were read.
     */
    InputStream requestBodyReader() throws IOException;

    /** Evaluates the request-body phase. */
    Optional<Interruption> processRequestBody() throws IOException;

    /** True if the engine is configured not to evaluate rules at all. */
    boolean isRuleEngineOff();

    /** Flushes the transaction's audit and error logs. */
    void processLogging();
}
