package io.wafgate.standalone.filter;

import io.wafgate.core.error.EngineIOException;
import io.wafgate.core.error.RequestConversionException;
import io.wafgate.core.lifecycle.EngineHandle;
import io.wafgate.core.lifecycle.WafLifecycle;
import io.wafgate.core.model.Interruption;
import io.wafgate.core.model.RequestView;
import io.wafgate.core.pipeline.PipelineResult;
import io.wafgate.core.pipeline.ResponseTranslator;
import io.wafgate.core.pipeline.TransactionPipeline;
import io.wafgate.core.pipeline.TransactionScope;
import io.wafgate.core.spi.Transaction;
import io.wafgate.core.spi.TransactionOptions;
import io.wafgate.standalone.adapter.InspectedRequest;
import io.wafgate.standalone.adapter.ServletRequestAdapter;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Servlet filter that inspects every request before the application sees it.
 *
 * <p>
 * Per request:
 * <ol>
 * <li>No engine: 500 with the initialization diagnostic, nothing else
 * runs</li>
 * <li>Convert the request into a {@link RequestView} (500 on failure, no
 * transaction is created)</li>
 * <li>Open a transaction and release it when the request ends, whatever the
 * outcome</li>
 * <li>Rule engine off: pass the request on unchanged</li>
 * <li>Run the {@link TransactionPipeline}. Interrupted: answer with the
 * translated status, {@code X-WAF-Blocked: true} and the block message.
 * Allowed: continue the chain with the body restored</li>
 * </ol>
 *
 * <p>
 * I/O failures and unexpected faults during inspection are logged and
 * answered with a generic 500; they never propagate to the container.
 * Exceptions thrown by downstream handlers are not touched.
 */
public final class WafFilter implements Filter {

    private static final Logger LOG = LoggerFactory.getLogger(WafFilter.class);

    public static final String BLOCKED_HEADER = "X-WAF-Blocked";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_REQUEST_ID = "requestId";

    static final int MAX_REQUEST_ID_LENGTH = 128;
    private static final Pattern REQUEST_ID_PATTERN = Pattern.compile("[A-Za-z0-9._:\\-]+");

    private final WafLifecycle lifecycle;
    private final ServletRequestAdapter adapter;
    private final TransactionPipeline pipeline;
    private final int blockStatus;

    /**
     * @param lifecycle   supplies the engine and the block message
     * @param blockStatus status for interruptions whose action is not
     *                    {@code deny}
     */
    public WafFilter(WafLifecycle lifecycle, int blockStatus) {
        this(lifecycle, new ServletRequestAdapter(), new TransactionPipeline(), blockStatus);
    }

    WafFilter(WafLifecycle lifecycle, ServletRequestAdapter adapter, TransactionPipeline pipeline, int blockStatus) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.adapter = adapter;
        this.pipeline = pipeline;
        this.blockStatus = blockStatus;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest) || !(response instanceof HttpServletResponse)) {
            chain.doFilter(request, response);
            return;
        }
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        EngineHandle handle = lifecycle.handle();
        if (handle == null) {
            if (lifecycle.failure() != null) {
                WafResponses.serverError(httpResponse, WafResponses.INITIALIZATION_FAILED);
            } else {
                LOG.error("Request received before WAF initialization: uri={}", httpRequest.getRequestURI());
                WafResponses.serverError(httpResponse, WafResponses.NOT_INITIALIZED);
            }
            return;
        }

        String requestId = requestId(httpRequest);
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            inspect(handle, requestId, httpRequest, httpResponse, chain);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    /** The client's id when it is short and plain, otherwise a fresh UUID. */
    static String requestId(HttpServletRequest request) {
        String incoming = request.getHeader(REQUEST_ID_HEADER);
        if (incoming != null
                && incoming.length() <= MAX_REQUEST_ID_LENGTH
                && REQUEST_ID_PATTERN.matcher(incoming).matches()) {
            return incoming;
        }
        if (incoming != null && !incoming.isEmpty()) {
            LOG.debug("Ignoring malformed {} header: length={}", REQUEST_ID_HEADER, incoming.length());
        }
        return UUID.randomUUID().toString();
    }

    private void inspect(
            EngineHandle handle,
            String requestId,
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain)
            throws IOException, ServletException {
        RequestView view;
        try {
            view = adapter.toView(request);
        } catch (RequestConversionException e) {
            LOG.error("Request conversion failed: {}", e.getMessage(), e);
            WafResponses.serverError(response, WafResponses.CONVERSION_FAILED);
            return;
        }

        Transaction tx;
        try {
            tx = handle.newTransaction(TransactionOptions.forCurrentThread(requestId));
        } catch (RuntimeException e) {
            LOG.error("Failed to start WAF transaction: {}", e.getMessage(), e);
            WafResponses.serverError(response, WafResponses.PROCESSING_FAILED);
            return;
        }

        try (TransactionScope scope = new TransactionScope(tx)) {
            HttpServletRequest downstream;
            try {
                downstream = evaluate(scope.transaction(), view, request, response);
            } catch (EngineIOException e) {
                LOG.error("WAF body processing failed: uri={}, error={}", view.uri(), e.getMessage(), e);
                WafResponses.serverError(response, WafResponses.PROCESSING_FAILED);
                return;
            } catch (RuntimeException e) {
                LOG.error("Unexpected fault during WAF inspection: uri={}", view.uri(), e);
                WafResponses.serverError(response, WafResponses.PROCESSING_FAILED);
                return;
            }
            if (downstream != null) {
                chain.doFilter(downstream, response);
            }
        }
    }

    /** Returns the request to pass on, or {@code null} if the response has been written. */
    private HttpServletRequest evaluate(
            Transaction tx, RequestView view, HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        if (tx.isRuleEngineOff()) {
            LOG.debug("Rule engine off, skipping inspection: uri={}", view.uri());
            return request;
        }
        PipelineResult result = pipeline.run(tx, view);
        if (result.isInterrupted()) {
            block(response, result.interruption());
            return null;
        }
        if (result.body() != null && result.body() != view.body()) {
            return new InspectedRequest(request, result.body());
        }
        return request;
    }

    private void block(HttpServletResponse response, Interruption interruption) throws IOException {
        int status = ResponseTranslator.translate(interruption, blockStatus);
        response.setHeader(BLOCKED_HEADER, "true");
        WafResponses.write(response, status, lifecycle.blockMessage());
    }
}
