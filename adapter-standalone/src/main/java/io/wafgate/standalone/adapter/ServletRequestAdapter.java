package io.wafgate.standalone.adapter;

import io.wafgate.core.error.RequestConversionException;
import io.wafgate.core.model.Endpoint;
import io.wafgate.core.model.RequestView;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects a Jakarta {@link HttpServletRequest} into a {@link RequestView}.
 *
 * <p>
 * Header names are kept as the container reports them and every value of a
 * repeated header is kept, in order. The request target is the raw request
 * URI plus the raw query string. The body stream is attached only when the
 * request declares one, through a positive {@code Content-Length} or a
 * {@code Transfer-Encoding} header. Over HTTP/2 and later, a body-bearing
 * method with no declared length is also treated as carrying a body.
 *
 * <p>
 * Pure projection: nothing is read from the body here. Thread-safe; all state
 * is local to each call.
 */
public final class ServletRequestAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(ServletRequestAdapter.class);

    static final String HOST_HEADER = "Host";
    static final String TRANSFER_ENCODING_HEADER = "Transfer-Encoding";
    static final String DEFAULT_PROTOCOL = "HTTP/1.1";
    static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    /**
     * Builds the view.
     *
     * @throws RequestConversionException if the request lacks a method or a
     *                                    target, or its body cannot be opened
     */
    public RequestView toView(HttpServletRequest request) {
        try {
            return convert(request);
        } catch (RequestConversionException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new RequestConversionException("Failed to convert request: " + e.getMessage(), e);
        }
    }

    private RequestView convert(HttpServletRequest request) throws IOException {
        String method = request.getMethod();
        if (method == null || method.isEmpty()) {
            throw new RequestConversionException("Request has no method");
        }
        String path = request.getRequestURI();
        if (path == null || path.isEmpty()) {
            throw new RequestConversionException("Request has no target URI");
        }
        String query = request.getQueryString();
        String uri = query != null ? path + "?" + query : path;

        String protocol = request.getProtocol() != null ? request.getProtocol() : DEFAULT_PROTOCOL;

        RequestView.Builder builder = RequestView.builder()
                .method(method)
                .uri(uri)
                .protocol(protocol)
                .remote(Endpoint.of(request.getRemoteAddr(), request.getRemotePort()))
                .local(Endpoint.of(request.getLocalAddr(), request.getLocalPort()));

        Enumeration<String> names = request.getHeaderNames();
        if (names != null) {
            while (names.hasMoreElements()) {
                String name = names.nextElement();
                Enumeration<String> values = request.getHeaders(name);
                while (values != null && values.hasMoreElements()) {
                    builder.addHeader(name, values.nextElement());
                }
            }
        }

        String host = request.getHeader(HOST_HEADER);
        builder.host(host != null && !host.isEmpty() ? host : request.getServerName());

        String transferEncoding = firstToken(request.getHeader(TRANSFER_ENCODING_HEADER));
        builder.transferEncoding(transferEncoding);

        long contentLength = request.getContentLengthLong();
        if (contentLength > 0
                || transferEncoding != null
                || (contentLength < 0 && isFramedProtocol(protocol) && BODY_METHODS.contains(method))) {
            InputStream body = request.getInputStream();
            builder.body(body);
        }

        RequestView view = builder.build();
        LOG.debug("toView: {} {} (host={}, body={})", method, uri, view.host(), view.hasBody());
        return view;
    }

    /** HTTP/2 and later frame bodies themselves and need not declare a length. */
    static boolean isFramedProtocol(String protocol) {
        return protocol.startsWith("HTTP/2") || protocol.startsWith("HTTP/3");
    }

    static String firstToken(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        int comma = headerValue.indexOf(',');
        String token = (comma >= 0 ? headerValue.substring(0, comma) : headerValue).trim();
        return token.isEmpty() ? null : token;
    }
}
