package io.wafgate.core.model;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Protocol-neutral projection of one inbound HTTP request, the input of the
 * inspection pipeline.
 *
 * <p>
 * Headers keep the names as received and the order in which they arrived.
 * Repeated headers are kept as separate values under one name, in order.
 *
 * <p>
 * The view is immutable, except for the body stream it hands out, which is
 * consumed at most once by the pipeline. A view belongs to the single request
 * invocation that built it and is never shared.
 */
public final class RequestView {

    private final String method;
    private final String uri;
    private final String protocol;
    private final Map<String, List<String>> headers;
    private final Endpoint remote;
    private final Endpoint local;
    private final String host;
    private final String transferEncoding;
    private final InputStream body;

    private RequestView(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.uri = Objects.requireNonNull(builder.uri, "uri must not be null");
        this.protocol = builder.protocol != null ? builder.protocol : "HTTP/1.1";
        Map<String, List<String>> copy = new LinkedHashMap<>();
        builder.headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
        this.remote = builder.remote != null ? builder.remote : Endpoint.unknown();
        this.local = builder.local != null ? builder.local : Endpoint.unknown();
        this.host = builder.host != null ? builder.host : "";
        this.transferEncoding = builder.transferEncoding;
        this.body = builder.body;
    }

    /** HTTP method, e.g. {@code POST}. */
    public String method() {
        return method;
    }

    /** Request target as sent: raw path plus {@code ?query} when present. */
    public String uri() {
        return uri;
    }

    /** Protocol version, e.g. {@code HTTP/1.1}. */
    public String protocol() {
        return protocol;
    }

    /** Header name → values, in arrival order. Unmodifiable. */
    public Map<String, List<String>> headers() {
        return headers;
    }

    /** True if a header with the given name is present (case-insensitive). */
    public boolean hasHeader(String name) {
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /** The client side of the connection. */
    public Endpoint remote() {
        return remote;
    }

    /** The server side of the connection; {@link Endpoint#unknown()} if the server does not expose it. */
    public Endpoint local() {
        return local;
    }

    /** Effective host: the Host header, else the server name. Empty if neither is known. */
    public String host() {
        return host;
    }

    /** First token of the Transfer-Encoding header, or {@code null}. */
    public String transferEncoding() {
        return transferEncoding;
    }

    /** True if the request carries a body stream. */
    public boolean hasBody() {
        return body != null;
    }

    /** The body stream, or {@code null} when the request has no body. */
    public InputStream body() {
        return body;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RequestView[" + method + " " + uri + " " + protocol + ", from=" + remote + ", host=" + host + "]";
    }

    /** Builder for {@link RequestView}. */
    public static final class Builder {
        private String method;
        private String uri;
        private String protocol;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private Endpoint remote;
        private Endpoint local;
        private String host;
        private String transferEncoding;
        private InputStream body;

        Builder() {}

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        /** Appends one header value; repeated calls with the same name keep every value in order. */
        public Builder addHeader(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder remote(Endpoint remote) {
            this.remote = remote;
            return this;
        }

        public Builder local(Endpoint local) {
            this.local = local;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder transferEncoding(String transferEncoding) {
            this.transferEncoding = transferEncoding;
            return this;
        }

        public Builder body(InputStream body) {
            this.body = body;
            return this;
        }

        public RequestView build() {
            return new RequestView(this);
        }
    }
}
