package io.wafgate.standalone.adapter;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Request handed downstream after inspection: identical to the original
 * except that its body is read from the stream rebuilt by the pipeline.
 *
 * <p>
 * {@link #getInputStream()} and {@link #getReader()} follow the servlet rule
 * that only one of them may be used per request. Form parameters already
 * parsed by the container are not re-parsed from the rebuilt body.
 */
public final class InspectedRequest extends HttpServletRequestWrapper {

    private final InputStream body;
    private ServletInputStream stream;
    private BufferedReader reader;

    public InspectedRequest(HttpServletRequest request, InputStream body) {
        super(request);
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    @Override
    public ServletInputStream getInputStream() {
        if (reader != null) {
            throw new IllegalStateException("getReader() has already been called for this request");
        }
        if (stream == null) {
            stream = new ReplayInputStream(body);
        }
        return stream;
    }

    @Override
    public BufferedReader getReader() {
        if (stream != null) {
            throw new IllegalStateException("getInputStream() has already been called for this request");
        }
        if (reader == null) {
            reader = new BufferedReader(new InputStreamReader(body, charset()));
        }
        return reader;
    }

    private Charset charset() {
        String encoding = getCharacterEncoding();
        if (encoding == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    /** Blocking servlet stream over the rebuilt body. */
    static final class ReplayInputStream extends ServletInputStream {

        private final InputStream body;
        private boolean finished;

        ReplayInputStream(InputStream body) {
            this.body = body;
        }

        @Override
        public int read() throws IOException {
            int b = body.read();
            if (b < 0) {
                finished = true;
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = body.read(b, off, len);
            if (n < 0) {
                finished = true;
            }
            return n;
        }

        @Override
        public int available() throws IOException {
            return body.available();
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            throw new UnsupportedOperationException("Asynchronous reads are not supported on an inspected request");
        }

        @Override
        public void close() throws IOException {
            body.close();
        }
    }
}
