package io.wafgate.core.pipeline;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;

/**
 * Wraps the original request body while the engine ingests it.
 *
 * <p>
 * The engine reads from this stream up to its own limit. Whatever it leaves
 * unread stays in the underlying stream, so the downstream body is rebuilt as
 * the engine's retained copy followed by that remainder (see
 * {@link #replay(InputStream)}). The result yields the original bytes, in the
 * original order, exactly once.
 *
 * <p>
 * {@link #close()} does not close the source: the remainder still belongs to
 * the downstream handler. Mark/reset is not supported because a reset would
 * make the consumed count disagree with what the engine retained.
 */
public final class BodyCaptureStream extends FilterInputStream {

    private long consumed;

    public BodyCaptureStream(InputStream source) {
        super(source);
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b >= 0) {
            consumed++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = in.read(b, off, len);
        if (n > 0) {
            consumed += n;
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = in.skip(n);
        if (skipped > 0) {
            consumed += skipped;
        }
        return skipped;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    @Override
    public synchronized void mark(int readlimit) {
        // not supported
    }

    @Override
    public synchronized void reset() throws IOException {
        throw new IOException("mark/reset not supported");
    }

    /** Leaves the source open; it is closed by whoever reads the replayed body. */
    @Override
    public void close() {
        // source stays open for replay
    }

    /** Number of bytes read (or skipped) through this stream so far. */
    public long consumed() {
        return consumed;
    }

    /**
     * Builds the downstream body: {@code retained} (the bytes the engine kept)
     * followed by the unread remainder of the source. Closing the returned
     * stream closes both.
     */
    public InputStream replay(InputStream retained) {
        return new SequenceInputStream(retained, in);
    }
}
