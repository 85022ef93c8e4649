package com.github.nlayna.transferengine.service;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;

/**
 * InputStream wrapper that charges every byte read against a shared {@link BandwidthThrottle}.
 * Bytes are charged after the read returns, so the caller is held back before it can write them.
 */
public class ThrottledInputStream extends FilterInputStream {

    private final BandwidthThrottle throttle;

    public ThrottledInputStream(InputStream in, BandwidthThrottle throttle) {
        super(in);
        if (throttle == null) {
            throw new IllegalArgumentException("throttle must not be null");
        }
        this.throttle = throttle;
    }

    @Override
    public int read() throws IOException {
        int b = in.read();
        if (b != -1) {
            throttle(1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int bytesRead = in.read(b, off, len);
        if (bytesRead > 0) {
            throttle(bytesRead);
        }
        return bytesRead;
    }

    private void throttle(int bytes) throws IOException {
        try {
            throttle.consume(bytes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ex = new InterruptedIOException("Throttled read interrupted");
            ex.initCause(e);
            throw ex;
        }
    }
}
