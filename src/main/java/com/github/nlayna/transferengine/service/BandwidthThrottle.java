package com.github.nlayna.transferengine.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Token bucket capping aggregate byte throughput across all transfers.
 * <p>
 * The bucket holds up to {@code burstSize} tokens and refills at {@code bytesPerSecond}
 * based on elapsed time. A consumer that finds too few tokens reserves them anyway, leaving
 * the bucket in debt, and sleeps until the debt it caused is repaid. Later consumers then
 * queue up behind that debt, which keeps the aggregate rate at the configured limit.
 * A non-positive rate disables throttling.
 */
@Slf4j
public class BandwidthThrottle {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final Ticker ticker;
    private final Object lock = new Object();

    private long bytesPerSecond;
    private long burstSize;
    private double availableTokens;
    private long lastRefillNanos;
    private boolean paused;

    public BandwidthThrottle(long bytesPerSecond, Long burstSize) {
        this(bytesPerSecond, burstSize, Ticker.SYSTEM);
    }

    public BandwidthThrottle(long bytesPerSecond, Long burstSize, Ticker ticker) {
        this.ticker = ticker;
        applyLimit(bytesPerSecond, burstSize);
        this.availableTokens = this.burstSize;
        this.lastRefillNanos = ticker.nanoTime();
    }

    /**
     * Waits until {@code bytes} tokens are available and deducts them.
     * Blocks indefinitely while the throttle is paused.
     *
     * @return the time spent waiting for tokens, excluding time spent paused
     */
    public Duration consume(long bytes) throws InterruptedException {
        if (bytes <= 0) {
            return Duration.ZERO;
        }
        long waitNanos;
        synchronized (lock) {
            while (paused) {
                lock.wait();
            }
            if (bytesPerSecond <= 0) {
                return Duration.ZERO;
            }
            refill();
            if (availableTokens >= bytes) {
                availableTokens -= bytes;
                return Duration.ZERO;
            }
            double deficit = bytes - availableTokens;
            availableTokens -= bytes;
            waitNanos = (long) Math.ceil(deficit * NANOS_PER_SECOND / bytesPerSecond);
        }
        log.trace("Throttling: need {} bytes, delay {}ms", bytes, waitNanos / 1_000_000);
        ticker.sleepNanos(waitNanos);
        return Duration.ofNanos(waitNanos);
    }

    /**
     * Changes the limit at runtime. Tokens already banked are kept up to the new burst size.
     */
    public void setLimit(long newBytesPerSecond, Long newBurstSize) {
        synchronized (lock) {
            boolean wasUnlimited = bytesPerSecond <= 0;
            refill();
            applyLimit(newBytesPerSecond, newBurstSize);
            if (wasUnlimited) {
                availableTokens = burstSize;
            } else {
                availableTokens = Math.min(availableTokens, burstSize);
            }
            lastRefillNanos = ticker.nanoTime();
        }
        log.info("Bandwidth limit set to {} bytes/s (burst {})", newBytesPerSecond, burstSize);
    }

    /**
     * Freezes token consumption. Consumers wait until {@link #resume()}.
     */
    public void pause() {
        synchronized (lock) {
            refill();
            paused = true;
        }
        log.info("Bandwidth throttle paused");
    }

    public void resume() {
        synchronized (lock) {
            paused = false;
            // no catch-up burst for the paused period
            lastRefillNanos = ticker.nanoTime();
            lock.notifyAll();
        }
        log.info("Bandwidth throttle resumed");
    }

    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    public long getBytesPerSecond() {
        synchronized (lock) {
            return bytesPerSecond;
        }
    }

    public long getBurstSize() {
        synchronized (lock) {
            return burstSize;
        }
    }

    public Stats getStats() {
        synchronized (lock) {
            if (bytesPerSecond > 0 && !paused) {
                refill();
            }
            return new Stats(bytesPerSecond, burstSize, (long) availableTokens, paused);
        }
    }

    private void refill() {
        long now = ticker.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0 && bytesPerSecond > 0) {
            availableTokens = Math.min(burstSize, availableTokens + elapsed * bytesPerSecond / NANOS_PER_SECOND);
        }
        lastRefillNanos = now;
    }

    private void applyLimit(long newBytesPerSecond, Long newBurstSize) {
        if (newBytesPerSecond <= 0) {
            bytesPerSecond = 0;
            burstSize = 0;
            return;
        }
        long burst = newBurstSize != null ? newBurstSize : newBytesPerSecond * 2;
        if (burst <= 0) {
            throw new IllegalArgumentException("burstSize must be positive, got: " + burst);
        }
        bytesPerSecond = newBytesPerSecond;
        burstSize = burst;
    }

    public record Stats(long bytesPerSecond, long burstSize, long availableTokens, boolean paused) {
    }
}
