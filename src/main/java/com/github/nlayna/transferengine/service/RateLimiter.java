package com.github.nlayna.transferengine.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting semaphore that bounds concurrent in-flight operations across every
 * component sharing the instance. Waiters are served strictly in arrival order.
 * An optional minimum delay spaces out successive acquisitions even when permits are free.
 */
@Slf4j
public class RateLimiter {

    private final int maxConcurrent;
    private final long minDelayNanos;
    private final Ticker ticker;
    private final Semaphore permits;
    private final ReentrantLock pacingLock = new ReentrantLock(true);
    private final AtomicInteger outstanding = new AtomicInteger();
    private long lastAcquireNanos;
    private boolean acquiredBefore;

    private final LongAdder acquires = new LongAdder();
    private final LongAdder releases = new LongAdder();
    private final LongAdder delays = new LongAdder();
    private final LongAdder queueWaits = new LongAdder();

    public RateLimiter(int maxConcurrent, Duration minDelay) {
        this(maxConcurrent, minDelay, Ticker.SYSTEM);
    }

    public RateLimiter(int maxConcurrent, Duration minDelay, Ticker ticker) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive, got: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.minDelayNanos = minDelay == null ? 0 : Math.max(0, minDelay.toNanos());
        this.ticker = ticker;
        this.permits = new Semaphore(maxConcurrent, true);
    }

    /**
     * Blocks until a permit is available. Always pair with {@link #release()} in a finally block.
     */
    public void acquire() throws InterruptedException {
        acquires.increment();
        if (permits.availablePermits() == 0 || permits.hasQueuedThreads()) {
            queueWaits.increment();
            log.debug("At capacity ({}), queueing (queue: {})", maxConcurrent, permits.getQueueLength() + 1);
        }
        permits.acquire();
        outstanding.incrementAndGet();
        try {
            pace();
        } catch (InterruptedException e) {
            outstanding.decrementAndGet();
            permits.release();
            throw e;
        }
        log.debug("Acquired permit (active: {}/{}, queued: {})", outstanding.get(), maxConcurrent, permits.getQueueLength());
    }

    /**
     * Returns a permit and wakes the longest waiting caller.
     *
     * @throws IllegalStateException when no permit is outstanding
     */
    public void release() {
        int previous = outstanding.getAndUpdate(v -> v > 0 ? v - 1 : v);
        if (previous <= 0) {
            log.error("release() called without a matching acquire()");
            throw new IllegalStateException("release() called without a matching acquire()");
        }
        releases.increment();
        permits.release();
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        acquire();
        try {
            return operation.call();
        } finally {
            release();
        }
    }

    private void pace() throws InterruptedException {
        if (minDelayNanos == 0) {
            return;
        }
        pacingLock.lockInterruptibly();
        try {
            long now = ticker.nanoTime();
            if (acquiredBefore) {
                long waitNanos = lastAcquireNanos + minDelayNanos - now;
                if (waitNanos > 0) {
                    delays.increment();
                    log.debug("Delaying {}ms for min delay", waitNanos / 1_000_000);
                    ticker.sleepNanos(waitNanos);
                    now = ticker.nanoTime();
                }
            }
            lastAcquireNanos = now;
            acquiredBefore = true;
        } finally {
            pacingLock.unlock();
        }
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getActiveCount() {
        return outstanding.get();
    }

    public int getQueueLength() {
        return permits.getQueueLength();
    }

    public boolean isAtCapacity() {
        return outstanding.get() >= maxConcurrent;
    }

    public Stats getStats() {
        return new Stats(outstanding.get(), permits.getQueueLength(), maxConcurrent, minDelayNanos / 1_000_000,
                acquires.sum(), releases.sum(), delays.sum(), queueWaits.sum());
    }

    public record Stats(int active,
                        int queued,
                        int maxConcurrent,
                        long minDelayMs,
                        long acquires,
                        long releases,
                        long delays,
                        long queueWaits) {
    }
}
