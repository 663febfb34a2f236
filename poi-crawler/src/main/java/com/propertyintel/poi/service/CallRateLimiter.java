package com.propertyintel.poi.service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum spacing between calls to a shared external resource.
 *
 * {@link #acquire()} returns no earlier than 1/rate seconds after the previous
 * acquire returned. The lock is fair, so waiting threads are served in arrival order.
 * Shared by every crawl task, so the aggregate provider rate stays bounded no matter
 * how many tasks run locally.
 */
@Slf4j
public class CallRateLimiter {

    private final long intervalNanos;
    private final ReentrantLock lock = new ReentrantLock(true);
    private long lastReleaseNanos;
    private boolean released;

    public CallRateLimiter(double callsPerSecond) {
        if (callsPerSecond <= 0) {
            throw new IllegalArgumentException("callsPerSecond must be positive: " + callsPerSecond);
        }
        this.intervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / callsPerSecond);
    }

    public long getIntervalNanos() {
        return intervalNanos;
    }

    /**
     * Block until the next call is allowed. Never throws: if the thread is interrupted
     * while waiting, the interrupt flag is restored and the call returns early.
     */
    public void acquire() {
        lock.lock();
        try {
            if (released) {
                long waitNanos = lastReleaseNanos + intervalNanos - System.nanoTime();
                if (waitNanos > 0) {
                    try {
                        TimeUnit.NANOSECONDS.sleep(waitNanos);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.debug("Interrupted while rate limiting");
                    }
                }
            }
            lastReleaseNanos = System.nanoTime();
            released = true;
        } finally {
            lock.unlock();
        }
    }
}
