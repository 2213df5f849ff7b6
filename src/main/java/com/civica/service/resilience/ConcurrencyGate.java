package com.civica.service.resilience;


import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Counting admission control for outbound calls. Acquiring blocks only the
 * calling dispatch until one of the fixed number of slots frees up.
 */
public class ConcurrencyGate {

    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public ConcurrencyGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Gate capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Block until a slot is free.
     *
     * @throws InterruptedException if interrupted while waiting; no slot is held then
     */
    public void acquire() throws InterruptedException {
        permits.acquire();
        int now = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(now, Math::max);
    }

    public void release() {
        inFlight.decrementAndGet();
        permits.release();
    }

    /**
     * Run {@code critical} holding a slot.
     */
    public <T> T withPermit(Supplier<T> critical) throws InterruptedException {
        acquire();
        try {
            return critical.get();
        } finally {
            release();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Highest number of simultaneously held slots since creation.
     */
    public int getPeakInFlight() {
        return peakInFlight.get();
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }
}
