package io.aegis.core.safety;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps consecutive starts at least {@code interval} apart by delaying callers. Each caller
 * reserves its slot under the lock and sleeps outside it, so waiting callers queue in order
 * without holding the lock.
 */
public final class Throttle {
    private final ReentrantLock lock = new ReentrantLock();
    private long intervalNanos;
    private long nextSlotNanos;
    private boolean primed;

    public Throttle(Duration interval) {
        setInterval(interval);
    }

    /**
     * Blocks until this caller's slot arrives.
     *
     * @return the {@link System#nanoTime()} value of the granted slot
     * @throws InterruptedException if interrupted while waiting; the unused slot is handed
     *     back when no later caller has reserved after it
     */
    public long acquire() throws InterruptedException {
        long now = System.nanoTime();
        long slot = reserve(now);
        long waitNanos = slot - now;
        if (waitNanos > 0) {
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                cancel(slot);
                throw e;
            }
        }
        return slot;
    }

    public void setInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        lock.lock();
        try {
            this.intervalNanos = interval.toNanos();
        } finally {
            lock.unlock();
        }
    }

    public Duration interval() {
        lock.lock();
        try {
            return Duration.ofNanos(intervalNanos);
        } finally {
            lock.unlock();
        }
    }

    private long reserve(long now) {
        lock.lock();
        try {
            long slot = !primed || nextSlotNanos - now < 0 ? now : nextSlotNanos;
            primed = true;
            nextSlotNanos = slot + intervalNanos;
            return slot;
        } finally {
            lock.unlock();
        }
    }

    private void cancel(long slot) {
        lock.lock();
        try {
            if (nextSlotNanos == slot + intervalNanos) {
                nextSlotNanos = slot;
            }
        } finally {
            lock.unlock();
        }
    }
}
