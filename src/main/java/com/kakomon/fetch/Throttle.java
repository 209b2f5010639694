package com.kakomon.fetch;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Minimum spacing between network requests. Every caller sharing an instance shares the clock.
 */
public final class Throttle {
    private final long intervalNanos;
    private final Sleeper sleeper;
    private final LongSupplier nanoTime;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(Long.MIN_VALUE);

    public Throttle(long intervalMs) {
        this(intervalMs, Sleeper.SYSTEM, System::nanoTime);
    }

    public Throttle(long intervalMs, Sleeper sleeper, LongSupplier nanoTime) {
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, intervalMs));
        this.sleeper = sleeper;
        this.nanoTime = nanoTime;
    }

    public static Throttle none() {
        return new Throttle(0L);
    }

    public long intervalMs() {
        return TimeUnit.NANOSECONDS.toMillis(intervalNanos);
    }

    public void acquire() throws InterruptedException {
        if (intervalNanos <= 0L) {
            return;
        }
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = nanoTime.getAsLong();
            if (prev != Long.MIN_VALUE) {
                long nextAllowed = prev + intervalNanos;
                if (now < nextAllowed) {
                    long waitMs = Math.max(1L, TimeUnit.NANOSECONDS.toMillis(nextAllowed - now));
                    sleeper.sleep(waitMs);
                    continue;
                }
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }
}
