package com.kakomon.fetch;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThrottleTest {

    @Test
    void acquire_shouldSpaceConsecutiveRequests() throws Exception {
        AtomicLong now = new AtomicLong(TimeUnit.SECONDS.toNanos(100));
        List<Long> sleeps = new ArrayList<>();
        Sleeper sleeper = millis -> {
            sleeps.add(millis);
            now.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
        };
        Throttle throttle = new Throttle(1_000L, sleeper, now::get);

        throttle.acquire();
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(250));
        throttle.acquire();

        assertEquals(List.of(750L), sleeps);
    }

    @Test
    void acquire_shouldNotWaitOnceIntervalElapsed() throws Exception {
        AtomicLong now = new AtomicLong(0L);
        List<Long> sleeps = new ArrayList<>();
        Throttle throttle = new Throttle(500L, sleeps::add, now::get);

        throttle.acquire();
        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(600));
        throttle.acquire();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void none_shouldNeverSleep() throws Exception {
        Throttle throttle = Throttle.none();
        for (int i = 0; i < 5; i++) {
            throttle.acquire();
        }
        assertEquals(0L, throttle.intervalMs());
    }
}
