package com.kakomon.fetch;

import com.kakomon.config.Config;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void delayMillis_shouldGrowExponentiallyUpToCap() {
        RetryPolicy policy = new RetryPolicy(6, 1_000L, 2.0, 5_000L, 0.0);

        assertEquals(1_000L, policy.delayMillis(1, () -> 0.5));
        assertEquals(2_000L, policy.delayMillis(2, () -> 0.5));
        assertEquals(4_000L, policy.delayMillis(3, () -> 0.5));
        assertEquals(5_000L, policy.delayMillis(4, () -> 0.5));
    }

    @Test
    void delayMillis_shouldStretchByJitter() {
        RetryPolicy policy = new RetryPolicy(3, 1_000L, 2.0, 30_000L, 0.5);

        assertEquals(1_000L, policy.delayMillis(1, () -> 0.0));
        assertEquals(1_250L, policy.delayMillis(1, () -> 0.5));
        assertEquals(1_000L, policy.delayMillis(1, () -> -3.0));
    }

    @Test
    void canRetry_shouldStopAtMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(3, 0L, 1.0, 0L, 0.0);

        assertTrue(policy.canRetry(2));
        assertFalse(policy.canRetry(3));
        assertFalse(RetryPolicy.noRetry().canRetry(1));
    }

    @Test
    void fromConfig_shouldClampNonsense() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "fetch", Map.of("retry", Map.of("max_attempts", "0", "jitter_ratio", "7", "multiplier", "0.5"))
        ));

        RetryPolicy policy = RetryPolicy.fromConfig(config);

        assertEquals(1, policy.maxAttempts);
        assertEquals(1.0, policy.jitterRatio);
        assertEquals(1.0, policy.multiplier);
    }
}
