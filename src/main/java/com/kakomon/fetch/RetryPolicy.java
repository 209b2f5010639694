package com.kakomon.fetch;

import com.kakomon.config.Config;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with proportional jitter. Attempt numbers are 1-based.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class RetryPolicy {
    public final int maxAttempts;
    public final long baseDelayMs;
    public final double multiplier;
    public final long maxDelayMs;
    public final double jitterRatio;

    public static RetryPolicy fromConfig(Config config) {
        return new RetryPolicy(
                Math.max(1, config.getInt("fetch.retry.max_attempts", 5)),
                Math.max(0L, config.getLong("fetch.retry.base_delay_ms", 1000L)),
                Math.max(1.0, config.getDouble("fetch.retry.multiplier", 2.0)),
                Math.max(0L, config.getLong("fetch.retry.max_delay_ms", 30_000L)),
                Math.max(0.0, Math.min(1.0, config.getDouble("fetch.retry.jitter_ratio", 0.25)))
        );
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0L, 1.0, 0L, 0.0);
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay to wait after failed {@code attempt}: base * multiplier^(attempt-1), capped, then
     * stretched by up to {@code jitterRatio}. {@code random} yields values in [0, 1).
     */
    public long delayMillis(int attempt, DoubleSupplier random) {
        int exponent = Math.max(0, attempt - 1);
        double raw = baseDelayMs * Math.pow(multiplier, exponent);
        double capped = maxDelayMs > 0L ? Math.min(raw, (double) maxDelayMs) : raw;
        double jitter = jitterRatio <= 0.0 ? 0.0 : capped * jitterRatio * clampUnit(random.getAsDouble());
        return Math.round(capped + jitter);
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
