package com.kakomon.fetch;

import com.kakomon.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Throttled, retried and cached request execution.
 * A cache hit returns immediately and consumes no throttle slot; only successful responses are cached.
 */
public final class Fetcher {
    private static final Logger LOG = LogManager.getLogger(Fetcher.class);

    private final HttpTransport transport;
    private final ResponseCache cache;
    private final Throttle throttle;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Duration timeout;
    private final DoubleSupplier random;

    public Fetcher(
            HttpTransport transport,
            ResponseCache cache,
            Throttle throttle,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            Duration timeout,
            DoubleSupplier random
    ) {
        this.transport = transport;
        this.cache = cache == null ? ResponseCache.disabled() : cache;
        this.throttle = throttle == null ? Throttle.none() : throttle;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.noRetry() : retryPolicy;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.timeout = timeout == null ? Duration.ofSeconds(20) : timeout;
        this.random = random == null ? () -> ThreadLocalRandom.current().nextDouble() : random;
    }

    public static Fetcher fromConfig(Config config, HttpTransport transport, ResponseCache cache, Throttle throttle) {
        int timeoutSec = Math.max(3, config.getInt("fetch.timeout_sec", 20));
        return new Fetcher(
                transport,
                cache,
                throttle,
                RetryPolicy.fromConfig(config),
                Sleeper.SYSTEM,
                Duration.ofSeconds(timeoutSec),
                null
        );
    }

    public ResponseCache cache() {
        return cache;
    }

    public FetchResult fetch(FetchRequest request) throws NetworkException, InterruptedException {
        Optional<CacheEntry> cached = request.cacheable ? cache.get(request) : Optional.empty();
        if (cached.isPresent()) {
            LOG.debug("cache hit {}", request.signature());
            return FetchResult.cached(cached.get().body);
        }

        NetworkException lastError = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts; attempt++) {
            throttle.acquire();
            TransportResponse response;
            try {
                response = transport.send(request, timeout);
            } catch (IOException e) {
                String category = classifyFailure(e);
                lastError = new NetworkException(
                        category + " on attempt " + attempt + ": " + describe(e),
                        request.url,
                        e
                );
                if (!backoff(request, attempt, category, -1L)) {
                    break;
                }
                continue;
            }

            if (response.isSuccess()) {
                if (request.cacheable) {
                    cache.put(request, response.body);
                }
                return FetchResult.network(response.body, attempt, response.statusCode);
            }
            int status = response.statusCode;
            if (status == 429) {
                lastError = new RateLimitException(request.url, attempt);
            } else if (status >= 500 && status < 600) {
                lastError = new NetworkException("http status=" + status, request.url, status, true);
            } else {
                throw new NetworkException("http status=" + status, request.url, status, false);
            }
            if (!backoff(request, attempt, "http_" + status, retryAfterMillis(response))) {
                break;
            }
        }
        if (lastError == null) {
            lastError = new NetworkException("fetch failed", request.url, -1, true);
        }
        LOG.warn("Giving up on {} after {} attempts: {}", request.signature(), retryPolicy.maxAttempts, lastError.getMessage());
        throw lastError;
    }

    private boolean backoff(FetchRequest request, int attempt, String reason, long floorMs) throws InterruptedException {
        if (!retryPolicy.canRetry(attempt)) {
            return false;
        }
        long delay = Math.max(retryPolicy.delayMillis(attempt, random), floorMs);
        LOG.info("Retrying {} after {} (attempt {}/{}, wait {}ms)",
                request.url, reason, attempt, retryPolicy.maxAttempts, delay);
        if (delay > 0L) {
            sleeper.sleep(delay);
        }
        return true;
    }

    private long retryAfterMillis(TransportResponse response) {
        Optional<String> header = response.header("Retry-After");
        if (header.isEmpty()) {
            return -1L;
        }
        try {
            long seconds = Long.parseLong(header.get().trim());
            return seconds < 0 ? -1L : seconds * 1000L;
        } catch (NumberFormatException ignored) {
            return -1L;
        }
    }

    public static String classifyFailure(Throwable error) {
        if (error instanceof HttpTimeoutException) {
            return "timeout";
        }
        String msg = error == null || error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout")) {
            return "timeout";
        }
        if (msg.contains("connection reset") || msg.contains("connection refused") || msg.contains("closed")) {
            return "connection";
        }
        return "io_error";
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
