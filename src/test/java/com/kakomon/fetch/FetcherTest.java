package com.kakomon.fetch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetcherTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-04-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final RecordingSleeper sleeper = new RecordingSleeper();

    private Fetcher fetcher(HttpTransport transport, ResponseCache cache, int maxAttempts) {
        RetryPolicy retry = new RetryPolicy(maxAttempts, 100L, 2.0, 1_000L, 0.0);
        return new Fetcher(transport, cache, Throttle.none(), retry, sleeper, Duration.ofSeconds(5), () -> 0.0);
    }

    @Test
    void fetch_shouldRetryServerErrorsWithBackoff() throws Exception {
        FakeTransport transport = FakeTransport.sequence(
                TransportResponse.of(503, "busy"),
                TransportResponse.of(502, "busy"),
                TransportResponse.of(200, "ok")
        );

        FetchResult result = fetcher(transport, ResponseCache.disabled(), 5)
                .fetch(FetchRequest.get("https://example.test/a").build());

        assertEquals("ok", result.body);
        assertEquals(3, result.attempts);
        assertFalse(result.fromCache);
        assertEquals(List.of(100L, 200L), sleeper.sleeps());
    }

    @Test
    void fetch_shouldHonourRetryAfterAndSurfaceRateLimit() {
        TransportResponse limited = new TransportResponse(429, "", Map.of("Retry-After", List.of("3")));
        FakeTransport transport = FakeTransport.sequence(limited);

        RateLimitException error = assertThrows(RateLimitException.class, () -> fetcher(transport, ResponseCache.disabled(), 2)
                .fetch(FetchRequest.get("https://example.test/a").build()));

        assertEquals(429, error.statusCode());
        assertEquals(2, transport.count());
        assertEquals(List.of(3_000L), sleeper.sleeps());
    }

    @Test
    void fetch_shouldNotRetryClientErrors() {
        FakeTransport transport = FakeTransport.sequence(TransportResponse.of(404, "missing"));

        NetworkException error = assertThrows(NetworkException.class, () -> fetcher(transport, ResponseCache.disabled(), 5)
                .fetch(FetchRequest.get("https://example.test/missing").build()));

        assertEquals(404, error.statusCode());
        assertFalse(error.isTransientFailure());
        assertEquals(1, transport.count());
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void fetch_shouldWrapIoFailuresAfterLastAttempt() {
        FakeTransport transport = new FakeTransport(request -> {
            throw new HttpTimeoutException("request timed out");
        });

        NetworkException error = assertThrows(NetworkException.class, () -> fetcher(transport, ResponseCache.disabled(), 2)
                .fetch(FetchRequest.get("https://example.test/slow").build()));

        assertTrue(error.getMessage().startsWith("timeout"));
        assertInstanceOf(IOException.class, error.getCause());
        assertEquals(2, transport.count());
    }

    @Test
    void fetch_shouldServeRepeatRequestsFromCache() throws Exception {
        FakeTransport transport = FakeTransport.sequence(TransportResponse.of(200, "<html>1</html>"));
        ResponseCache cache = new ResponseCache(tempDir.resolve("cache"), true, CLOCK);
        Fetcher fetcher = fetcher(transport, cache, 1);

        FetchResult first = fetcher.fetch(FetchRequest.post("https://example.test/draw").param("qno", "1")
                .transientParam("sid", "aaa").build());
        FetchResult second = fetcher.fetch(FetchRequest.post("https://example.test/draw").param("qno", "1")
                .transientParam("sid", "bbb").build());

        assertFalse(first.fromCache);
        assertTrue(second.fromCache);
        assertEquals("<html>1</html>", second.body);
        assertEquals(1, transport.count());
        assertEquals(1, cache.hits());
    }

    @Test
    void fetch_shouldBypassCacheForUncacheableRequests() throws Exception {
        FakeTransport transport = FakeTransport.sequence(TransportResponse.of(200, "fresh"));
        ResponseCache cache = new ResponseCache(tempDir.resolve("cache"), true, CLOCK);
        Fetcher fetcher = fetcher(transport, cache, 1);
        FetchRequest prime = FetchRequest.get("https://example.test/start").noCache().build();

        fetcher.fetch(prime);
        fetcher.fetch(prime);

        assertEquals(2, transport.count());
        assertTrue(cache.get(prime).isEmpty());
    }

    @Test
    void fetch_shouldNotCacheFailures() {
        FakeTransport transport = FakeTransport.sequence(TransportResponse.of(500, "boom"));
        ResponseCache cache = new ResponseCache(tempDir.resolve("cache"), true, CLOCK);
        FetchRequest request = FetchRequest.get("https://example.test/a").build();

        assertThrows(NetworkException.class, () -> fetcher(transport, cache, 1).fetch(request));

        assertTrue(cache.get(request).isEmpty());
    }

    @Test
    void classifyFailure_shouldNameCommonCategories() {
        assertEquals("timeout", Fetcher.classifyFailure(new HttpTimeoutException("x")));
        assertEquals("connection", Fetcher.classifyFailure(new IOException("Connection reset by peer")));
        assertEquals("io_error", Fetcher.classifyFailure(new IOException("weird")));
    }
}
