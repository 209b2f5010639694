package com.kakomon.fetch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disk-backed response store, one JSON file per request signature. Entries never expire.
 */
public class ResponseCache {
    private static final Logger LOG = LogManager.getLogger(ResponseCache.class);
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final boolean enabled;
    private final Clock clock;
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    public ResponseCache(Path dir, boolean enabled, Clock clock) {
        this.dir = dir;
        this.enabled = enabled && dir != null;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static ResponseCache disabled() {
        return new ResponseCache(null, false, Clock.systemUTC());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path dir() {
        return dir;
    }

    public Optional<CacheEntry> get(FetchRequest request) {
        if (!enabled) {
            return Optional.empty();
        }
        Path file = fileFor(request.cacheKey());
        if (!Files.isRegularFile(file)) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        try {
            JSONObject json = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            CacheEntry entry = new CacheEntry(
                    json.optString("key", request.cacheKey()),
                    json.optString("signature", request.signature()),
                    json.getString("body"),
                    Instant.parse(json.optString("fetchedAt", Instant.EPOCH.toString()))
            );
            hits.incrementAndGet();
            return Optional.of(entry);
        } catch (IOException | JSONException | DateTimeParseException e) {
            LOG.warn("Ignoring unreadable cache entry {}: {}", file.getFileName(), e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    /**
     * Stores a successful response. A write failure is logged and otherwise ignored, the cache only saves cost.
     */
    public void put(FetchRequest request, String body) {
        if (!enabled) {
            return;
        }
        String key = request.cacheKey();
        JSONObject json = new JSONObject();
        json.put("key", key);
        json.put("signature", request.signature());
        json.put("fetchedAt", clock.instant().toString());
        json.put("body", body == null ? "" : body);
        Path target = fileFor(key);
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, key.substring(0, 12) + ".", ".tmp");
            try {
                Files.writeString(tmp, json.toString(), StandardCharsets.UTF_8);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            LOG.warn("Failed to write cache entry {}: {}", target.getFileName(), e.getMessage());
        }
    }

    public int clear() throws IOException {
        if (dir == null || !Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : stream) {
                Files.deleteIfExists(file);
                removed++;
            }
        }
        return removed;
    }

    public int hits() {
        return hits.get();
    }

    public int misses() {
        return misses.get();
    }

    private Path fileFor(String key) {
        return dir.resolve(key + SUFFIX);
    }
}
