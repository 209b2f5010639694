package com.kakomon.harvest;

import com.kakomon.config.Config;
import com.kakomon.fetch.FetchRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves request/response pairs per draw or page for offline selector debugging.
 * Write failures are logged and never affect the harvest.
 */
public final class DebugPageWriter {
    private static final Logger LOG = LogManager.getLogger(DebugPageWriter.class);
    private static final DebugPageWriter DISABLED = new DebugPageWriter(null, false);

    private final Path dir;
    private final boolean enabled;

    public DebugPageWriter(Path dir, boolean enabled) {
        this.dir = dir;
        this.enabled = enabled && dir != null;
    }

    public static DebugPageWriter disabled() {
        return DISABLED;
    }

    public static DebugPageWriter fromConfig(Config config) {
        return new DebugPageWriter(
                config.getPath("harvest.debug_pages.dir"),
                config.getBoolean("harvest.debug_pages.enabled", false)
        );
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void write(String label, String step, FetchRequest request, String body) {
        if (!enabled) {
            return;
        }
        String base = safe(label) + "_" + safe(step);
        String extension = body != null && body.trim().startsWith("<") ? ".response.html" : ".response.json";
        try {
            Files.createDirectories(dir);
            Files.writeString(
                    dir.resolve(base + ".request.txt"),
                    request.signature() + "\n" + request.encodedParams() + "\n",
                    StandardCharsets.UTF_8
            );
            Files.writeString(dir.resolve(base + extension), body == null ? "" : body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Failed to save debug page {}: {}", base, e.getMessage());
        }
    }

    static String safe(String value) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? "_" : text.replaceAll("[\\s/\\\\:*?\"<>|]+", "_");
    }
}
