package com.kakomon.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldLayerWorkingDirFileOverResource() throws Exception {
        Files.writeString(tempDir.resolve("config.properties"), "harvest.max_qno=7\n", StandardCharsets.UTF_8);

        Config config = Config.load(tempDir);

        assertEquals(7, config.getInt("harvest.max_qno"));
        assertEquals("override", config.sourceOf("harvest.max_qno"));
        assertEquals("resource", config.sourceOf("fetch.throttle_ms"));
        assertEquals(1000L, config.getLong("fetch.throttle_ms", -1L));
    }

    @Test
    void withOverrides_shouldWinAndIgnoreBlankValues() {
        Config base = Config.fromMap(tempDir, Map.of("merge", Map.of("policy", "preferExisting")));

        Config overridden = base.withOverrides(Map.of("merge.policy", " ", "harvest.max_requests", 12));

        assertEquals("preferExisting", overridden.getString("merge.policy"));
        assertEquals(12, overridden.getInt("harvest.max_requests"));
        assertEquals(200, base.getInt("harvest.max_requests"));
    }

    @Test
    void getters_shouldFallBackOnMalformedValues() {
        Config config = Config.fromMap(tempDir, Map.of(
                "harvest.max_qno", "many",
                "fetch.retry.multiplier", "x",
                "harvest.parallel", "yes",
                "extra.list", List.of("a", "b")
        ));

        assertEquals(3, config.getInt("harvest.max_qno", 3));
        assertEquals(2.0, config.getDouble("fetch.retry.multiplier", 2.0));
        assertTrue(config.getBoolean("harvest.parallel"));
        assertFalse(config.getBoolean("fetch.unknown"));
        assertEquals(List.of("a", "b"), config.getList("extra.list"));
    }

    @Test
    void getPath_shouldResolveAgainstWorkingDir() {
        Config config = Config.fromMap(tempDir, Map.of());

        assertEquals(tempDir.resolve("outputs/questions_seed.json").normalize(), config.getPath("dataset.path"));
        assertEquals(tempDir, config.getPath("no.such.key"));
    }

    @Test
    void requireString_shouldRejectMissingKey() {
        Config config = Config.fromMap(tempDir, Map.of());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> config.requireString("nope"));
        assertTrue(error.getMessage().contains("nope"));
    }
}
