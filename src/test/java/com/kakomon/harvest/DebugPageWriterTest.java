package com.kakomon.harvest;

import com.kakomon.config.Config;
import com.kakomon.fetch.FetchRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DebugPageWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_shouldSaveRequestAndResponsePair() throws Exception {
        Config config = Config.fromMap(tempDir, Map.of(
                "harvest.debug_pages.enabled", "true",
                "harvest.debug_pages.dir", "debug"
        ));
        DebugPageWriter writer = DebugPageWriter.fromConfig(config);
        FetchRequest request = FetchRequest.post("https://x.test/draw").param("qno", "3").transientParam("sid", "z").build();

        writer.write("令和7年 春期", "qno3", request, "<html>ok</html>");

        Path dir = tempDir.resolve("debug");
        String requestText = Files.readString(dir.resolve("令和7年_春期_qno3.request.txt"), StandardCharsets.UTF_8);
        assertTrue(requestText.startsWith("POST https://x.test/draw qno=3"));
        assertTrue(requestText.contains("sid=z"));
        assertEquals("<html>ok</html>", Files.readString(dir.resolve("令和7年_春期_qno3.response.html"), StandardCharsets.UTF_8));
    }

    @Test
    void write_shouldDoNothingWhenDisabled() {
        DebugPageWriter writer = new DebugPageWriter(tempDir.resolve("off"), false);

        writer.write("s", "page0", FetchRequest.get("https://x.test/").build(), "{}");

        assertFalse(writer.isEnabled());
        assertFalse(Files.exists(tempDir.resolve("off")));
    }

    @Test
    void safe_shouldReplacePathHostileCharacters() {
        assertEquals("a_b_c", DebugPageWriter.safe("a/b:c"));
        assertEquals("_", DebugPageWriter.safe(" "));
    }
}
