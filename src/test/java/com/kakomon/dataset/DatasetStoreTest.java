package com.kakomon.dataset;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetStoreTest {

    @TempDir
    Path tempDir;

    private final DatasetStore store = new DatasetStore();

    private static Question question(String id) {
        return Question.builder()
                .id(id)
                .category("database")
                .year(2023)
                .text("第3正規形の条件はどれか。")
                .choices(List.of("推移的関数従属がない", "部分関数従属がある", "繰返し項目がある", "主キーがない"))
                .answerIndex(0)
                .explanation("第3正規形は推移的関数従属を排除した形である。")
                .sourceUrl("https://www.ap-siken.com/kakomon/05_aki/q30.html")
                .build();
    }

    @Test
    void write_shouldProducePrettyJsonAndLeaveNoTempFiles() throws Exception {
        Path out = tempDir.resolve("nested/questions_seed.json");
        Dataset dataset = Dataset.of(2, Instant.parse("2025-04-20T12:00:00Z"), List.of("令和5年秋期"),
                List.of(question("ap-05_aki-q030"), question("ap-05_aki-q031")));

        store.write(out, dataset);

        String text = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(text.contains("\n  \"version\": 2"));
        try (Stream<Path> files = Files.list(out.getParent())) {
            assertEquals(List.of("questions_seed.json"), files.map(p -> p.getFileName().toString()).toList());
        }
        Dataset loaded = store.load(out).orElseThrow();
        assertEquals(List.of("ap-05_aki-q030", "ap-05_aki-q031"), List.copyOf(loaded.ids()));
        assertEquals(dataset.generatedAt, loaded.generatedAt);
        assertEquals(dataset.questions, loaded.questions);
    }

    @Test
    void write_shouldEncodeMissingTimestampAsNull() {
        JSONObject json = DatasetStore.toJson(Dataset.empty());

        assertEquals(JSONObject.NULL, json.get("generatedAt"));
        assertEquals(0, json.getInt("version"));
    }

    @Test
    void load_shouldReturnEmptyForMissingFile() throws Exception {
        assertEquals(Optional.empty(), store.load(tempDir.resolve("absent.json")));
    }

    @Test
    void load_shouldFailOnNonJson() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "not json at all", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> store.load(file));
    }

    @Test
    void repair_shouldDropInvalidRecordsAndMalformedMetadata() {
        JSONArray questions = new JSONArray()
                .put(DatasetStore.toJson(question("ok-q001")))
                .put(DatasetStore.toJson(question("bad-q001")).put("answerIndex", 7))
                .put(DatasetStore.toJson(question("bad-q002")).put("year", "2023"))
                .put(DatasetStore.toJson(question("ok-q001")))
                .put("garbage");
        JSONObject root = new JSONObject()
                .put("version", "seven")
                .put("generatedAt", "yesterday")
                .put("sourceSessions", new JSONArray().put("s1").put(5))
                .put("questions", questions);

        DatasetStore.Repaired repaired = DatasetStore.repair(root);

        Dataset dataset = repaired.dataset();
        assertEquals(0, dataset.version);
        assertNull(dataset.generatedAt);
        assertTrue(dataset.sourceSessions.isEmpty());
        assertEquals(List.of("ok-q001"), List.copyOf(dataset.ids()));
        assertEquals(List.of("bad-q001", "bad-q002", "ok-q001", "<not an object>"), repaired.droppedIds());
    }

    @Test
    void repair_shouldAcceptOffsetTimestamps() {
        JSONObject root = new JSONObject()
                .put("version", 4)
                .put("generatedAt", "2025-04-20T21:00:00+09:00")
                .put("sourceSessions", new JSONArray().put("s1").put("s1"))
                .put("questions", new JSONArray());

        Dataset dataset = DatasetStore.repair(root).dataset();

        assertEquals(4, dataset.version);
        assertEquals(Instant.parse("2025-04-20T12:00:00Z"), dataset.generatedAt);
        assertEquals(List.of("s1"), dataset.sourceSessions);
    }
}
