package com.kakomon.dataset;

import com.kakomon.validate.QuestionValidator;
import com.kakomon.validate.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 模块说明：DatasetStore（class）。
 * 主要职责：读写题库 JSON 文件；读取时修复损坏或不合法的记录，写入时先写临时文件再原子替换。
 * 使用建议：文件不存在视为没有历史数据；文件不是 JSON 时抛出 IOException 交由调用方处理。
 */
public final class DatasetStore {
    private static final Logger LOG = LogManager.getLogger(DatasetStore.class);

    public Optional<Dataset> load(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String raw = Files.readString(file, StandardCharsets.UTF_8);
        JSONObject root;
        try {
            root = new JSONObject(raw);
        } catch (JSONException e) {
            throw new IOException("dataset is not a JSON object: " + file + " (" + e.getMessage() + ")", e);
        }
        Repaired repaired = repair(root);
        if (!repaired.droppedIds().isEmpty()) {
            LOG.warn("Dropped {} invalid question(s) from {}: {}",
                    repaired.droppedIds().size(), file, String.join(", ", repaired.droppedIds()));
        }
        return Optional.of(repaired.dataset());
    }

    /**
     * Rebuilds a dataset from parsed JSON, dropping records that fail validation and
     * discarding malformed metadata.
     */
    public static Repaired repair(JSONObject root) {
        Object rawVersion = root.opt("version");
        int version = rawVersion instanceof Integer || rawVersion instanceof Long
                ? ((Number) rawVersion).intValue()
                : 0;

        Instant generatedAt = null;
        if (root.opt("generatedAt") instanceof String text && !text.isBlank()) {
            generatedAt = parseTimestamp(text.trim());
            if (generatedAt == null) {
                LOG.warn("Discarding malformed generatedAt '{}'", text);
            }
        }

        List<String> sessions = new ArrayList<>();
        if (root.opt("sourceSessions") instanceof JSONArray arr) {
            for (int i = 0; i < arr.length(); i++) {
                if (!(arr.opt(i) instanceof String label)) {
                    LOG.warn("Discarding malformed sourceSessions");
                    sessions.clear();
                    break;
                }
                if (!sessions.contains(label)) {
                    sessions.add(label);
                }
            }
        }

        List<Question> questions = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        JSONArray items = root.optJSONArray("questions");
        if (items != null) {
            for (int i = 0; i < items.length(); i++) {
                JSONObject item = items.optJSONObject(i);
                String label = item == null ? "<not an object>" : item.optString("id", "<missing id>");
                try {
                    Question q = fromJson(item);
                    QuestionValidator.check(q);
                    if (!ids.add(q.id)) {
                        throw new ValidationException(ValidationException.DUPLICATE_ID, "duplicate id " + q.id);
                    }
                    questions.add(q);
                } catch (ValidationException e) {
                    dropped.add(label);
                }
            }
        }
        return new Repaired(Dataset.of(version, generatedAt, sessions, questions), dropped);
    }

    public void write(Path file, Dataset dataset) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = toJson(dataset).toString(2) + "\n";
        Path tmp = Files.createTempFile(parent, file.getFileName().toString() + ".", ".tmp");
        try {
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOG.info("Wrote {} question(s), version {} to {}", dataset.size(), dataset.version, file);
    }

    public static JSONObject toJson(Dataset dataset) {
        JSONObject root = new JSONObject();
        root.put("version", dataset.version);
        root.put("generatedAt", dataset.generatedAt == null ? JSONObject.NULL : dataset.generatedAt.toString());
        root.put("sourceSessions", new JSONArray(dataset.sourceSessions));
        JSONArray questions = new JSONArray();
        for (Question q : dataset.questions.values()) {
            questions.put(toJson(q));
        }
        root.put("questions", questions);
        return root;
    }

    public static JSONObject toJson(Question q) {
        JSONObject o = new JSONObject();
        o.put("id", q.id);
        o.put("category", q.category);
        o.put("year", q.year);
        o.put("text", q.text);
        o.put("choices", new JSONArray(q.choices));
        o.put("answerIndex", q.answerIndex);
        o.put("explanation", q.explanation);
        o.put("sourceUrl", q.sourceUrl == null ? "" : q.sourceUrl);
        return o;
    }

    static Question fromJson(JSONObject o) throws ValidationException {
        if (o == null) {
            throw new ValidationException(ValidationException.MISSING_FIELD, "not an object");
        }
        if (!(o.opt("year") instanceof Integer year)) {
            throw new ValidationException(ValidationException.BAD_YEAR, "year must be an integer");
        }
        if (!(o.opt("answerIndex") instanceof Integer answerIndex)) {
            throw new ValidationException(ValidationException.BAD_ANSWER_INDEX, "answerIndex must be an integer");
        }
        JSONArray rawChoices = o.optJSONArray("choices");
        if (rawChoices == null) {
            throw new ValidationException(ValidationException.TOO_FEW_CHOICES, "choices must be a list");
        }
        List<String> choices = new ArrayList<>(rawChoices.length());
        for (int i = 0; i < rawChoices.length(); i++) {
            if (!(rawChoices.opt(i) instanceof String choice)) {
                throw new ValidationException(ValidationException.TOO_FEW_CHOICES, "choice " + i + " is not a string");
            }
            choices.add(choice);
        }
        return Question.builder()
                .id(stringOrNull(o, "id"))
                .category(stringOrNull(o, "category"))
                .year(year)
                .text(stringOrNull(o, "text"))
                .choices(List.copyOf(choices))
                .answerIndex(answerIndex)
                .explanation(stringOrNull(o, "explanation"))
                .sourceUrl(o.optString("sourceUrl", ""))
                .build();
    }

    private static Instant parseTimestamp(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static String stringOrNull(JSONObject o, String key) {
        return o.opt(key) instanceof String s ? s : null;
    }

    public record Repaired(Dataset dataset, List<String> droppedIds) {
    }
}
