package com.kakomon.extract;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Deterministic API page parser. The payload is either a top-level array or an object holding the
 * list under {@code questions}, {@code items} or {@code data}; the next-page token sits beside it.
 */
public final class ApiPageExtractor implements Extractor {
    private static final String[] LIST_KEYS = {"questions", "items", "data"};
    private static final String[] NEXT_KEYS = {"next", "nextPage", "next_page_token", "nextToken"};
    private static final String[] TOTAL_KEYS = {"total", "totalCount", "count"};
    private static final Pattern PATH_SPLIT = Pattern.compile("\\s*(?:»|＞|>)\\s*");

    @Override
    public ExtractionResult extract(String rawBody) throws ExtractionException {
        String raw = rawBody == null ? "" : rawBody.trim();
        if (raw.isEmpty()) {
            throw new ExtractionException("empty api payload");
        }
        JSONArray items;
        JSONObject root = null;
        try {
            if (raw.startsWith("[")) {
                items = new JSONArray(raw);
            } else {
                root = new JSONObject(raw);
                items = findList(root);
            }
        } catch (JSONException e) {
            throw new ExtractionException("api payload is not json: " + e.getMessage(), e);
        }
        if (items == null) {
            throw new ExtractionException("api payload has no questions/items/data list");
        }

        List<RawQuestion> candidates = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            if (item == null) {
                skipped++;
                continue;
            }
            String text = firstNonBlank(item, "question", "text", "body");
            if (text.isEmpty()) {
                skipped++;
                continue;
            }
            candidates.add(RawQuestion.builder()
                    .origin(ExtractionMode.API)
                    .sequence(sequenceOf(item))
                    .yearLabel(firstNonBlank(item, "era", "yearLabel", "year"))
                    .categorySegments(categoryOf(item))
                    .text(text)
                    .choices(choicesOf(item))
                    .answerMarker(firstNonBlank(item, "answer", "answerIndex", "correct"))
                    .explanation(firstNonBlank(item, "explanation", "commentary"))
                    .sourceUrl(firstNonBlank(item, "url", "sourceUrl"))
                    .build());
        }

        Continuation continuation = root == null
                ? Continuation.done()
                : Continuation.nextPage(firstNonBlank(root, NEXT_KEYS));
        return new ExtractionResult(candidates, continuation, totalOf(root), Map.of(), skipped);
    }

    private JSONArray findList(JSONObject root) {
        for (String key : LIST_KEYS) {
            if (root.opt(key) instanceof JSONArray arr) {
                return arr;
            }
        }
        return null;
    }

    private Integer sequenceOf(JSONObject item) {
        for (String key : new String[]{"no", "number", "qno"}) {
            Object value = item.opt(key);
            if (value instanceof Number n) {
                return n.intValue();
            }
            if (value instanceof String s && !s.isBlank()) {
                try {
                    return Integer.parseInt(s.trim());
                } catch (NumberFormatException ignored) {
                    // non-numeric labels such as "午前1" fall through to the running index
                }
            }
        }
        return null;
    }

    private List<String> choicesOf(JSONObject item) {
        Object value = item.opt("choices");
        if (!(value instanceof JSONArray)) {
            value = item.opt("options");
        }
        if (!(value instanceof JSONArray arr)) {
            return List.of();
        }
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            Object choice = arr.opt(i);
            if (choice instanceof JSONObject obj) {
                out.add(firstNonBlank(obj, "text", "label", "value"));
            } else {
                out.add(choice == null || choice == JSONObject.NULL ? "" : String.valueOf(choice));
            }
        }
        return out;
    }

    private List<String> categoryOf(JSONObject item) {
        Object value = item.opt("category");
        if (value == null || value == JSONObject.NULL) {
            value = item.opt("categoryPath");
        }
        List<String> out = new ArrayList<>();
        if (value instanceof JSONArray arr) {
            for (int i = 0; i < arr.length(); i++) {
                String part = arr.optString(i, "").trim();
                if (!part.isEmpty()) {
                    out.add(part);
                }
            }
        } else if (value != null && value != JSONObject.NULL) {
            for (String part : PATH_SPLIT.split(String.valueOf(value))) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return out;
    }

    private OptionalInt totalOf(JSONObject root) {
        if (root == null) {
            return OptionalInt.empty();
        }
        for (String key : TOTAL_KEYS) {
            int value = root.optInt(key, -1);
            if (value > 0) {
                return OptionalInt.of(value);
            }
        }
        return OptionalInt.empty();
    }

    private static String firstNonBlank(JSONObject obj, String... keys) {
        for (String key : keys) {
            Object value = obj.opt(key);
            if (value == null || value == JSONObject.NULL) {
                continue;
            }
            String text = String.valueOf(value).trim();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return "";
    }
}
