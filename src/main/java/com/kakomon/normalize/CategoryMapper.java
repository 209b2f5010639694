package com.kakomon.normalize;

import com.kakomon.config.Config;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps raw category paths to the canonical taxonomy using an ordered rule table.
 * Segments are tried from the most specific (last) outward; within a segment the first matching rule wins.
 */
public final class CategoryMapper {
    public static final String DEFAULT_RESOURCE = "category-map.json";
    public static final String UNKNOWN = "unknown";

    private static final Pattern DELIMITERS = Pattern.compile("[/»＞>]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final List<Rule> rules;

    public CategoryMapper(List<Rule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static CategoryMapper fromConfig(Config config) throws IOException {
        String configured = config.getString("normalize.category_map.path", "");
        if (configured.isEmpty()) {
            return loadDefault();
        }
        return load(config.getPath("normalize.category_map.path"));
    }

    public static CategoryMapper loadDefault() throws IOException {
        try (InputStream in = CategoryMapper.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("classpath resource not found: " + DEFAULT_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public static CategoryMapper load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static CategoryMapper parse(String json) throws IOException {
        try {
            JSONObject root = new JSONObject(json);
            JSONArray arr = root.optJSONArray("rules");
            List<Rule> rules = new ArrayList<>();
            if (arr != null) {
                for (int i = 0; i < arr.length(); i++) {
                    JSONObject item = arr.optJSONObject(i);
                    if (item == null) {
                        continue;
                    }
                    String path = item.optString("path", "").trim();
                    JSONArray match = item.optJSONArray("match");
                    if (path.isEmpty() || match == null) {
                        continue;
                    }
                    List<String> needles = new ArrayList<>();
                    for (int j = 0; j < match.length(); j++) {
                        String needle = match.optString(j, "").trim();
                        if (!needle.isEmpty()) {
                            needles.add(needle.toLowerCase(Locale.ROOT));
                        }
                    }
                    rules.add(new Rule(needles, path));
                }
            }
            return new CategoryMapper(rules);
        } catch (JSONException e) {
            throw new IOException("invalid category map: " + e.getMessage(), e);
        }
    }

    public int ruleCount() {
        return rules.size();
    }

    /**
     * Canonical path for {@code segments}; blank input yields {@code defaultCategory}, then {@code unknown}.
     */
    public String map(List<String> segments, String defaultCategory) {
        List<String> cleaned = new ArrayList<>();
        if (segments != null) {
            for (String segment : segments) {
                if (segment != null && !segment.isBlank()) {
                    cleaned.add(segment.trim());
                }
            }
        }
        if (cleaned.isEmpty()) {
            return defaultCategory == null || defaultCategory.isBlank() ? UNKNOWN : defaultCategory.trim();
        }
        for (int i = cleaned.size() - 1; i >= 0; i--) {
            String segment = cleaned.get(i).toLowerCase(Locale.ROOT);
            for (Rule rule : rules) {
                if (rule.matches(segment)) {
                    return rule.path();
                }
            }
        }
        return singleSegment(cleaned);
    }

    private static String singleSegment(List<String> segments) {
        String joined = DELIMITERS.matcher(String.join(" ", segments)).replaceAll(" ");
        return SPACES.matcher(joined).replaceAll(" ").trim();
    }

    public record Rule(List<String> match, String path) {
        boolean matches(String lowerSegment) {
            for (String needle : match) {
                if (lowerSegment.contains(needle)) {
                    return true;
                }
            }
            return false;
        }
    }
}
