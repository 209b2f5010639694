package com.kakomon.config;

import com.kakomon.normalize.EraConverter;
import com.kakomon.normalize.NormalizationException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only table of configured sessions, keyed by label. Iteration follows the sorted entry keys.
 */
public final class SessionCatalog {
    private final Map<String, SessionMeta> sessions;
    private final List<String> order;

    public SessionCatalog(Collection<SessionMeta> sessions) {
        Map<String, SessionMeta> map = new LinkedHashMap<>();
        for (SessionMeta meta : sessions) {
            map.put(meta.label, meta);
        }
        this.sessions = Map.copyOf(map);
        this.order = List.copyOf(map.keySet());
    }

    public static SessionCatalog empty() {
        return new SessionCatalog(List.of());
    }

    public static SessionCatalog load(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            return empty();
        }
        try {
            return parse(new JSONObject(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (JSONException e) {
            throw new IllegalArgumentException("invalid sessions file " + file + ": " + e.getMessage(), e);
        }
    }

    public static SessionCatalog parse(JSONObject root) {
        List<SessionMeta> out = new ArrayList<>();
        for (String key : root.keySet().stream().sorted().toList()) {
            JSONObject entry = root.optJSONObject(key);
            if (entry == null) {
                throw new IllegalArgumentException("session " + key + " must be an object");
            }
            out.add(parseEntry(key, entry));
        }
        return new SessionCatalog(out);
    }

    private static SessionMeta parseEntry(String key, JSONObject entry) {
        String label = entry.optString("label", key).trim();
        if (label.isEmpty()) {
            label = key;
        }
        String startUrl = blankToNull(entry.optString("start_url", ""));
        String apiUrl = blankToNull(entry.optString("api_url", ""));
        if (startUrl == null && apiUrl == null) {
            throw new IllegalArgumentException("session " + label + " needs api_url or start_url");
        }
        int year = entry.optInt("year", 0);
        if (year <= 0) {
            try {
                year = EraConverter.toGregorian(label);
            } catch (NormalizationException e) {
                throw new IllegalArgumentException("session " + label + " has no usable year", e);
            }
        }
        return SessionMeta.builder()
                .label(label)
                .year(year)
                .startUrl(startUrl)
                .apiUrl(apiUrl)
                .category(blankToNull(entry.optString("category", "")))
                .idPrefix(blankToNull(entry.optString("id_prefix", "")))
                .form(parseForm(entry.optJSONObject("form")))
                .build();
    }

    private static Map<String, List<String>> parseForm(JSONObject form) {
        if (form == null) {
            return Map.of();
        }
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String name : form.keySet().stream().sorted().toList()) {
            Object value = form.get(name);
            List<String> values = new ArrayList<>();
            if (value instanceof JSONArray arr) {
                for (int i = 0; i < arr.length(); i++) {
                    values.add(String.valueOf(arr.get(i)));
                }
            } else {
                values.add(String.valueOf(value));
            }
            out.put(name, List.copyOf(values));
        }
        return out;
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }

    public List<SessionMeta> all() {
        List<SessionMeta> out = new ArrayList<>(order.size());
        for (String label : order) {
            out.add(sessions.get(label));
        }
        return out;
    }

    /**
     * Resolves {@code all} or a comma separated list of labels; unknown labels are a configuration error.
     */
    public List<SessionMeta> resolve(String selector) {
        String raw = selector == null ? "" : selector.trim();
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("no sessions selected");
        }
        if (raw.toLowerCase(Locale.ROOT).equals("all")) {
            return all();
        }
        List<SessionMeta> out = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String token : raw.split(",")) {
            String label = token.trim();
            if (label.isEmpty()) {
                continue;
            }
            SessionMeta meta = sessions.get(label);
            if (meta == null) {
                missing.add(label);
            } else if (!out.contains(meta)) {
                out.add(meta);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Unknown sessions: " + String.join(", ", missing));
        }
        return out;
    }

    public SessionCatalog plus(Collection<SessionMeta> more) {
        Map<String, SessionMeta> merged = new LinkedHashMap<>();
        for (SessionMeta meta : all()) {
            merged.put(meta.label, meta);
        }
        for (SessionMeta meta : more) {
            merged.putIfAbsent(meta.label, meta);
        }
        return new SessionCatalog(merged.values());
    }
}
