package com.kakomon.config;

import com.kakomon.extract.ExtractionMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One harvesting target. Immutable; every harvester gets its own instance.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class SessionMeta {
    public final String label;
    public final int year;
    public final String startUrl;
    public final String apiUrl;
    public final String category;
    public final String idPrefix;
    /** Static form params sent with every draw, e.g. {@code times[]}. */
    public final Map<String, List<String>> form;

    public ExtractionMode mode() {
        if (apiUrl != null && !apiUrl.isBlank()) {
            return ExtractionMode.API;
        }
        if (startUrl != null && !startUrl.isBlank()) {
            return ExtractionMode.HTML;
        }
        throw new IllegalStateException("session " + label + " has neither api_url nor start_url");
    }

    public Map<String, List<String>> formOrEmpty() {
        return form == null ? Map.of() : form;
    }

    /**
     * Explicit prefix, else {@code ap-<times code>} when a {@code times[]} form value exists, else {@code ap-<year>}.
     */
    public String effectiveIdPrefix() {
        if (idPrefix != null && !idPrefix.isBlank()) {
            return idPrefix.trim();
        }
        List<String> times = formOrEmpty().get("times[]");
        if (times != null && !times.isEmpty() && !times.get(0).isBlank()) {
            return "ap-" + times.get(0).trim();
        }
        return "ap-" + year;
    }

    public String defaultCategoryOrUnknown() {
        return category == null || category.isBlank() ? "unknown" : category.trim();
    }
}
