package com.kakomon.normalize;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Trims choices, drops blank ones and re-targets the answer index at the surviving entry.
 */
public final class ChoiceSanitizer {
    public static final int INVALID = -1;

    private static final String KATAKANA_MARKERS = "アイウエオカ";
    private static final String LATIN_MARKERS = "abcdef";

    private ChoiceSanitizer() {
    }

    public static Sanitized sanitize(List<String> rawChoices, int rawAnswerIndex) {
        List<String> kept = new ArrayList<>();
        int answer = INVALID;
        if (rawChoices != null) {
            for (int i = 0; i < rawChoices.size(); i++) {
                String raw = rawChoices.get(i);
                String trimmed = raw == null ? "" : raw.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (i == rawAnswerIndex) {
                    answer = kept.size();
                }
                kept.add(trimmed);
            }
        }
        return new Sanitized(List.copyOf(kept), answer);
    }

    /**
     * Parses the site's answer marker: ア..カ, a..f (either case) or a zero-based integer.
     * Returns {@link #INVALID} when the marker is unrecognized.
     */
    public static int parseAnswerMarker(String marker) {
        if (marker == null) {
            return INVALID;
        }
        String text = Normalizer.normalize(marker, Normalizer.Form.NFKC).trim();
        if (text.isEmpty()) {
            return INVALID;
        }
        if (text.length() == 1) {
            int kana = KATAKANA_MARKERS.indexOf(text.charAt(0));
            if (kana >= 0) {
                return kana;
            }
            int latin = LATIN_MARKERS.indexOf(text.toLowerCase(Locale.ROOT).charAt(0));
            if (latin >= 0) {
                return latin;
            }
        }
        try {
            int index = Integer.parseInt(text);
            return index < 0 ? INVALID : index;
        } catch (NumberFormatException ignored) {
            return INVALID;
        }
    }

    public record Sanitized(List<String> choices, int answerIndex) {
        public boolean answerValid() {
            return answerIndex >= 0 && answerIndex < choices.size();
        }
    }
}
