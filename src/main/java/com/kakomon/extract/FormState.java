package com.kakomon.extract;

import java.util.Map;

/**
 * The drawing form of a randomized page: where to submit, how, and which hidden fields to echo back.
 */
public record FormState(String action, boolean post, Map<String, String> hiddenFields) {
    public FormState {
        hiddenFields = hiddenFields == null ? Map.of() : Map.copyOf(hiddenFields);
    }
}
