package com.kakomon.validate;

/**
 * A single record failed the output schema. {@link #reason} is a stable tally key.
 */
public class ValidationException extends Exception {
    public static final String MISSING_FIELD = "missing_field";
    public static final String BAD_YEAR = "bad_year";
    public static final String TOO_FEW_CHOICES = "too_few_choices";
    public static final String BAD_ANSWER_INDEX = "bad_answer_index";
    public static final String BAD_SOURCE_URL = "bad_source_url";
    public static final String DUPLICATE_ID = "duplicate_id";

    private final String reason;

    public ValidationException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
