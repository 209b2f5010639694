package com.kakomon.validate;

import com.kakomon.dataset.Question;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Schema check and first-wins deduplication by id. One bad record never fails the batch.
 */
public final class QuestionValidator {
    private static final Logger LOG = LogManager.getLogger(QuestionValidator.class);

    public ValidationReport validate(List<Question> candidates) {
        List<Question> accepted = new ArrayList<>();
        Map<String, Integer> reasons = new TreeMap<>();
        Set<String> seenIds = new HashSet<>();
        for (Question candidate : candidates == null ? List.<Question>of() : candidates) {
            try {
                check(candidate);
                if (!seenIds.add(candidate.id)) {
                    throw new ValidationException(ValidationException.DUPLICATE_ID, "duplicate id " + candidate.id);
                }
                accepted.add(candidate);
            } catch (ValidationException e) {
                reasons.merge(e.reason(), 1, Integer::sum);
                if (ValidationException.DUPLICATE_ID.equals(e.reason())) {
                    LOG.debug("Rejected {}: {}", idOf(candidate), e.getMessage());
                } else {
                    LOG.warn("Rejected {}: {}", idOf(candidate), e.getMessage());
                }
            }
        }
        return new ValidationReport(accepted, reasons);
    }

    /**
     * Validates one record against the persisted schema.
     */
    public static void check(Question q) throws ValidationException {
        if (q == null) {
            throw new ValidationException(ValidationException.MISSING_FIELD, "null record");
        }
        requireText(q.id, "id");
        requireText(q.category, "category");
        requireText(q.text, "text");
        requireText(q.explanation, "explanation");
        if (q.year < 1000 || q.year > 9999) {
            throw new ValidationException(ValidationException.BAD_YEAR, "year is not four digits: " + q.year);
        }
        List<String> choices = q.choices == null ? List.of() : q.choices;
        for (String choice : choices) {
            if (choice == null || choice.isBlank()) {
                throw new ValidationException(ValidationException.TOO_FEW_CHOICES, "blank choice entry");
            }
        }
        if (choices.size() < 2) {
            throw new ValidationException(ValidationException.TOO_FEW_CHOICES, "choices=" + choices.size());
        }
        if (q.answerIndex < 0 || q.answerIndex >= choices.size()) {
            throw new ValidationException(
                    ValidationException.BAD_ANSWER_INDEX,
                    "answerIndex=" + q.answerIndex + " choices=" + choices.size()
            );
        }
        String url = q.sourceUrl == null ? "" : q.sourceUrl.trim();
        if (!url.isEmpty()) {
            String lower = url.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                throw new ValidationException(ValidationException.BAD_SOURCE_URL, "sourceUrl=" + url);
            }
        }
    }

    private static void requireText(String value, String field) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ValidationException.MISSING_FIELD, "missing " + field);
        }
    }

    private static String idOf(Question q) {
        return q == null || q.id == null ? "<missing id>" : q.id;
    }
}
