package com.kakomon.normalize;

import com.kakomon.config.SessionMeta;
import com.kakomon.dataset.Question;
import com.kakomon.extract.RawQuestion;

import java.util.Locale;

/**
 * Converts source-native {@link RawQuestion}s into canonical {@link Question}s.
 * Stateless apart from the category table; safe to share between session workers.
 */
public final class QuestionNormalizer {
    private final CategoryMapper categories;

    public QuestionNormalizer(CategoryMapper categories) {
        this.categories = categories == null ? new CategoryMapper(null) : categories;
    }

    /**
     * @param fallbackUrl provenance used when the page carries none (usually the request URL)
     * @throws NormalizationException when the year label names an unsupported era or no year
     */
    public NormalizedQuestion normalize(RawQuestion raw, SessionMeta session, String fallbackUrl)
            throws NormalizationException {
        int year = EraConverter.toGregorian(raw.yearLabel, session.year);

        ChoiceSanitizer.Sanitized sanitized = ChoiceSanitizer.sanitize(
                raw.choicesOrEmpty(),
                ChoiceSanitizer.parseAnswerMarker(raw.answerMarker)
        );
        int answerIndex = sanitized.answerValid() ? sanitized.answerIndex() : ChoiceSanitizer.INVALID;

        String prefix = session.effectiveIdPrefix();
        String id = raw.sequence != null && raw.sequence > 0 ? IdAllocator.format(prefix, raw.sequence) : null;

        Question question = Question.builder()
                .id(id)
                .category(categories.map(raw.categorySegmentsOrEmpty(), session.category))
                .year(year)
                .text(trim(raw.text))
                .choices(sanitized.choices())
                .answerIndex(answerIndex)
                .explanation(trim(raw.explanation))
                .sourceUrl(provenance(raw.sourceUrl, fallbackUrl))
                .build();
        return new NormalizedQuestion(question, QuestionIdentity.of(question.text, question.choices));
    }

    static String provenance(String raw, String fallback) {
        if (isHttpUrl(raw)) {
            return raw.trim();
        }
        if (isHttpUrl(fallback)) {
            return fallback.trim();
        }
        return "";
    }

    private static boolean isHttpUrl(String value) {
        if (value == null) {
            return false;
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
