package com.kakomon.normalize;

import com.kakomon.config.SessionMeta;
import com.kakomon.dataset.Question;
import com.kakomon.extract.ExtractionMode;
import com.kakomon.extract.RawQuestion;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuestionNormalizerTest {
    private static final SessionMeta SESSION = SessionMeta.builder()
            .label("令和6年秋期")
            .year(2024)
            .startUrl("https://www.ap-siken.com/apkakomon.php")
            .form(Map.of("times[]", List.of("06_aki")))
            .build();

    private final QuestionNormalizer normalizer = new QuestionNormalizer(new CategoryMapper(List.of(
            new CategoryMapper.Rule(List.of("ネットワーク"), "network")
    )));

    private RawQuestion.RawQuestionBuilder raw() {
        return RawQuestion.builder()
                .origin(ExtractionMode.HTML)
                .sequence(7)
                .yearLabel("令和6年秋期")
                .categorySegments(List.of("テクノロジ系", "ネットワーク"))
                .text("  IPv6 アドレスのビット長はどれか。 ")
                .choices(List.of(" 32 ", "64", "128", "256"))
                .answerMarker("ウ")
                .explanation(" 128 ビットである。 ")
                .sourceUrl("https://www.ap-siken.com/kakomon/06_aki/q7.html");
    }

    @Test
    void normalize_shouldProduceCanonicalQuestion() throws Exception {
        NormalizedQuestion result = normalizer.normalize(raw().build(), SESSION, "https://fallback.test/");

        Question q = result.question();
        assertEquals("ap-06_aki-q007", q.id);
        assertEquals(2024, q.year);
        assertEquals("network", q.category);
        assertEquals("IPv6 アドレスのビット長はどれか。", q.text);
        assertEquals(List.of("32", "64", "128", "256"), q.choices);
        assertEquals(2, q.answerIndex);
        assertEquals("128 ビットである。", q.explanation);
        assertEquals("https://www.ap-siken.com/kakomon/06_aki/q7.html", q.sourceUrl);
        assertEquals(QuestionIdentity.of(q.text, q.choices), result.identity());
    }

    @Test
    void normalize_shouldUseFallbacksForMissingFields() throws Exception {
        RawQuestion unnumbered = raw().sequence(null).yearLabel("").sourceUrl("/relative").build();

        NormalizedQuestion result = normalizer.normalize(unnumbered, SESSION, "https://www.ap-siken.com/apkakomon.php");

        assertFalse(result.hasId());
        assertNull(result.question().id);
        assertEquals(2024, result.question().year);
        assertEquals("https://www.ap-siken.com/apkakomon.php", result.question().sourceUrl);
        assertTrue(result.withId("ap-06_aki-q100").hasId());
    }

    @Test
    void normalize_shouldMarkUnparseableAnswerInvalid() throws Exception {
        NormalizedQuestion result = normalizer.normalize(raw().answerMarker("?").build(), SESSION, "");

        assertEquals(ChoiceSanitizer.INVALID, result.question().answerIndex);
    }

    @Test
    void normalize_shouldRejectUnsupportedEra() {
        assertThrows(NormalizationException.class,
                () -> normalizer.normalize(raw().yearLabel("昭和60年").build(), SESSION, ""));
    }

    @Test
    void identity_shouldIgnoreWhitespaceDifferences() {
        assertEquals(
                QuestionIdentity.of("A  question", List.of("x", " y")),
                QuestionIdentity.of(" A question ", List.of("x ", "y"))
        );
        assertFalse(QuestionIdentity.of("A", List.of("x", "y")).equals(QuestionIdentity.of("A", List.of("y", "x"))));
    }
}
