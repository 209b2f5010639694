package com.kakomon.validate;

import com.kakomon.dataset.Question;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QuestionValidatorTest {

    private static Question.QuestionBuilder valid(String id) {
        return Question.builder()
                .id(id)
                .category("network")
                .year(2024)
                .text("OSI 参照モデルでルーティングを担う層はどれか。")
                .choices(List.of("物理層", "データリンク層", "ネットワーク層", "トランスポート層"))
                .answerIndex(2)
                .explanation("ルーティングはネットワーク層の機能である。")
                .sourceUrl("https://www.ap-siken.com/kakomon/06_aki/q1.html");
    }

    @Test
    void check_shouldAcceptWellFormedRecord() {
        assertDoesNotThrow(() -> QuestionValidator.check(valid("ap-2024-q001").build()));
        assertDoesNotThrow(() -> QuestionValidator.check(valid("ap-2024-q001").sourceUrl("").build()));
    }

    @Test
    void check_shouldClassifyFailures() {
        assertReason(ValidationException.MISSING_FIELD, valid(null).build());
        assertReason(ValidationException.MISSING_FIELD, valid("x").explanation(" ").build());
        assertReason(ValidationException.BAD_YEAR, valid("x").year(24).build());
        assertReason(ValidationException.TOO_FEW_CHOICES, valid("x").choices(List.of("only")).answerIndex(0).build());
        assertReason(ValidationException.TOO_FEW_CHOICES, valid("x").choices(Arrays.asList("a", " ", "c")).build());
        assertReason(ValidationException.BAD_ANSWER_INDEX, valid("x").answerIndex(4).build());
        assertReason(ValidationException.BAD_ANSWER_INDEX, valid("x").answerIndex(-1).build());
        assertReason(ValidationException.BAD_SOURCE_URL, valid("x").sourceUrl("ftp://host/q").build());
    }

    @Test
    void validate_shouldKeepFirstRecordPerIdAndTallyRejections() {
        Question first = valid("ap-2024-q001").build();
        Question duplicate = valid("ap-2024-q001").text("別の問題文").build();
        Question other = valid("ap-2023-q001").year(2023).category("security").build();
        Question broken = valid("ap-2024-q002").answerIndex(9).build();

        ValidationReport report = new QuestionValidator().validate(List.of(first, duplicate, other, broken));

        assertEquals(2, report.total());
        assertSame(first, report.accepted.get(0));
        assertEquals(2, report.rejected);
        assertEquals(Map.of("duplicate_id", 1, "bad_answer_index", 1), report.rejectedByReason);
        assertEquals(List.of(2023, 2024), List.copyOf(report.perYear.keySet()));
        assertEquals(Map.of("network", 1, "security", 1), report.perCategory);
    }

    @Test
    void validate_shouldHandleEmptyBatch() {
        ValidationReport report = new QuestionValidator().validate(List.of());

        assertEquals(0, report.total());
        assertEquals(0, report.rejected);
    }

    private static void assertReason(String reason, Question q) {
        ValidationException error = assertThrows(ValidationException.class, () -> QuestionValidator.check(q));
        assertEquals(reason, error.reason());
    }
}
