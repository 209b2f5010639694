package com.kakomon.extract;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ApiPageExtractorTest {
    private final ApiPageExtractor extractor = new ApiPageExtractor();

    @Test
    void extract_shouldMapAlternateKeysAndSkipNonQuestions() throws Exception {
        ExtractionResult result = extractor.extract(Fixtures.read("api_page1.json"));

        assertEquals(2, result.candidates.size());
        assertEquals(2, result.skippedItems);
        assertEquals(OptionalInt.of(3), result.totalHint);

        RawQuestion first = result.candidates.get(0);
        assertEquals(ExtractionMode.API, first.origin);
        assertEquals(Integer.valueOf(1), first.sequence);
        assertEquals("令和6年", first.yearLabel);
        assertEquals(List.of("マネジメント系", "プロジェクトマネジメント"), first.categorySegments);
        assertEquals(List.of("作業を階層的に分解する", "コストを見積もらない", "品質を定義する", "要員を解雇する"), first.choices);
        assertEquals("0", first.answerMarker);
        assertEquals("https://api.example.test/questions/1", first.sourceUrl);

        RawQuestion second = result.candidates.get(1);
        assertEquals(Integer.valueOf(2), second.sequence);
        assertEquals(List.of("テクノロジ系", "データベース"), second.categorySegments);
        assertEquals("ア", second.answerMarker);
        assertEquals("正規化はデータの冗長性を排除する。", second.explanation);
        assertEquals("", second.sourceUrl);
    }

    @Test
    void extract_shouldFollowNextToken() throws Exception {
        ExtractionResult result = extractor.extract(Fixtures.read("api_page1.json"));

        assertEquals(Continuation.Kind.NEXT_PAGE, result.continuation.kind);
        assertEquals("2", result.continuation.token);
    }

    @Test
    void extract_shouldTreatTopLevelArrayAsLastPage() throws Exception {
        ExtractionResult result = extractor.extract(Fixtures.read("api_page2.json"));

        assertEquals(Continuation.Kind.DONE, result.continuation.kind);
        assertEquals(OptionalInt.empty(), result.totalHint);
        RawQuestion only = result.candidates.get(0);
        assertEquals("2024", only.yearLabel);
        assertEquals(List.of("ストラテジ系", "企業と法務"), only.categorySegments);
    }

    @Test
    void extract_shouldTreatBlankNextAsDone() throws Exception {
        ExtractionResult result = extractor.extract("{\"items\": [], \"nextToken\": \"\"}");

        assertEquals(Continuation.Kind.DONE, result.continuation.kind);
        assertEquals(0, result.candidates.size());
    }

    @Test
    void extract_shouldRejectMalformedPayloads() {
        assertThrows(ExtractionException.class, () -> extractor.extract("<html>maintenance</html>"));
        assertThrows(ExtractionException.class, () -> extractor.extract("{\"status\": \"ok\"}"));
        assertThrows(ExtractionException.class, () -> extractor.extract(""));
    }
}
