package com.kakomon.extract;

public interface Extractor {

    ExtractionResult extract(String rawBody) throws ExtractionException;

    static Extractor forMode(ExtractionMode mode) {
        return mode == ExtractionMode.API ? new ApiPageExtractor() : new HtmlQuestionExtractor();
    }
}
