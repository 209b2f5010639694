package com.kakomon.extract;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Source-native question fields before normalization. Nothing here is canonical:
 * the year is an era label, the answer is the site's marker, choices are untrimmed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class RawQuestion {
    public final ExtractionMode origin;
    /** Question number as published by the source, null when absent. */
    public final Integer sequence;
    public final String yearLabel;
    public final List<String> categorySegments;
    public final String text;
    public final List<String> choices;
    public final String answerMarker;
    public final String explanation;
    public final String sourceUrl;

    public List<String> categorySegmentsOrEmpty() {
        return categorySegments == null ? List.of() : categorySegments;
    }

    public List<String> choicesOrEmpty() {
        return choices == null ? List.of() : choices;
    }
}
