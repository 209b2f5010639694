package com.kakomon.dataset;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Canonical question record as persisted in the seed dataset.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class Question {
    public final String id;
    public final String category;
    public final int year;
    public final String text;
    public final List<String> choices;
    public final int answerIndex;
    public final String explanation;
    public final String sourceUrl;
}
