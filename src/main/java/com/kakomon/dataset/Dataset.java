package com.kakomon.dataset;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One persisted generation of the question set. Immutable; questions keep insertion order.
 */
public final class Dataset {
    public final int version;
    /** Null for a dataset that was never generated. */
    public final Instant generatedAt;
    public final List<String> sourceSessions;
    public final Map<String, Question> questions;

    public Dataset(int version, Instant generatedAt, List<String> sourceSessions, Map<String, Question> questions) {
        this.version = Math.max(0, version);
        this.generatedAt = generatedAt;
        this.sourceSessions = sourceSessions == null ? List.of() : List.copyOf(sourceSessions);
        this.questions = questions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(questions));
    }

    public static Dataset empty() {
        return new Dataset(0, null, List.of(), Map.of());
    }

    public static Dataset of(int version, Instant generatedAt, List<String> sourceSessions, List<Question> questions) {
        Map<String, Question> byId = new LinkedHashMap<>();
        for (Question q : questions) {
            byId.putIfAbsent(q.id, q);
        }
        return new Dataset(version, generatedAt, sourceSessions, byId);
    }

    public Set<String> ids() {
        return questions.keySet();
    }

    public int size() {
        return questions.size();
    }

    public boolean isEmpty() {
        return questions.isEmpty();
    }
}
