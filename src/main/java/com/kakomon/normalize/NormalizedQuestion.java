package com.kakomon.normalize;

import com.kakomon.dataset.Question;

/**
 * A normalized question plus its content identity. {@code question.id} is null when the source
 * published no sequence number; the harvester assigns one.
 */
public record NormalizedQuestion(Question question, String identity) {

    public boolean hasId() {
        return question.id != null && !question.id.isBlank();
    }

    public NormalizedQuestion withId(String id) {
        return new NormalizedQuestion(question.toBuilder().id(id).build(), identity);
    }
}
