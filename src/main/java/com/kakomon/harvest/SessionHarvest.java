package com.kakomon.harvest;

import com.kakomon.dataset.Question;

import java.util.List;

/**
 * Questions captured by one session plus its outcome. Questions are present even when the session failed.
 */
public final class SessionHarvest {
    public final SessionOutcome outcome;
    public final List<Question> questions;

    public SessionHarvest(SessionOutcome outcome, List<Question> questions) {
        this.outcome = outcome;
        this.questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
