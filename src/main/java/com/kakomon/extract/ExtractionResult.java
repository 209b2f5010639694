package com.kakomon.extract;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

public final class ExtractionResult {
    public final List<RawQuestion> candidates;
    public final Continuation continuation;
    /** Total question count advertised by the page, if any. */
    public final OptionalInt totalHint;
    /** Hidden form fields to carry into the next request. */
    public final Map<String, String> formState;
    /** Items present in the payload but not shaped like a question. */
    public final int skippedItems;

    public ExtractionResult(
            List<RawQuestion> candidates,
            Continuation continuation,
            OptionalInt totalHint,
            Map<String, String> formState,
            int skippedItems
    ) {
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.continuation = continuation == null ? Continuation.done() : continuation;
        this.totalHint = totalHint == null ? OptionalInt.empty() : totalHint;
        this.formState = formState == null ? Map.of() : Map.copyOf(formState);
        this.skippedItems = Math.max(0, skippedItems);
    }
}
