package com.kakomon.harvest;

import com.kakomon.extract.ExtractionMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Terminal report of one session run.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class SessionOutcome {
    public final String label;
    public final ExtractionMode mode;
    public final HarvestState state;
    /** Why the session stopped, e.g. {@code done}, {@code streak}, {@code max_requests}, {@code network}. */
    public final String reason;
    /** Fetches issued, cache hits included. */
    public final int fetches;
    public final int cacheHits;
    public final int candidates;
    public final int newQuestions;
    public final int extractionFailures;
    public final int normalizationFailures;
    /** Total advertised by the source, -1 when unknown. */
    public final int totalHint;
    public final long elapsedMs;

    public boolean failed() {
        return state == HarvestState.FAILED;
    }

    public String summaryLine() {
        return String.format(
                Locale.ROOT,
                "%s [%s] %s(%s) fetches=%d cache_hits=%d candidates=%d new=%d extract_fail=%d normalize_fail=%d%s elapsed_ms=%d",
                label,
                mode,
                state,
                reason,
                fetches,
                cacheHits,
                candidates,
                newQuestions,
                extractionFailures,
                normalizationFailures,
                totalHint >= 0 ? " hint=" + totalHint : "",
                elapsedMs
        );
    }
}
