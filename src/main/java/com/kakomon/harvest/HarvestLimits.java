package com.kakomon.harvest;

import com.kakomon.config.Config;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-session bounds. Every session loop ends by convergence or by one of these caps.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class HarvestLimits {
    /** Randomized mode: fetches per session, the priming request included. */
    public final int maxRequests;
    /** Randomized mode: draws per session. */
    public final int maxQno;
    /** Deterministic mode: pages per session. */
    public final int maxPages;
    /** Consecutive already-seen draws that count as convergence. */
    public final int convergenceStreak;
    /** Consecutive extraction failures that fail the session. */
    public final int failureTolerance;
    public final boolean continueOnRateLimit;
    public final String pageParam;

    public static HarvestLimits fromConfig(Config config) {
        return HarvestLimits.builder()
                .maxRequests(Math.max(1, config.getInt("harvest.max_requests", 200)))
                .maxQno(Math.max(1, config.getInt("harvest.max_qno", 80)))
                .maxPages(Math.max(1, config.getInt("harvest.api.max_pages", 500)))
                .convergenceStreak(Math.max(1, config.getInt("harvest.convergence.streak", 15)))
                .failureTolerance(Math.max(1, config.getInt("harvest.extraction.failure_tolerance", 5)))
                .continueOnRateLimit(config.getBoolean("harvest.rate_limit.continue", false))
                .pageParam(config.getString("harvest.api.page_param", "page"))
                .build();
    }
}
