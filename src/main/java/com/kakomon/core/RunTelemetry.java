package com.kakomon.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step timings and counters of one harvest run, printed as the run summary.
 */
public final class RunTelemetry {
    public static final String STEP_DISCOVER = "DISCOVER";
    public static final String STEP_HARVEST = "HARVEST";
    public static final String STEP_VALIDATE = "VALIDATE";
    public static final String STEP_MERGE = "MERGE";
    public static final String STEP_WRITE = "WRITE";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runMode;
    private final Clock clock;
    private final Instant startedAt;
    private Instant finishedAt;

    private int sessionsTotal;
    private int sessionsFailed;
    private int fetches;
    private int cacheHits;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Instant> stepStarts = new LinkedHashMap<>();

    public RunTelemetry(String runMode, Clock clock) {
        this.runMode = blankTo(runMode, "sequential");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStarts.put(key, clock.instant());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Instant started = stepStarts.remove(key);
        if (started != null) {
            stat.elapsedMs += Math.max(0L, Duration.between(started, clock.instant()).toMillis());
        }
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        if (note != null && !note.isBlank()) {
            stat.note = stat.note.isEmpty() ? note.trim() : stat.note + "; " + note.trim();
        }
        errorsTotal += (int) Math.max(0L, errorCount);
    }

    public synchronized void recordSession(boolean failed, int sessionFetches, int sessionCacheHits) {
        sessionsTotal++;
        if (failed) {
            sessionsFailed++;
        }
        fetches += Math.max(0, sessionFetches);
        cacheHits += Math.max(0, sessionCacheHits);
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = clock.instant();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? clock.instant() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.note));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? clock.instant() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("sessions=").append(sessionsTotal).append(" failed=").append(sessionsFailed).append('\n');
        sb.append("fetches=").append(fetches).append(" cache_hits=").append(cacheHits).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.note.isBlank()) {
                sb.append(" note=").append(stat.note);
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount, String note) {
    }
}
