package com.kakomon.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        TickingClock clock = new TickingClock(Instant.parse("2026-02-23T00:00:00Z"));
        RunTelemetry telemetry = new RunTelemetry("parallel", clock);
        telemetry.startStep(RunTelemetry.STEP_HARVEST);
        clock.advance(Duration.ofMillis(1500));
        telemetry.recordSession(false, 12, 3);
        telemetry.recordSession(true, 2, 0);
        telemetry.endStep(RunTelemetry.STEP_HARVEST, 2, 40, 1, "cancelled");
        telemetry.startStep(RunTelemetry.STEP_WRITE);
        telemetry.endStep(RunTelemetry.STEP_WRITE, 40, 40, 0);
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertEquals(1500L, telemetry.totalElapsedMs());
        assertTrue(summary.contains("run_mode=parallel"));
        assertTrue(summary.contains("started_at=2026-02-23T00:00:00Z"));
        assertTrue(summary.contains("total_elapsed_ms=1500"));
        assertTrue(summary.contains("sessions=2 failed=1"));
        assertTrue(summary.contains("fetches=14 cache_hits=3"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("HARVEST elapsed_ms=1500 in=2 out=40 err=1 note=cancelled"));
        assertTrue(summary.contains("WRITE elapsed_ms=0 in=40 out=40 err=0"));
    }

    @Test
    void endStep_shouldAccumulateRepeatedStepsUnderOneName() {
        RunTelemetry telemetry = new RunTelemetry(" ", Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        telemetry.startStep("merge");
        telemetry.endStep("merge", 3, 2, 0, "first");
        telemetry.startStep(RunTelemetry.STEP_MERGE);
        telemetry.endStep(RunTelemetry.STEP_MERGE, 4, 1, -5, "second");
        telemetry.endStep(null, 1, 1, 0);

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();

        assertEquals("sequential", telemetry.runMode());
        assertEquals(2, records.size());
        assertEquals(new RunTelemetry.StepRecord("MERGE", 0L, 7L, 3L, 0L, "first; second"), records.get(0));
        assertEquals("UNKNOWN_STEP", records.get(1).name());
        assertEquals(0, telemetry.errorsTotal());
    }

    private static final class TickingClock extends Clock {
        private Instant now;

        private TickingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
