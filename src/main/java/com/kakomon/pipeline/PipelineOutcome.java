package com.kakomon.pipeline;

import com.kakomon.dataset.MergeResult;
import com.kakomon.harvest.SessionOutcome;
import com.kakomon.validate.ValidationReport;

import java.nio.file.Path;
import java.util.List;

public final class PipelineOutcome {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    public final List<SessionOutcome> sessions;
    public final ValidationReport validation;
    public final MergeResult merge;
    /** Where the dataset was written, null when the write was skipped. */
    public final Path written;

    public PipelineOutcome(List<SessionOutcome> sessions, ValidationReport validation, MergeResult merge, Path written) {
        this.sessions = List.copyOf(sessions);
        this.validation = validation;
        this.merge = merge;
        this.written = written;
    }

    public boolean allFailed() {
        if (sessions.isEmpty()) {
            return false;
        }
        for (SessionOutcome outcome : sessions) {
            if (!outcome.failed()) {
                return false;
            }
        }
        return true;
    }

    public int exitCode() {
        return allFailed() ? EXIT_FAILED : EXIT_OK;
    }
}
