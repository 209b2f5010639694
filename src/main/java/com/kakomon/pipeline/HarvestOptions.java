package com.kakomon.pipeline;

import com.kakomon.config.SessionMeta;
import com.kakomon.dataset.MergePolicy;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * What one pipeline run should do, resolved from the command line and configuration.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class HarvestOptions {
    public final List<SessionMeta> sessions;
    public final Path out;
    /** Prior dataset to merge into; null means {@link #out} when resuming, else none. */
    public final Path mergeInto;
    public final boolean resume;
    public final MergePolicy policy;
    public final boolean parallel;

    public Path inputPath() {
        if (mergeInto != null) {
            return mergeInto;
        }
        return resume ? out : null;
    }
}
