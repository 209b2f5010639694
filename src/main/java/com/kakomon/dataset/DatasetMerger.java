package com.kakomon.dataset;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模块说明：DatasetMerger（class）。
 * 主要职责：按冲突策略把新抓取的批次合并进已有数据集，只有内容真正变化时才推进 version 与 generatedAt。
 * 使用建议：无变化的合并原样返回已有数据集对象，调用方据此跳过写盘。
 */
public final class DatasetMerger {
    private static final Logger LOG = LogManager.getLogger(DatasetMerger.class);

    private final Clock clock;

    public DatasetMerger(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * @param existing prior generation, null when there is none
     * @param incoming validated batch, unique by id
     * @param incomingSessions labels of the sessions that contributed to {@code incoming}
     */
    public MergeResult merge(Dataset existing, List<Question> incoming, List<String> incomingSessions, MergePolicy policy) {
        Dataset base = existing == null ? Dataset.empty() : existing;
        MergePolicy effective = policy == null ? MergePolicy.PREFER_NEW : policy;

        Map<String, Question> merged = new LinkedHashMap<>(base.questions);
        int inserted = 0;
        int replaced = 0;
        int unchanged = 0;
        for (Question q : incoming == null ? List.<Question>of() : incoming) {
            Question prior = merged.get(q.id);
            if (prior == null) {
                merged.put(q.id, q);
                inserted++;
            } else if (effective == MergePolicy.PREFER_NEW && !prior.equals(q)) {
                merged.put(q.id, q);
                replaced++;
            } else {
                unchanged++;
            }
        }

        boolean changed = inserted > 0 || replaced > 0;
        if (!changed) {
            LOG.info("Merge is a no-op: {} incoming record(s) already present, version stays {}", unchanged, base.version);
            return new MergeResult(base, 0, 0, unchanged, false);
        }

        Set<String> sessions = new LinkedHashSet<>(base.sourceSessions);
        if (incomingSessions != null) {
            sessions.addAll(incomingSessions);
        }
        Dataset next = new Dataset(base.version + 1, clock.instant(), new ArrayList<>(sessions), merged);
        LOG.info("Merged generation {}: inserted={} replaced={} unchanged={} total={}",
                next.version, inserted, replaced, unchanged, next.size());
        return new MergeResult(next, inserted, replaced, unchanged, true);
    }
}
