package com.kakomon.pipeline;

import com.kakomon.config.Config;
import com.kakomon.config.SessionMeta;
import com.kakomon.core.RunTelemetry;
import com.kakomon.dataset.Dataset;
import com.kakomon.dataset.DatasetMerger;
import com.kakomon.dataset.DatasetStore;
import com.kakomon.dataset.MergeResult;
import com.kakomon.dataset.Question;
import com.kakomon.fetch.Fetcher;
import com.kakomon.fetch.HttpTransport;
import com.kakomon.fetch.ResponseCache;
import com.kakomon.fetch.Throttle;
import com.kakomon.harvest.DebugPageWriter;
import com.kakomon.harvest.HarvestLimits;
import com.kakomon.harvest.HarvestState;
import com.kakomon.harvest.ResumeState;
import com.kakomon.harvest.SessionHarvest;
import com.kakomon.harvest.SessionHarvester;
import com.kakomon.harvest.SessionOutcome;
import com.kakomon.normalize.QuestionNormalizer;
import com.kakomon.validate.QuestionValidator;
import com.kakomon.validate.ValidationReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 模块说明：HarvestPipeline（class）。
 * 主要职责：逐场次（或并行）抓取，汇总为一个批次后统一校验、合并并原子写出数据集。
 * 使用建议：取消标志置位后不再发出新请求，但已抓到的数据仍会完成校验与写盘。
 */
public final class HarvestPipeline {
    private static final Logger LOG = LogManager.getLogger(HarvestPipeline.class);

    private final Config config;
    private final HttpTransport transport;
    private final ResponseCache cache;
    private final QuestionNormalizer normalizer;
    private final DatasetStore store;
    private final DatasetMerger merger;
    private final AtomicBoolean cancelled;

    public HarvestPipeline(
            Config config,
            HttpTransport transport,
            ResponseCache cache,
            QuestionNormalizer normalizer,
            DatasetStore store,
            DatasetMerger merger,
            AtomicBoolean cancelled
    ) {
        this.config = config;
        this.transport = transport;
        this.cache = cache == null ? ResponseCache.disabled() : cache;
        this.normalizer = normalizer;
        this.store = store == null ? new DatasetStore() : store;
        this.merger = merger;
        this.cancelled = cancelled == null ? new AtomicBoolean(false) : cancelled;
    }

    public PipelineOutcome run(HarvestOptions options, RunTelemetry telemetry) throws IOException {
        Path input = options.inputPath();
        Dataset existing = input == null ? null : store.load(input).orElse(null);
        if (existing != null) {
            LOG.info("Loaded prior dataset {} (version={}, questions={})", input, existing.version, existing.size());
        }
        ResumeState resume = options.resume && existing != null ? ResumeState.from(existing) : ResumeState.none();

        telemetry.startStep(RunTelemetry.STEP_HARVEST);
        List<SessionHarvest> harvests = options.parallel && options.sessions.size() > 1
                ? harvestParallel(options.sessions, resume)
                : harvestSequential(options.sessions, resume);
        int harvested = 0;
        int sessionErrors = 0;
        for (SessionHarvest harvest : harvests) {
            harvested += harvest.questions.size();
            sessionErrors += harvest.outcome.extractionFailures + harvest.outcome.normalizationFailures;
            telemetry.recordSession(harvest.outcome.failed(), harvest.outcome.fetches, harvest.outcome.cacheHits);
        }
        telemetry.endStep(RunTelemetry.STEP_HARVEST, options.sessions.size(), harvested, sessionErrors,
                cancelled.get() ? "cancelled" : "");

        telemetry.startStep(RunTelemetry.STEP_VALIDATE);
        List<Question> batch = new ArrayList<>();
        for (SessionHarvest harvest : harvests) {
            batch.addAll(harvest.questions);
        }
        ValidationReport report = new QuestionValidator().validate(batch);
        telemetry.endStep(RunTelemetry.STEP_VALIDATE, batch.size(), report.total(), report.rejected);
        List<String> contributing = contributingSessions(harvests, report.accepted);

        telemetry.startStep(RunTelemetry.STEP_MERGE);
        MergeResult merge = merger.merge(existing, report.accepted, contributing, options.policy);
        telemetry.endStep(RunTelemetry.STEP_MERGE, report.total(), merge.insertedCount + merge.replacedCount, 0L,
                merge.toString());

        Path written = null;
        telemetry.startStep(RunTelemetry.STEP_WRITE);
        if (shouldWrite(merge, existing, input, options.out)) {
            store.write(options.out, merge.merged);
            written = options.out;
        } else {
            LOG.info("Dataset unchanged; not rewriting {}", options.out);
        }
        telemetry.endStep(RunTelemetry.STEP_WRITE, merge.merged.size(), written == null ? 0 : merge.merged.size(), 0L);

        List<SessionOutcome> outcomes = new ArrayList<>();
        for (SessionHarvest harvest : harvests) {
            outcomes.add(harvest.outcome);
        }
        return new PipelineOutcome(outcomes, report, merge, written);
    }

    /**
     * Labels of sessions that produced at least one accepted record, in session order.
     */
    static List<String> contributingSessions(List<SessionHarvest> harvests, List<Question> accepted) {
        Set<Question> acceptedRecords = Collections.newSetFromMap(new IdentityHashMap<>());
        acceptedRecords.addAll(accepted);
        List<String> out = new ArrayList<>();
        for (SessionHarvest harvest : harvests) {
            for (Question q : harvest.questions) {
                if (acceptedRecords.contains(q)) {
                    out.add(harvest.outcome.label);
                    break;
                }
            }
        }
        return out;
    }

    static boolean shouldWrite(MergeResult merge, Dataset existing, Path input, Path out) {
        if (merge.changed) {
            return true;
        }
        if (existing == null) {
            return false;
        }
        return input == null || !input.toAbsolutePath().normalize().equals(out.toAbsolutePath().normalize());
    }

    private List<SessionHarvest> harvestSequential(List<SessionMeta> sessions, ResumeState resume) {
        SessionHarvester harvester = newHarvester(newThrottle());
        List<SessionHarvest> out = new ArrayList<>();
        for (SessionMeta session : sessions) {
            out.add(harvester.harvest(session, resume));
        }
        return out;
    }

    private List<SessionHarvest> harvestParallel(List<SessionMeta> sessions, ResumeState resume) {
        ExecutorService pool = Executors.newFixedThreadPool(sessions.size());
        CompletionService<Indexed> completion = new ExecutorCompletionService<>(pool);
        SessionHarvest[] results = new SessionHarvest[sessions.size()];
        int submitted = 0;
        try {
            for (int i = 0; i < sessions.size(); i++) {
                int index = i;
                SessionMeta session = sessions.get(i);
                completion.submit(() -> new Indexed(index, newHarvester(newThrottle()).harvest(session, resume)));
                submitted++;
            }
            for (int i = 0; i < submitted; i++) {
                Future<Indexed> future = completion.take();
                try {
                    Indexed done = future.get();
                    results[done.index] = done.harvest;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.error("Session worker crashed: {}", cause.toString(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
        } finally {
            pool.shutdown();
        }

        List<SessionHarvest> out = new ArrayList<>();
        for (int i = 0; i < results.length; i++) {
            out.add(results[i] != null ? results[i] : crashed(sessions.get(i)));
        }
        return out;
    }

    private SessionHarvest crashed(SessionMeta session) {
        SessionOutcome outcome = SessionOutcome.builder()
                .label(session.label)
                .mode(session.mode())
                .state(HarvestState.FAILED)
                .reason("worker_error")
                .totalHint(-1)
                .build();
        return new SessionHarvest(outcome, List.of());
    }

    private Throttle newThrottle() {
        return new Throttle(Math.max(0L, config.getLong("fetch.throttle_ms", 1000L)));
    }

    private SessionHarvester newHarvester(Throttle throttle) {
        Fetcher fetcher = Fetcher.fromConfig(config, transport, cache, throttle);
        return new SessionHarvester(
                fetcher,
                normalizer,
                HarvestLimits.fromConfig(config),
                DebugPageWriter.fromConfig(config),
                cancelled
        );
    }

    private record Indexed(int index, SessionHarvest harvest) {
    }
}
