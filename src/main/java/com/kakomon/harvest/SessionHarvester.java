package com.kakomon.harvest;

import com.kakomon.config.SessionMeta;
import com.kakomon.dataset.Question;
import com.kakomon.extract.Continuation;
import com.kakomon.extract.ExtractionException;
import com.kakomon.extract.ExtractionMode;
import com.kakomon.extract.ExtractionResult;
import com.kakomon.extract.Extractor;
import com.kakomon.extract.FormState;
import com.kakomon.extract.HtmlQuestionExtractor;
import com.kakomon.extract.RawQuestion;
import com.kakomon.fetch.FetchRequest;
import com.kakomon.fetch.FetchResult;
import com.kakomon.fetch.Fetcher;
import com.kakomon.fetch.NetworkException;
import com.kakomon.fetch.RateLimitException;
import com.kakomon.normalize.IdAllocator;
import com.kakomon.normalize.NormalizationException;
import com.kakomon.normalize.NormalizedQuestion;
import com.kakomon.normalize.QuestionNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 模块说明：SessionHarvester（class）。
 * 主要职责：驱动单个场次的抓取状态机，API 模式按页翻到结束，随机出题模式反复抽题直到收敛或触达上限。
 * 使用建议：同一场次内请求严格串行；失败场次已抓到的题目仍会随结果返回。
 */
public final class SessionHarvester {
    private static final Logger LOG = LogManager.getLogger(SessionHarvester.class);

    private final Fetcher fetcher;
    private final QuestionNormalizer normalizer;
    private final HarvestLimits limits;
    private final DebugPageWriter debugPages;
    private final AtomicBoolean cancelled;

    public SessionHarvester(
            Fetcher fetcher,
            QuestionNormalizer normalizer,
            HarvestLimits limits,
            DebugPageWriter debugPages,
            AtomicBoolean cancelled
    ) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.limits = limits;
        this.debugPages = debugPages == null ? DebugPageWriter.disabled() : debugPages;
        this.cancelled = cancelled == null ? new AtomicBoolean(false) : cancelled;
    }

    public SessionHarvest harvest(SessionMeta session, ResumeState resume) {
        Run run = new Run(session, resume == null ? ResumeState.none() : resume);
        LOG.info("Harvesting session {} (year={}, mode={}, resumed={})",
                session.label, session.year, run.mode, run.seen.size());
        try {
            if (run.mode == ExtractionMode.API) {
                harvestPages(run);
            } else {
                harvestDraws(run);
            }
        } catch (RateLimitException e) {
            if (limits.continueOnRateLimit) {
                run.finish(HarvestState.CAPPED, "rate_limited");
            } else {
                run.finish(HarvestState.FAILED, "rate_limited");
            }
            LOG.warn("Session {} rate limited: {}", session.label, e.getMessage());
        } catch (NetworkException e) {
            run.finish(HarvestState.FAILED, "network");
            LOG.warn("Session {} failed: {}", session.label, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.finish(HarvestState.CAPPED, "cancelled");
        }
        SessionHarvest result = run.result();
        LOG.info("Session outcome: {}", result.outcome.summaryLine());
        return result;
    }

    private void harvestPages(Run run) throws NetworkException, InterruptedException {
        Extractor extractor = Extractor.forMode(ExtractionMode.API);
        SessionMeta session = run.session;
        String token = "";
        int page = 0;
        while (true) {
            if (cancelled.get()) {
                run.finish(HarvestState.CAPPED, "cancelled");
                return;
            }
            if (page >= limits.maxPages) {
                run.finish(HarvestState.CAPPED, "max_pages");
                return;
            }
            run.transition(HarvestState.FETCHING);
            FetchRequest request = pageRequest(session, token);
            String body = run.fetch(request, "page" + page);
            page++;

            run.transition(HarvestState.EXTRACTING);
            ExtractionResult extraction;
            try {
                extraction = extractor.extract(body);
            } catch (ExtractionException e) {
                run.extractionFailures++;
                LOG.warn("Session {} page {}: {}", session.label, page, e.getMessage());
                run.finish(HarvestState.FAILED, "extraction");
                return;
            }
            extraction.totalHint.ifPresent(total -> run.totalHint = total);
            for (RawQuestion raw : extraction.candidates) {
                run.accept(normalize(run, raw, request.targetUrl(), "page " + page));
            }

            Continuation next = extraction.continuation;
            if (next.kind == Continuation.Kind.NEXT_PAGE) {
                run.transition(HarvestState.CONTINUING);
                token = next.token;
            } else {
                run.finish(HarvestState.CONVERGED, "done");
                return;
            }
        }
    }

    private FetchRequest pageRequest(SessionMeta session, String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return FetchRequest.get(token).header("Accept", "application/json").build();
        }
        FetchRequest.Builder builder = FetchRequest.get(session.apiUrl)
                .params(session.formOrEmpty())
                .header("Accept", "application/json");
        if (!token.isEmpty()) {
            builder.param(limits.pageParam, token);
        }
        return builder.build();
    }

    private void harvestDraws(Run run) throws NetworkException, InterruptedException {
        Extractor extractor = Extractor.forMode(ExtractionMode.HTML);
        SessionMeta session = run.session;

        if (!run.hasFetchBudget()) {
            run.finish(HarvestState.CAPPED, "max_requests");
            return;
        }
        run.transition(HarvestState.FETCHING);
        FetchRequest prime = FetchRequest.get(session.startUrl).noCache().build();
        String primeBody = run.fetch(prime, "prime");
        FormState form = HtmlQuestionExtractor.readForm(primeBody, session.startUrl);
        HtmlQuestionExtractor.parseTotalHint(primeBody).ifPresent(total -> run.totalHint = total);

        int consecutiveFailures = 0;
        int streak = 0;
        for (int qno = 0; qno < limits.maxQno; qno++) {
            if (cancelled.get()) {
                run.finish(HarvestState.CAPPED, "cancelled");
                return;
            }
            if (!run.hasFetchBudget()) {
                run.finish(HarvestState.CAPPED, "max_requests");
                return;
            }
            run.transition(HarvestState.FETCHING);
            FetchRequest request = drawRequest(session, form, qno);
            String body = run.fetch(request, "qno" + qno);

            run.transition(HarvestState.EXTRACTING);
            ExtractionResult extraction;
            try {
                extraction = extractor.extract(body);
                consecutiveFailures = 0;
            } catch (ExtractionException e) {
                run.extractionFailures++;
                consecutiveFailures++;
                LOG.warn("Session {} qno={}: {} ({} in a row)", session.label, qno, e.getMessage(), consecutiveFailures);
                if (consecutiveFailures >= limits.failureTolerance) {
                    run.finish(HarvestState.FAILED, "extraction");
                    return;
                }
                run.transition(HarvestState.CONTINUING);
                continue;
            }
            if (!extraction.formState.isEmpty()) {
                form = new FormState(form.action(), form.post(), extraction.formState);
            }
            extraction.totalHint.ifPresent(total -> run.totalHint = total);

            for (RawQuestion raw : extraction.candidates) {
                NormalizedQuestion normalized = normalize(run, raw, request.url, "qno=" + qno);
                if (normalized == null) {
                    continue;
                }
                streak = run.accept(normalized) ? 0 : streak + 1;
            }

            if (streak >= limits.convergenceStreak) {
                run.finish(HarvestState.CONVERGED, "streak");
                return;
            }
            if (run.totalHint > 0 && run.seen.size() >= run.totalHint) {
                run.finish(HarvestState.CONVERGED, "total_hint");
                return;
            }
            run.transition(HarvestState.CONTINUING);
        }
        run.finish(HarvestState.CAPPED, "max_qno");
    }

    /**
     * Static session params and the draw number identify the request; hidden fields ride along as transient
     * params, except where a static param of the same name takes precedence. {@code result} is always reset to 0.
     */
    static FetchRequest drawRequest(SessionMeta session, FormState form, int qno) {
        FetchRequest.Builder builder = form.post() ? FetchRequest.post(form.action()) : FetchRequest.get(form.action());
        Map<String, List<String>> staticParams = session.formOrEmpty();
        builder.params(staticParams).param("qno", String.valueOf(qno));

        Map<String, String> hidden = new LinkedHashMap<>(form.hiddenFields());
        hidden.keySet().removeAll(staticParams.keySet());
        hidden.remove("qno");
        if (hidden.containsKey("result")) {
            hidden.put("result", "0");
        }
        return builder.transientParams(hidden)
                .header("Referer", session.startUrl)
                .build();
    }

    private NormalizedQuestion normalize(Run run, RawQuestion raw, String fallbackUrl, String where) {
        run.candidates++;
        try {
            return normalizer.normalize(raw, run.session, fallbackUrl);
        } catch (NormalizationException e) {
            run.normalizationFailures++;
            LOG.warn("Session {} {}: {}", run.session.label, where, e.getMessage());
            return null;
        }
    }

    private final class Run {
        final SessionMeta session;
        final ExtractionMode mode;
        final String idPrefix;
        final Set<String> seen;
        final ResumeState resume;
        final IdAllocator ids = new IdAllocator();
        final List<NormalizedQuestion> accepted = new ArrayList<>();
        final long startedNanos = System.nanoTime();

        HarvestState state = HarvestState.IDLE;
        String reason = "";
        int fetches;
        int cacheHits;
        int candidates;
        int newQuestions;
        int extractionFailures;
        int normalizationFailures;
        int totalHint = -1;

        Run(SessionMeta session, ResumeState resume) {
            this.session = session;
            this.mode = session.mode();
            this.idPrefix = session.effectiveIdPrefix();
            this.resume = resume;
            this.seen = new HashSet<>(resume.identitiesFor(idPrefix));
            this.ids.seed(resume.ids());
        }

        void transition(HarvestState next) {
            if (state != next) {
                LOG.debug("Session {}: {} -> {}", session.label, state, next);
                state = next;
            }
        }

        void finish(HarvestState terminal, String why) {
            transition(terminal);
            reason = why;
        }

        boolean hasFetchBudget() {
            return fetches < limits.maxRequests;
        }

        String fetch(FetchRequest request, String step) throws NetworkException, InterruptedException {
            fetches++;
            FetchResult result = fetcher.fetch(request);
            if (result.fromCache) {
                cacheHits++;
            }
            debugPages.write(session.label, step, request, result.body);
            return result.body;
        }

        /**
         * Records a normalized question; returns false when its content identity was already seen.
         * In deterministic mode every record is kept and the validator dedupes by id.
         */
        boolean accept(NormalizedQuestion normalized) {
            if (normalized == null) {
                return false;
            }
            boolean fresh = seen.add(normalized.identity());
            if (mode == ExtractionMode.HTML && !fresh) {
                return false;
            }
            if (normalized.hasId()) {
                ids.reserve(normalized.question().id);
            }
            accepted.add(normalized);
            if (fresh) {
                newQuestions++;
            }
            return fresh;
        }

        SessionHarvest result() {
            if (!state.isTerminal()) {
                finish(HarvestState.FAILED, "incomplete");
            }
            long elapsedMs = Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
            SessionOutcome outcome = SessionOutcome.builder()
                    .label(session.label)
                    .mode(mode)
                    .state(state)
                    .reason(reason)
                    .fetches(fetches)
                    .cacheHits(cacheHits)
                    .candidates(candidates)
                    .newQuestions(newQuestions)
                    .extractionFailures(extractionFailures)
                    .normalizationFailures(normalizationFailures)
                    .totalHint(totalHint)
                    .elapsedMs(elapsedMs)
                    .build();
            return new SessionHarvest(outcome, assignIds());
        }

        /**
         * Unnumbered records get their id only once every source-numbered id of the session is reserved.
         * Content captured by a previous run keeps its stored id; repeated content shares one id.
         */
        List<Question> assignIds() {
            Set<String> numbered = new HashSet<>();
            for (NormalizedQuestion q : accepted) {
                if (q.hasId()) {
                    numbered.add(q.question().id);
                }
            }
            Map<String, String> assigned = new HashMap<>();
            List<Question> out = new ArrayList<>(accepted.size());
            for (NormalizedQuestion q : accepted) {
                if (q.hasId()) {
                    out.add(q.question());
                    continue;
                }
                String id = assigned.get(q.identity());
                if (id == null) {
                    id = resume.idOf(q.identity())
                            .filter(previous -> ResumeState.prefixOf(previous).equals(idPrefix))
                            .filter(previous -> !numbered.contains(previous))
                            .orElseGet(() -> ids.idFor(idPrefix, null));
                    assigned.put(q.identity(), id);
                }
                out.add(q.withId(id).question());
            }
            return out;
        }
    }
}
