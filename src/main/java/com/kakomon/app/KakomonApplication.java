package com.kakomon.app;

import com.kakomon.config.Config;
import com.kakomon.config.SessionCatalog;
import com.kakomon.config.SessionMeta;
import com.kakomon.core.RunTelemetry;
import com.kakomon.dataset.DatasetMerger;
import com.kakomon.dataset.DatasetStore;
import com.kakomon.dataset.MergePolicy;
import com.kakomon.extract.SessionDiscovery;
import com.kakomon.fetch.FetchRequest;
import com.kakomon.fetch.Fetcher;
import com.kakomon.fetch.HttpTransport;
import com.kakomon.fetch.JdkHttpTransport;
import com.kakomon.fetch.NetworkException;
import com.kakomon.fetch.ResponseCache;
import com.kakomon.fetch.Throttle;
import com.kakomon.harvest.SessionOutcome;
import com.kakomon.normalize.CategoryMapper;
import com.kakomon.normalize.QuestionNormalizer;
import com.kakomon.pipeline.HarvestOptions;
import com.kakomon.pipeline.HarvestPipeline;
import com.kakomon.pipeline.PipelineOutcome;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 模块说明：KakomonApplication（class）。
 * 主要职责：命令行入口，解析参数、装配抓取流水线并输出每个场次的结果与汇总统计。
 * 使用建议：退出码 0 表示至少一个场次未失败，1 表示全部失败或致命 I/O 错误，2 表示参数或配置错误。
 */
public final class KakomonApplication {
    private static final Logger LOG = LogManager.getLogger(KakomonApplication.class);
    private static final String APP_NAME = "kakomon-harvester";
    private static final long SHUTDOWN_FLUSH_WAIT_SEC = 30L;
    private static final List<String> LOGGED_KEYS = List.of(
            "fetch.throttle_ms", "fetch.cache.enabled", "harvest.max_requests", "harvest.max_qno", "merge.policy"
    );
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final HttpTransport transportOverride;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public KakomonApplication() {
        this(null);
    }

    KakomonApplication(HttpTransport transportOverride) {
        this.transportOverride = transportOverride;
    }

    public static void main(String[] args) {
        int exit = new KakomonApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        return run(args, Path.of(".").toAbsolutePath().normalize(), true);
    }

    int run(String[] args, Path workingDir, boolean routeLogs) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp(APP_NAME, options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp(APP_NAME, options);
            return EXIT_OK;
        }

        Config config;
        try {
            config = Config.load(workingDir).withOverrides(cliOverrides(cmd));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        String selector = cmd.hasOption("sessions")
                ? cmd.getOptionValue("sessions")
                : String.join(",", config.getList("harvest.sessions"));
        if (selector.isBlank() && !cmd.hasOption("list-sessions")) {
            new HelpFormatter().printHelp(APP_NAME, options);
            System.err.println("ERROR: --sessions (or harvest.sessions) is required unless --list-sessions is given.");
            return EXIT_USAGE;
        }
        if (routeLogs) {
            installLogRoutingIfNeeded(config);
        }
        for (String key : LOGGED_KEYS) {
            Config.ResolvedValue resolved = config.resolve(key);
            LOG.info("Config {}={} (source={})", resolved.key, resolved.value, resolved.source);
        }

        RunTelemetry telemetry = new RunTelemetry(
                config.getBoolean("harvest.parallel", false) ? "parallel" : "sequential",
                Clock.systemUTC()
        );
        try {
            HttpTransport transport = transportOverride != null
                    ? transportOverride
                    : new JdkHttpTransport(config.getString("fetch.user_agent"), Duration.ofSeconds(Math.max(1, config.getInt("fetch.timeout_sec", 20))));
            ResponseCache cache = new ResponseCache(
                    config.getPath("fetch.cache.dir"),
                    config.getBoolean("fetch.cache.enabled", true),
                    Clock.systemUTC()
            );

            SessionCatalog catalog = SessionCatalog.load(config.getPath("sessions.path"));
            if (catalog.isEmpty() || cmd.hasOption("list-sessions")) {
                catalog = catalog.plus(discover(config, transport, cache, telemetry));
            }
            if (cmd.hasOption("list-sessions")) {
                printSessions(catalog);
                return EXIT_OK;
            }

            List<SessionMeta> sessions = catalog.resolve(selector);
            MergePolicy policy = MergePolicy.parse(config.getString("merge.policy", "preferNew"));
            Path out = cmd.hasOption("out")
                    ? workingDir.resolve(cmd.getOptionValue("out")).normalize()
                    : config.getPath("dataset.path");
            Path mergeInto = cmd.hasOption("merge-into")
                    ? workingDir.resolve(cmd.getOptionValue("merge-into")).normalize()
                    : null;
            HarvestOptions harvestOptions = HarvestOptions.builder()
                    .sessions(sessions)
                    .out(out)
                    .mergeInto(mergeInto)
                    .resume(cmd.hasOption("resume"))
                    .policy(policy)
                    .parallel(config.getBoolean("harvest.parallel", false))
                    .build();

            HarvestPipeline pipeline = new HarvestPipeline(
                    config,
                    transport,
                    cache,
                    new QuestionNormalizer(CategoryMapper.fromConfig(config)),
                    new DatasetStore(),
                    new DatasetMerger(Clock.systemUTC()),
                    cancelled
            );

            CountDownLatch flushed = new CountDownLatch(1);
            Thread hook = new Thread(() -> awaitFlush(flushed), "kakomon-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            PipelineOutcome outcome;
            try {
                outcome = pipeline.run(harvestOptions, telemetry);
            } finally {
                flushed.countDown();
                removeHook(hook);
            }
            telemetry.finish();
            report(outcome, telemetry);
            return outcome.exitCode();
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    private void awaitFlush(CountDownLatch flushed) {
        cancelled.set(true);
        try {
            if (!flushed.await(SHUTDOWN_FLUSH_WAIT_SEC, TimeUnit.SECONDS)) {
                LOG.warn("Shutdown before the dataset flush finished");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM shutdown in progress; keeping flush hook");
        }
    }

    private List<SessionMeta> discover(Config config, HttpTransport transport, ResponseCache cache, RunTelemetry telemetry)
            throws IOException {
        String indexUrl = config.requireString("discovery.index_url");
        telemetry.startStep(RunTelemetry.STEP_DISCOVER);
        Fetcher fetcher = Fetcher.fromConfig(
                config,
                transport,
                cache,
                new Throttle(Math.max(0L, config.getLong("fetch.throttle_ms", 1000L)))
        );
        try {
            String html = fetcher.fetch(FetchRequest.get(indexUrl).build()).body;
            List<SessionMeta> found = new SessionDiscovery().discover(html, indexUrl);
            telemetry.endStep(RunTelemetry.STEP_DISCOVER, 1, found.size(), 0);
            return found;
        } catch (NetworkException e) {
            telemetry.endStep(RunTelemetry.STEP_DISCOVER, 1, 0, 1, e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("session discovery interrupted", e);
        }
    }

    static Map<String, Object> cliOverrides(CommandLine cmd) {
        Map<String, Object> overrides = new HashMap<>();
        if (cmd.hasOption("max-requests")) {
            overrides.put("harvest.max_requests", positiveInt(cmd, "max-requests"));
        }
        if (cmd.hasOption("max-qno")) {
            overrides.put("harvest.max_qno", positiveInt(cmd, "max-qno"));
        }
        if (cmd.hasOption("throttle")) {
            String raw = cmd.getOptionValue("throttle");
            try {
                double seconds = Double.parseDouble(raw.trim());
                if (seconds < 0.0 || Double.isNaN(seconds)) {
                    throw new NumberFormatException(raw);
                }
                overrides.put("fetch.throttle_ms", Math.round(seconds * 1000.0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--throttle must be a non-negative number of seconds: " + raw);
            }
        }
        if (cmd.hasOption("merge-policy")) {
            overrides.put("merge.policy", MergePolicy.parse(cmd.getOptionValue("merge-policy")).cliName());
        }
        if (cmd.hasOption("no-cache")) {
            overrides.put("fetch.cache.enabled", "false");
        }
        if (cmd.hasOption("parallel")) {
            overrides.put("harvest.parallel", "true");
        }
        if (cmd.hasOption("debug-pages")) {
            overrides.put("harvest.debug_pages.enabled", "true");
        }
        return overrides;
    }

    private static int positiveInt(CommandLine cmd, String opt) {
        String raw = cmd.getOptionValue(opt);
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new NumberFormatException(raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + opt + " must be a positive integer: " + raw);
        }
    }

    private void printSessions(SessionCatalog catalog) {
        System.out.println("Known sessions:");
        for (SessionMeta session : catalog.all()) {
            System.out.println(String.format(
                    Locale.US,
                    "- %s year=%d mode=%s id_prefix=%s",
                    session.label,
                    session.year,
                    session.mode(),
                    session.effectiveIdPrefix()
            ));
        }
    }

    private void report(PipelineOutcome outcome, RunTelemetry telemetry) {
        System.out.println("Sessions:");
        for (SessionOutcome session : outcome.sessions) {
            System.out.println("  " + session.summaryLine());
        }
        System.out.println("Accepted: " + outcome.validation.total() + ", rejected: " + outcome.validation.rejected
                + (outcome.validation.rejectedByReason.isEmpty() ? "" : " " + outcome.validation.rejectedByReason));
        System.out.println("Merge: " + outcome.merge);
        System.out.println("Dataset total: " + outcome.merge.merged.size()
                + (outcome.written == null ? " (not rewritten)" : " -> " + outcome.written));
        System.out.println("Per-year:");
        outcome.validation.perYear.forEach((year, count) -> System.out.println("  " + year + ": " + count));
        System.out.println("Per-category:");
        outcome.validation.perCategory.forEach((category, count) -> System.out.println("  " + category + ": " + count));
        System.out.println(telemetry.getSummary());
        if (outcome.allFailed()) {
            System.err.println("ERROR: all requested sessions failed.");
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (KakomonApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("kakomon.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(KakomonApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.debug("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("sessions").hasArg().argName("all|a,b").desc("sessions to harvest: all or a comma separated list of labels (default: harvest.sessions)").build());
        options.addOption(Option.builder().longOpt("out").hasArg().argName("path").desc("output dataset path (default: dataset.path)").build());
        options.addOption(Option.builder().longOpt("merge-into").hasArg().argName("path").desc("existing dataset to merge the harvest into").build());
        options.addOption(Option.builder().longOpt("merge-policy").hasArg().argName("policy").desc("collision policy: preferNew (default) or preferExisting").build());
        options.addOption(Option.builder().longOpt("resume").desc("resume from the existing output and the response cache").build());
        options.addOption(Option.builder().longOpt("max-requests").hasArg().argName("n").desc("fetch cap per randomized session (default 200)").build());
        options.addOption(Option.builder().longOpt("max-qno").hasArg().argName("n").desc("draw cap per randomized session (default 80)").build());
        options.addOption(Option.builder().longOpt("throttle").hasArg().argName("seconds").desc("minimum seconds between network requests (default 1.0)").build());
        options.addOption(Option.builder().longOpt("no-cache").desc("disable the response cache (still throttles and retries)").build());
        options.addOption(Option.builder().longOpt("parallel").desc("harvest sessions in parallel, one worker and throttle per session").build());
        options.addOption(Option.builder().longOpt("debug-pages").desc("save request/response pairs per draw or page").build());
        options.addOption(Option.builder().longOpt("list-sessions").desc("list configured and discovered sessions, then exit").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
