package com.studioscout.app;

import com.studioscout.app.logging.LogSetup;
import com.studioscout.core.model.ScrapeConfig;
import com.studioscout.core.service.BatchResult;
import com.studioscout.core.service.BatchScrapeService;
import com.studioscout.core.service.export.ExportCoordinator;
import com.studioscout.core.util.YamlConfigLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * 명령행 진입점.
 * 종료 코드: 0 성공(필드 오류 포함), 1 모든 로케이터 실패 또는 취소, 2 설정/인자 오류
 */
public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_ALL_FAILED = 1;
    public static final int EXIT_BAD_CONFIG = 2;

    /** 종료 시그널 후 배치 정리를 기다리는 최대 시간 */
    static final Duration CANCEL_GRACE = Duration.ofSeconds(15);

    private App() {}

    public static void main(String[] args) {
        // 전역 uncaught 핸들러
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        // 1) 인자 + 설정
        final CliOptions opts;
        final ScrapeConfig cfg;
        try {
            opts = CliOptions.parse(args);
            if (opts.isHelp()) {
                out.println(CliOptions.usage());
                return EXIT_OK;
            }
            cfg = resolveConfig(opts);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println(CliOptions.usage());
            return EXIT_BAD_CONFIG;
        }

        LogSetup.configure(cfg.getOutputDir());
        LOG.info(() -> "Targets=" + cfg.getTargets().size()
                + (cfg.getTargetsFile() != null ? " (incl. " + cfg.getTargetsFile() + ")" : "")
                + ", out=" + cfg.getOutputDir().toAbsolutePath() + ", formats=" + cfg.getFormats());

        // 2) 배치 (Ctrl+C → 취소 플래그, 훅은 close()까지 대기)
        String startedIso = Instant.now().toString();
        final BatchResult result;
        try (ShutdownCancel shutdown = new ShutdownCancel(CANCEL_GRACE).install()) {
            try {
                result = new BatchScrapeService(cfg).run(cfg.locators(),
                        (phase, done, total) -> LOG.fine(() -> "Progress " + phase + " " + done + "/" + total),
                        shutdown.flag());
            } catch (CancellationException ce) {
                LOG.warning("Batch cancelled.");
                err.println("Cancelled.");
                err.flush();
                return EXIT_ALL_FAILED;
            }
        }

        // 3) 내보내기
        List<Path> files;
        try {
            files = new ExportCoordinator().exportAll(cfg.getOutputDir(), result, startedIso, cfg.getFormats());
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Export failed", e);
            err.println("Export failed: " + e.getMessage());
            files = List.of();
        }

        out.println(summary(result, files));
        return result.allFailed() ? EXIT_ALL_FAILED : EXIT_OK;
    }

    /** 설정 파일(명시 → ./scrape.yml → defaults) + 명령행 덮어쓰기 */
    static ScrapeConfig resolveConfig(CliOptions opts) throws IOException {
        ScrapeConfig cfg;
        if (opts.getConfigFile().isPresent()) {
            cfg = YamlConfigLoader.load(opts.getConfigFile().get());
        } else if (Files.exists(Path.of(YamlConfigLoader.DEFAULT_FILE))) {
            cfg = YamlConfigLoader.loadDefault();
        } else {
            cfg = ScrapeConfig.defaults();
        }
        if (!opts.getUrls().isEmpty()) cfg.setTargets(opts.getUrls());
        opts.getOutDir().ifPresent(cfg::setOutputDir);
        opts.getFormats().ifPresent(cfg::setFormats);
        cfg.validate();
        return cfg;
    }

    static String summary(BatchResult result, List<Path> files) {
        String paths = files.isEmpty() ? "-" :
                files.stream().map(p -> p.toAbsolutePath().toString()).collect(Collectors.joining(", "));
        return String.format("Scraped %d/%d locators: records=%d, retrievalErrors=%d, fieldErrors=%d -> %s",
                result.getRecords().size(), result.getOutcomes().size(), result.getRecords().size(),
                result.retrievalErrorCount(), result.fieldErrorCount(), paths);
    }
}
