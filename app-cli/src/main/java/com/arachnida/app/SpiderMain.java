package com.arachnida.app;

import com.arachnida.app.cli.CliOptions;
import com.arachnida.app.logging.LogSetup;
import com.arachnida.core.api.ITransport;
import com.arachnida.core.crawler.CrawlEngine;
import com.arachnida.core.crawler.MalformedSeedException;
import com.arachnida.core.http.HttpTransport;
import com.arachnida.core.model.CrawlConfig;
import com.arachnida.core.model.CrawlReport;
import com.arachnida.core.util.UrlResolver;
import com.arachnida.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.function.Function;

/**
 * spider CLI 진입점.
 * exit 1: URL 누락/오류, 잘못된 인자/설정, 출력 디렉터리 생성 실패
 * exit 0: 그 외 (개별 fetch/download 실패는 로그만 남김)
 */
public final class SpiderMain {

    private static final Logger LOG = LoggerFactory.getLogger(SpiderMain.class);

    private SpiderMain() {}

    public static void main(String[] args) {
        LogSetup.init();
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));
        System.exit(run(args, System.out, System.err, HttpTransport::new));
    }

    static int run(String[] args, PrintStream out, PrintStream err,
                   Function<CrawlConfig, ITransport> transportFactory) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.print(CliOptions.usage());
            return 1;
        }
        if (opts.help()) {
            out.print(CliOptions.usage());
            return 0;
        }

        CrawlConfig cfg;
        try {
            cfg = (opts.configFile() != null)
                    ? YamlConfigLoader.load(opts.configFile())
                    : CrawlConfig.defaults();
        } catch (IOException | RuntimeException e) {
            err.println("Could not load config " + opts.configFile() + ": " + e.getMessage());
            return 1;
        }
        opts.applyTo(cfg);

        if (cfg.getTarget() == null || cfg.getTarget().isBlank()) {
            err.println("Missing URL");
            err.print(CliOptions.usage());
            return 1;
        }
        if (UrlResolver.parse(cfg.getTarget()).isEmpty()) {
            err.println("Invalid URL (only http/https supported): " + cfg.getTarget());
            return 1;
        }
        try {
            cfg.validate();
        } catch (IllegalArgumentException | NullPointerException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        try {
            Files.createDirectories(cfg.getOutputDir());
        } catch (IOException | UnsupportedOperationException e) {
            err.println("Failed to create output directory: " + cfg.getOutputDir() + " (" + e.getMessage() + ")");
            return 1;
        }

        CrawlEngine engine = new CrawlEngine(cfg, transportFactory.apply(cfg));
        CrawlReport report;
        try {
            report = engine.crawl();
        } catch (MalformedSeedException e) {
            err.println(e.getMessage());
            return 1;
        } finally {
            closeQuietly(engine);
        }

        printSummary(out, report);
        return 0;
    }

    static void printSummary(PrintStream out, CrawlReport report) {
        out.println();
        out.println("Done.");
        out.println("Visited pages: " + report.visitedPages().size());
        out.println("Downloaded images: " + report.imagesSaved());
        if (report.stats().imagesFailed > 0 || report.pagesFailed() > 0) {
            out.println("Failed pages: " + report.pagesFailed() + ", failed images: " + report.stats().imagesFailed);
        }
        out.println("Output: " + report.outputDir().toAbsolutePath().normalize());
    }

    private static void closeQuietly(CrawlEngine engine) {
        try {
            engine.close();
        } catch (Exception e) {
            LOG.warn("Transport close failed: {}", e.toString());
        }
    }
}
