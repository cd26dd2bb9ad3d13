package com.arachnida.app.cli;

import com.arachnida.core.model.CrawlConfig;

import java.nio.file.Path;

/**
 * spider 명령행 인자.
 * 사용: spider [-r] [-l N] [-p PATH] [-c FILE] [-t N] URL
 * 값이 주어진 플래그만 CrawlConfig 를 덮어쓴다(YAML 보다 우선).
 */
public record CliOptions(
        String url,
        boolean recursive,
        Integer maxDepth,
        Path outputDir,
        Path configFile,
        Integer threads,
        boolean help
) {

    public static String usage() {
        return """
                Usage: spider [-r] [-l N] [-p PATH] [-c FILE] [-t N] URL
                  -r        recursive crawl (follow same-host links)
                  -l N      max depth (only with -r). default 5
                  -p PATH   output directory (default ./data)
                  -c FILE   YAML config (flags override it)
                  -t N      worker threads (default 1)
                  -h        show this help
                """;
    }

    /** @throws IllegalArgumentException 알 수 없는 플래그, 값 누락, 숫자 아님 */
    public static CliOptions parse(String[] args) {
        String url = null;
        boolean recursive = false;
        Integer depth = null;
        Path out = null;
        Path config = null;
        Integer threads = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-r" -> recursive = true;
                case "-l" -> depth = nonNegativeInt(value(args, ++i, "-l"), "-l");
                case "-p" -> out = Path.of(value(args, ++i, "-p"));
                case "-c" -> config = Path.of(value(args, ++i, "-c"));
                case "-t" -> threads = positiveInt(value(args, ++i, "-t"), "-t");
                case "-h", "--help" -> help = true;
                default -> {
                    if (a.startsWith("-") && a.length() > 1) {
                        throw new IllegalArgumentException("Unknown option: " + a);
                    }
                    if (url != null) {
                        throw new IllegalArgumentException("Only one URL expected, got: " + url + " and " + a);
                    }
                    url = a;
                }
            }
        }
        return new CliOptions(url, recursive, depth, out, config, threads, help);
    }

    /** 지정된 값만 cfg 에 반영 */
    public CrawlConfig applyTo(CrawlConfig cfg) {
        if (url != null) cfg.setTarget(url.strip());
        if (recursive) cfg.setRecursive(true);
        if (maxDepth != null) cfg.setMaxDepth(maxDepth);
        if (outputDir != null) cfg.setOutputDir(outputDir);
        if (threads != null) cfg.setConcurrency(threads);
        return cfg;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + flag);
        return args[i];
    }

    private static int nonNegativeInt(String s, String flag) {
        int n = parseInt(s, flag);
        if (n < 0) throw new IllegalArgumentException("Invalid value for " + flag + ": " + s + " (must be >= 0)");
        return n;
    }

    private static int positiveInt(String s, String flag) {
        int n = parseInt(s, flag);
        if (n < 1) throw new IllegalArgumentException("Invalid value for " + flag + ": " + s + " (must be >= 1)");
        return n;
    }

    private static int parseInt(String s, String flag) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + s, e);
        }
    }
}
