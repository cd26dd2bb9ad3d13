package com.arachnida.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (slf4j-jdk14 가 여기로 라우팅됨).
 * System props:
 *  -Darachnida.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Darachnida.log.dir=logs   지정 시 logs/spider-%g.log 롤링(2MB x 5)
 *  -Darachnida.log.console=true|false (기본 true, stderr)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init() {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("arachnida.log.level", "INFO"));
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("arachnida.log.console", "true"));
        String dir = System.getProperty("arachnida.log.dir");

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        if (dir != null && !dir.isBlank()) {
            Path logDir = Path.of(dir);
            try {
                Files.createDirectories(logDir);
                FileHandler file = new FileHandler(logDir.resolve("spider-%g.log").toString(), 2 * 1024 * 1024, 5, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 콘솔만으로 진행
                Logger.getAnonymousLogger().log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
            }
        }

        root.setLevel(level);
    }

    /** 문자열을 Level 로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    shortName(r.getLoggerName()), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }

        private static String shortName(String logger) {
            if (logger == null) return "";
            int dot = logger.lastIndexOf('.');
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
