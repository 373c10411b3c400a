package com.refharvest.app.logging;

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
 * CLI 실행 1회분의 JUL 설정. SLF4J(slf4j-jdk14)와 StructuredLog 모두 여기 붙인 핸들러로 나간다.
 *
 * <p>콘솔(stderr)은 진행 출력과 섞이지 않게 WARNING 이상만 짧게, 파일은
 * {@code <output>/logs/harvest-N.log} 에 전체 레벨을 남긴다. --verbose면 콘솔도 FINE까지.
 *
 * <p>System props: {@code rh.log.sizeMb}(기본 2), {@code rh.log.files}(기본 5), {@code rh.log.file=false}로 파일 끔.
 */
public final class LogSetup {
    private LogSetup() {}

    private static Path configuredDir; // 같은 JVM에서 두 번째 실행이면 핸들러만 교체

    public static synchronized void configure(Path outputDir, boolean verbose) {
        Path logDir = outputDir.resolve("logs");
        Level consoleLevel = verbose ? Level.FINE : Level.WARNING;

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(verbose ? Level.FINE : Level.INFO);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(consoleLevel);
        console.setFormatter(new ShortFormatter());
        root.addHandler(console);

        if (!"false".equalsIgnoreCase(System.getProperty("rh.log.file"))) {
            attachFile(root, logDir);
        }
        configuredDir = logDir;
    }

    /** 마지막으로 설정된 로그 디렉터리(미설정이면 null). */
    public static synchronized Path logDir() {
        return configuredDir;
    }

    private static void attachFile(Logger root, Path logDir) {
        int sizeMb = intProp("rh.log.sizeMb", 2);
        int files = intProp("rh.log.files", 5);
        try {
            Files.createDirectories(logDir);
            FileHandler file = new FileHandler(logDir.resolve("harvest-%g.log").toString(),
                    sizeMb * 1024 * 1024, files, true);
            file.setLevel(Level.ALL);
            file.setFormatter(new FullFormatter());
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "Cannot open log file in " + logDir + ": " + e.getMessage(), e);
        }
    }

    static int intProp(String key, int def) {
        String s = System.getProperty(key);
        if (s == null || s.isBlank()) return def;
        try {
            int v = Integer.parseInt(s.trim());
            return v > 0 ? v : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** 콘솔용: "WARN  page-failed ..." 한 줄. */
    static final class ShortFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String lvl = r.getLevel() == Level.WARNING ? "WARN" : r.getLevel().getName();
            String line = String.format(Locale.ROOT, "%-5s %s%n", lvl, formatMessage(r));
            Throwable t = r.getThrown();
            return t == null ? line : line + "      caused by " + t + System.lineSeparator();
        }
    }

    /** 파일용: 시각, 레벨, 스레드, 로거 이름, 메시지와 스택. */
    static final class FullFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL %2$-7s [%3$s] %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw;
        }
    }
}
