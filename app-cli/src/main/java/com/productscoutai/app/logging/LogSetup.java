package com.productscoutai.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * SLF4J(slf4j-jdk14)와 StructuredLog 모두 여기 핸들러로 나간다.
 * System props:
 *  -Dps.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dps.log.sizeMb=2
 *  -Dps.log.files=5
 *  -Dps.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/app-%g.log 로 저장 */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"), levelOf(System.getProperty("ps.log.level", "INFO")));
    }

    public static synchronized void init(Path logDir, Level level) {
        if (initialized) return;
        initialized = true;

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("ps.log.console", "true"));
        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            int sizeMb  = parseInt(System.getProperty("ps.log.sizeMb"), 2);
            int fileCnt = parseInt(System.getProperty("ps.log.files"), 5);
            FileHandler file = new FileHandler(logDir.resolve("app-%g.log").toString(),
                    Math.max(1, sizeMb) * 1024 * 1024, Math.max(1, fileCnt), true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 핸들러 실패 시 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "file log setup failed: " + e.getMessage(), e);
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 런타임 레벨 변경(루트 + 모든 핸들러). --verbose 용 */
    public static void setLevel(Level level) {
        Level lv = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(lv);
        for (Handler h : root.getHandlers()) h.setLevel(lv);
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
