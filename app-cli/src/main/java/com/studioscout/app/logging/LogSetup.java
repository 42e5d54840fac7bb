package com.studioscout.app.logging;

import com.studioscout.core.error.ScrapeErrorManager;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.*;

/**
 * 스크레이프 실행용 java.util.logging 부트스트랩. slf4j 호출은 slf4j-jdk14 바인딩으로 여기 핸들러에 모인다.
 * <pre>
 *  &lt;out&gt;/logs/scrape-%g.log   전체 로그(사이즈 롤링, 기본 2MB x 5)
 *  &lt;out&gt;/logs/errors-%g.log   scraper_error_logger 의 WARNING 이상만(로케이터/필드 오류)
 * </pre>
 * System props: -Dss.log.level=FINE|INFO|WARNING|SEVERE, -Dss.log.sizeMb=2, -Dss.log.files=5,
 * -Dss.log.console=true|false (콘솔은 stderr, 기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    static final String MAIN_LOG = "scrape-%g.log";
    static final String ERRORS_LOG = "errors-%g.log";

    private static volatile boolean configured = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    // JUL 로거는 약한 참조라 핸들러를 단 로거를 붙잡아 둔다
    private static Logger errorsLogger;

    /** 한 번만 적용(이후 호출은 무시) */
    public static synchronized void configure(Path outRoot) {
        if (configured) return;
        configured = true;
        install(outRoot.resolve("logs"));
    }

    /** 루트 로거를 초기화하고 핸들러를 새로 단다 */
    static synchronized void install(Path logDir) {
        Level level = levelOf(System.getProperty("ss.log.level"));
        int sizeMb = Math.max(1, parseInt(System.getProperty("ss.log.sizeMb"), 2));
        int files = Math.max(1, parseInt(System.getProperty("ss.log.files"), 5));
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("ss.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        if (toConsole) root.addHandler(withLevel(new ConsoleHandler(), level));

        try {
            Files.createDirectories(logDir);
            root.addHandler(withLevel(rolling(logDir.resolve(MAIN_LOG), sizeMb, files), level));

            // 오류 로그는 별도 파일에도, 부모(root)로도 전파
            errorsLogger = Logger.getLogger(ScrapeErrorManager.LOGGER_NAME);
            errorsLogger.addHandler(withLevel(rolling(logDir.resolve(ERRORS_LOG), sizeMb, files), Level.WARNING));

            Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 없이 콘솔로만 진행
            Logger.getAnonymousLogger().log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
        }
    }

    /** 문자열을 Level로(빈 값/실패 시 INFO) */
    static Level levelOf(String name) {
        if (name == null || name.isBlank()) return Level.INFO;
        try { return Level.parse(name.trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    private static FileHandler rolling(Path pattern, int sizeMb, int files) throws IOException {
        return new FileHandler(pattern.toString(), sizeMb * 1024 * 1024, files, true);
    }

    private static Handler withLevel(Handler h, Level level) {
        h.setLevel(level);
        h.setFormatter(LINE_FORMATTER);
        return h;
    }

    /** 한 줄: 시각 [레벨] (스레드) 로거 - 메시지, 예외가 있으면 스택 */
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
