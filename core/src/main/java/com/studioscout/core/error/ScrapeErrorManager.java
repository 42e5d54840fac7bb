package com.studioscout.core.error;

import com.studioscout.core.model.ExtractionError;
import com.studioscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 배치 전체의 오류 로그(추가 전용, 순서 보존, 스레드 세이프).
 * 로케이터 실패는 ERROR, 필드 실패는 WARN. 어떤 메서드도 예외를 던지지 않는다.
 * 배치마다 새 인스턴스를 만들어 워커에 넘긴다.
 */
public final class ScrapeErrorManager {

    public static final String LOGGER_NAME = "scraper_error_logger";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapeErrorManager.class);

    private final List<ExtractionError> log = new ArrayList<>();

    /** 로케이터를 가져오지 못함(네트워크/상태 코드) */
    public void reportRetrievalError(URI locator, Throwable cause) {
        ExtractionError e = ExtractionError.retrieval(locator, cause);
        append(e);
        LOG.error("Error accessing URL '{}': {}", locator, describe(cause));
        SLOG.warn("retrieval-error", "url", String.valueOf(locator), "cause", describe(cause));
    }

    /** 한 필드 가공 실패. 레코드의 나머지 필드는 계속 진행 */
    public void reportFieldError(URI locator, String fieldName, Throwable cause) {
        ExtractionError e = ExtractionError.field(locator, fieldName, cause);
        append(e);
        LOG.warn("Error accessing element '{}': {} (url={})", fieldName, describe(cause), locator);
        SLOG.debug("field-error", "url", String.valueOf(locator), "field", fieldName, "cause", describe(cause));
    }

    private void append(ExtractionError e) {
        synchronized (log) {
            log.add(e);
        }
    }

    /** 추가 순서 그대로의 불변 스냅샷 */
    public List<ExtractionError> errors() {
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    public List<ExtractionError> retrievalErrors() {
        return filter(ExtractionError.Kind.RETRIEVAL);
    }

    public List<ExtractionError> fieldErrors() {
        return filter(ExtractionError.Kind.FIELD);
    }

    public int size() {
        synchronized (log) {
            return log.size();
        }
    }

    private List<ExtractionError> filter(ExtractionError.Kind kind) {
        List<ExtractionError> out = new ArrayList<>();
        for (ExtractionError e : errors()) if (e.getKind() == kind) out.add(e);
        return List.copyOf(out);
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        return (t.getMessage() == null) ? t.getClass().getSimpleName() : t.getMessage();
    }
}
