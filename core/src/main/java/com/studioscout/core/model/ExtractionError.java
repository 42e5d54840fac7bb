package com.studioscout.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/**
 * 배치 중 기록되는 오류 한 건.
 * RETRIEVAL: 로케이터 자체를 못 가져옴(하드, 레코드 없음)
 * FIELD: 한 필드 가공 실패(소프트, 그 필드만 비움)
 * 팩토리는 null 인자에도 던지지 않는다(locator는 null 그대로, 필드명은 UNKNOWN_FIELD).
 */
public final class ExtractionError {

    public enum Kind { RETRIEVAL, FIELD }

    public static final String UNKNOWN_FIELD = "<unknown>";

    private final Kind kind;
    private final URI locator;
    private final String fieldName;   // FIELD만
    private final String causeType;
    private final String message;
    private final Instant occurredAt;

    private ExtractionError(Kind kind, URI locator, String fieldName, Throwable cause, Instant at) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.locator = locator;
        this.fieldName = fieldName;
        this.causeType = (cause == null) ? null : cause.getClass().getSimpleName();
        this.message = (cause == null) ? null : String.valueOf(cause.getMessage());
        this.occurredAt = (at == null) ? Instant.now() : at;
    }

    public static ExtractionError retrieval(URI locator, Throwable cause) {
        return new ExtractionError(Kind.RETRIEVAL, locator, null, cause, null);
    }

    public static ExtractionError field(URI locator, String fieldName, Throwable cause) {
        String f = (fieldName == null || fieldName.isBlank()) ? UNKNOWN_FIELD : fieldName;
        return new ExtractionError(Kind.FIELD, locator, f, cause, null);
    }

    public Kind getKind() { return kind; }
    public URI getLocator() { return locator; }
    public String getFieldName() { return fieldName; }
    public String getCauseType() { return causeType; }
    public String getMessage() { return message; }
    public Instant getOccurredAt() { return occurredAt; }

    public boolean isRetrieval() { return kind == Kind.RETRIEVAL; }

    @Override public String toString() {
        return kind == Kind.RETRIEVAL
                ? "Error accessing URL '" + locator + "': " + message
                : "Error accessing element '" + fieldName + "': " + message;
    }
}
