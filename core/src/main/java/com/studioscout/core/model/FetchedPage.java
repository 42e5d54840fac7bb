package com.studioscout.core.model;

import java.net.URI;
import java.util.Objects;

/** 로더가 가져온 원문 페이지(본문은 텍스트 기준) */
public final class FetchedPage {
    private final URI url;
    private final int statusCode;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final int attempts;

    private FetchedPage(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.attempts = Math.max(1, b.attempts);
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    /** 마지막 시도의 응답 시간 */
    public long getResponseTimeMs() { return responseTimeMs; }
    /** 재시도 포함 총 시도 횟수(>=1) */
    public int getAttempts() { return attempts; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private int attempts = 1;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }

        public FetchedPage build() {
            Objects.requireNonNull(url, "url");
            return new FetchedPage(this);
        }
    }
}
