package com.studioscout.core.http;

import java.net.URI;

/**
 * 페이지를 가져오지 못했을 때(네트워크 실패, 2xx 이외 상태) 로더가 던지는 예외.
 * status는 마지막 시도의 HTTP 상태, 전송 실패면 -1. attempts는 포기하기까지의 총 시도 횟수.
 */
public class RetrievalException extends Exception {

    private final URI locator;
    private final int status;
    private final int attempts;

    public RetrievalException(URI locator, int status, String message) {
        this(locator, status, message, null, 1);
    }

    public RetrievalException(URI locator, int status, String message, Throwable cause) {
        this(locator, status, message, cause, 1);
    }

    public RetrievalException(URI locator, int status, String message, Throwable cause, int attempts) {
        super(message, cause);
        this.locator = locator;
        this.status = status;
        this.attempts = Math.max(1, attempts);
    }

    public URI getLocator() { return locator; }
    public int getStatus() { return status; }
    public int getAttempts() { return attempts; }

    public boolean isTransportFailure() { return status == -1; }
}
