package com.studioscout.core.http;

import com.studioscout.core.api.IDocumentLoader;
import com.studioscout.core.model.FetchedPage;
import com.studioscout.core.model.ScrapeConfig;
import com.studioscout.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * HttpClient 기반 문서 로더.
 * GET 전송 → 429/5xx/전송 실패는 RetryPolicy에 따라 재시도 → 최종 2xx가 아니면 RetrievalException.
 */
public class HttpDocumentLoader implements IDocumentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(HttpDocumentLoader.class);

    /** Retry-After 상한 */
    static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final ScrapeConfig config;
    private final HttpSender sender;
    private final Sleeper sleeper;

    public HttpDocumentLoader(ScrapeConfig config) {
        this(config, clientSender(config), Sleeper.THREAD);
    }

    /** 테스트용 생성자(송신 훅/슬리퍼 주입) */
    public HttpDocumentLoader(ScrapeConfig config, HttpSender sender, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    private static HttpSender clientSender(ScrapeConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Override
    public FetchedPage fetch(URI locator) throws RetrievalException {
        ScrapeConfig.RetryCfg r = config.getRetry();
        return fetch(locator, new DefaultRetryPolicy(r.getMaxAttempts(), r.getBaseMillis()));
    }

    /** 재시도 포함 GET. 429/5xx/(-1)에서만 재시도, Retry-After(초) 우선 */
    public FetchedPage fetch(URI locator, RetryPolicy policy) throws RetrievalException {
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(policy, "policy");

        int attempt = 1;
        while (true) {
            Attempt a = sendOnce(locator, attempt);
            if (attempt >= policy.maxAttempts() || !policy.shouldRetry(a.status, attempt)) {
                return finish(locator, a, attempt);
            }
            Duration delay = retryAfterOr(policy.nextDelay(attempt), a.response);
            LOG.debug("Retrying {} after status={} (attempt {}/{}, wait {}ms)",
                    locator, a.status, attempt, policy.maxAttempts(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RetrievalException(locator, a.status, "interrupted while waiting to retry", ie, attempt);
            }
            attempt++;
        }
    }

    private Attempt sendOnce(URI locator, int attempt) throws RetrievalException {
        long start = System.nanoTime();
        HttpRequest req = HttpRequest.newBuilder(locator)
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml")
                .GET()
                .build();
        try {
            HttpResponse<String> resp = sender.send(req);
            return new Attempt(resp.statusCode(), resp, null, elapsedMs(start));
        } catch (IOException e) {
            return new Attempt(-1, null, e, elapsedMs(start));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetrievalException(locator, -1, "interrupted during request", ie, attempt);
        }
    }

    private static FetchedPage finish(URI locator, Attempt a, int attempts) throws RetrievalException {
        if (a.failure != null) {
            throw new RetrievalException(locator, -1,
                    a.failure.getClass().getSimpleName() + ": " + a.failure.getMessage(), a.failure, attempts);
        }
        HttpResponse<String> resp = a.response;
        if (a.status < 200 || a.status >= 300) {
            throw new RetrievalException(locator, a.status, "HTTP status " + a.status, null, attempts);
        }
        return FetchedPage.builder()
                .url(locator)
                .statusCode(a.status)
                .body(resp.body() == null ? "" : resp.body())
                .contentType(resp.headers().firstValue("Content-Type").orElse(null))
                .responseTimeMs(a.elapsedMs)
                .attempts(attempts)
                .build();
    }

    /** Retry-After(초)를 존중하되 30초로 상한. HTTP-date 형태는 fallback */
    static Duration retryAfterOr(Duration fallback, HttpResponse<String> resp) {
        if (resp == null) return fallback;
        String v = resp.headers().firstValue("Retry-After").orElse(null);
        if (v == null || v.isBlank()) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return fallback;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : d;
        } catch (NumberFormatException nfe) {
            return fallback;
        }
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }

    private static final class Attempt {
        final int status;
        final HttpResponse<String> response;
        final IOException failure;
        final long elapsedMs;
        Attempt(int status, HttpResponse<String> response, IOException failure, long elapsedMs) {
            this.status = status; this.response = response; this.failure = failure; this.elapsedMs = elapsedMs;
        }
    }
}
