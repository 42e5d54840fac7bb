package com.studioscout.core.service;

import com.studioscout.core.api.IDocumentLoader;
import com.studioscout.core.assemble.RecordAssembler;
import com.studioscout.core.error.ScrapeErrorManager;
import com.studioscout.core.extract.PageTree;
import com.studioscout.core.http.HttpDocumentLoader;
import com.studioscout.core.http.RetrievalException;
import com.studioscout.core.model.FacilityRecord;
import com.studioscout.core.model.FetchedPage;
import com.studioscout.core.model.ItemState;
import com.studioscout.core.model.ScrapeConfig;
import com.studioscout.core.model.ScrapeStats;
import com.studioscout.core.util.ProgressListener;
import com.studioscout.core.util.RateLimiter;
import com.studioscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 드라이버:
 *  - 로케이터마다 load → parse → extract, 결과(레코드 | 오류) 집계
 *  - 고정 스레드풀(동시성=concurrency, 역압) + 전역 RateLimiter
 *  - 한 건의 실패가 배치를 멈추지 않는다. 취소 플래그만 예외(CancellationException)
 *  - 레코드는 입력 순서, 오류는 발생 순서. 중복 로케이터도 각각 처리한다
 *  - 텔레메트리(ScrapeStats)는 run() 호출마다 새로 집계
 */
public final class BatchScrapeService {

    private static final Logger LOG = LoggerFactory.getLogger(BatchScrapeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(BatchScrapeService.class);

    private final ScrapeConfig config;
    private final IDocumentLoader loader;
    private final RateLimiter rateLimiter;

    /** 기본 구현(HttpDocumentLoader) */
    public BatchScrapeService(ScrapeConfig config) {
        this(config, new HttpDocumentLoader(config));
    }

    /** DI/테스트용 */
    public BatchScrapeService(ScrapeConfig config, IDocumentLoader loader) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.loader = Objects.requireNonNull(loader, "loader");
        this.rateLimiter = RateLimiter.perSecond(config.getRps());
    }

    /* =========================
       실행 API
       ========================= */

    /** 설정의 targets 그대로 */
    public BatchResult run() {
        return run(config.locators());
    }

    public BatchResult run(List<URI> locators) {
        return run(locators, ProgressListener.NONE, null);
    }

    public BatchResult run(List<URI> locators, ProgressListener listener, AtomicBoolean cancelFlag) {
        return run(locators, listener, cancelFlag, new ScrapeErrorManager());
    }

    /** 진행률 + 취소 플래그(옵션) + 외부에서 만든 오류 관리자 */
    public BatchResult run(List<URI> locators, ProgressListener listener, AtomicBoolean cancelFlag,
                           ScrapeErrorManager errors) {
        Objects.requireNonNull(locators, "locators");
        Objects.requireNonNull(errors, "errors");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final AtomicBoolean cancel = cancelFlag;
        checkCancel(cancel);

        final List<URI> items = new ArrayList<>(locators.size());
        for (URI u : locators) items.add(Objects.requireNonNull(u, "locator"));
        final int total = items.size();
        final ScrapeStats stats = new ScrapeStats();
        final int cc = Math.max(1, config.getConcurrency());
        final RecordAssembler assembler = new RecordAssembler(config.getSelectors(), errors);

        LOG.info("Batch start: locators={}, rps={}, cc={}, timeoutMs={}", total, config.getRps(), cc,
                config.getTimeoutMs());
        SLOG.info("batch-start", "locators", total, "rps", config.getRps(), "cc", cc,
                "timeoutMs", config.getTimeoutMs());

        if (total == 0) {
            pl.onProgress(ProgressListener.Phase.EXTRACT, 0, 0);
            LOG.info("Batch done. records=0, errors=0");
            return new BatchResult(List.of(), errors.errors(), List.of(), stats.snapshot());
        }
        pl.onProgress(ProgressListener.Phase.LOAD, 0, total);

        // ---- 1) 고정 스레드풀(+역압) ----
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("scrape-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final List<Future<ItemResult>> futures = new ArrayList<>(total);
        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);

        // ---- 2) 작업 제출(입력 순서) ----
        try {
            for (URI url : items) {
                checkCancel(cancel);
                futures.add(exec.submit(() -> {
                    int cur = inFlight.incrementAndGet();
                    stats.observeConcurrency(cur);
                    long t0 = System.nanoTime();
                    try {
                        ItemResult r = processOne(url, assembler, errors, cancel, stats);
                        int n = done.incrementAndGet();
                        try {
                            pl.onProgress(ProgressListener.Phase.EXTRACT, n, total);
                        } catch (RuntimeException listenerFailure) {
                            LOG.debug("Progress listener failed: {}", listenerFailure.toString());
                        }
                        return r;
                    } finally {
                        stats.addItemWallTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
                        inFlight.decrementAndGet();
                    }
                }));
            }

            // ---- 3) 결과 수집(입력 순서) ----
            List<FacilityRecord> records = new ArrayList<>();
            List<BatchResult.ItemOutcome> outcomes = new ArrayList<>(total);
            for (int i = 0; i < futures.size(); i++) {
                checkCancel(cancel);
                URI url = items.get(i);
                try {
                    ItemResult r = futures.get(i).get();
                    if (r.record != null) records.add(r.record);
                    outcomes.add(new BatchResult.ItemOutcome(url, r.state));
                } catch (CancellationException ce) {
                    throw ce;
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    if (cause instanceof CancellationException ce) throw ce;
                    // 워커 내부 예상 못한 실패도 해당 로케이터의 하드 실패로만 기록
                    errors.reportRetrievalError(url, cause);
                    SLOG.error("task-failed", cause, "url", String.valueOf(url));
                    outcomes.add(new BatchResult.ItemOutcome(url, ItemState.LOAD_FAILED));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
            }

            BatchResult result = new BatchResult(records, errors.errors(), outcomes, stats.snapshot());
            LOG.info("Batch done. records={}, retrievalErrors={}, fieldErrors={}, maxObservedCC={}",
                    records.size(), result.retrievalErrorCount(), result.fieldErrorCount(),
                    result.getStats().maxObservedConcurrency);
            SLOG.info("batch-done",
                    "records", records.size(),
                    "retrievalErrors", result.retrievalErrorCount(),
                    "fieldErrors", result.fieldErrorCount(),
                    "maxObservedCC", result.getStats().maxObservedConcurrency);
            return result;
        } finally {
            // ---- 4) 종료 ----
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /* =========================
       로케이터 한 건
       ========================= */

    private ItemResult processOne(URI url, RecordAssembler assembler, ScrapeErrorManager errors,
                                  AtomicBoolean cancel, ScrapeStats stats) {
        Item item = new Item(url);
        checkCancel(cancel);

        // Loading
        item.moveTo(ItemState.LOADING);
        FetchedPage page;
        try {
            rateLimiter.acquire();
            page = load(url, stats);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while rate-limiting");
        } catch (RetrievalException e) {
            SLOG.debug("load-failed", "url", String.valueOf(url), "status", e.getStatus(),
                    "transport", e.isTransportFailure(), "attempts", e.getAttempts());
            errors.reportRetrievalError(url, e);
            item.moveTo(ItemState.LOAD_FAILED);
            return new ItemResult(null, item.state);
        }

        // Parsed
        PageTree tree;
        try {
            tree = PageTree.parse(page.getBody(), page.getUrl().toString());
        } catch (RuntimeException e) {
            errors.reportRetrievalError(url, e);
            item.moveTo(ItemState.LOAD_FAILED);
            return new ItemResult(null, item.state);
        }
        item.moveTo(ItemState.PARSED);

        // Extracting → Done
        item.moveTo(ItemState.EXTRACTING);
        FacilityRecord record = assembler.assemble(url, tree);
        item.moveTo(ItemState.DONE);

        LOG.info("Scraped {} -> name={}, status={}, attempts={}, {}ms",
                url, record.getName().orElse("-"), page.getStatusCode(), page.getAttempts(), page.getResponseTimeMs());
        SLOG.info("page-done", "url", String.valueOf(url), "status", page.getStatusCode(),
                "attempts", page.getAttempts(), "responseMs", page.getResponseTimeMs(),
                "contentType", page.getContentType(), "empty", record.isEmpty());
        return new ItemResult(record, item.state);
    }

    /** 성공이든 포기든 로더가 보고한 시도 횟수를 집계 */
    private FetchedPage load(URI url, ScrapeStats stats) throws RetrievalException {
        try {
            FetchedPage p = loader.fetch(url);
            stats.addAttempts(p.getAttempts());
            stats.addRetries(p.getAttempts() - 1L);
            return p;
        } catch (RetrievalException e) {
            stats.addAttempts(e.getAttempts());
            stats.addRetries(e.getAttempts() - 1L);
            throw e;
        }
    }

    /* =========================
       공용 유틸
       ========================= */

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || (flag != null && flag.get())) {
            throw new CancellationException();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /** 상태 전이 검증용 홀더(워커 스레드 한 개만 만진다) */
    private static final class Item {
        final URI url;
        ItemState state = ItemState.PENDING;
        Item(URI url) { this.url = url; }
        void moveTo(ItemState next) {
            if (!state.canMoveTo(next)) {
                throw new IllegalStateException(url + ": " + state + " -> " + next);
            }
            state = next;
        }
    }

    private static final class ItemResult {
        final FacilityRecord record; // LOAD_FAILED면 null
        final ItemState state;
        ItemResult(FacilityRecord record, ItemState state) { this.record = record; this.state = state; }
    }
}
