package com.studioscout.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScrapeStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicLong sumWallMs     = new AtomicLong(0);   // 로케이터별 load+extract 벽시계 합
    private final AtomicLong itemsTotal    = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addAttempts(long attempts) { requestsTotal.addAndGet(attempts); }
    public void addRetries(long retries) { retriesTotal.addAndGet(retries); }

    public void addItemWallTimeMs(long wallMs) {
        sumWallMs.addAndGet(wallMs);
        itemsTotal.incrementAndGet();
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long items = Math.max(1, itemsTotal.get());
        return new Snapshot(requestsTotal.get(), retriesTotal.get(),
                maxObservedConcurrency.get(), sumWallMs.get() / items);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;   // 로케이터당 평균(재시도 대기 포함)
        public Snapshot(long r, long t, int c, long a) {
            this.requestsTotal = r;
            this.retriesTotal = t;
            this.maxObservedConcurrency = c;
            this.avgLatencyMs = a;
        }
    }
}
