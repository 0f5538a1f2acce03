package com.siteharvest.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong fetchesTotal = new AtomicLong(0);     // fetch 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal = new AtomicLong(0);     // 재시도 횟수 총합
    private final AtomicLong sumWallMs = new AtomicLong(0);        // 페이지별 fetch+parse+extract 벽시계 합
    private final AtomicLong pagesTimed = new AtomicLong(0);
    private final AtomicInteger pagesVisited = new AtomicInteger(0);
    private final AtomicInteger pagesFailed = new AtomicInteger(0);
    private final AtomicInteger duplicatesDiscarded = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** attempts = (1 + retries) for a URL */
    public void addAttempts(long attempts) { fetchesTotal.addAndGet(attempts); }
    public void addRetries(long retries) { retriesTotal.addAndGet(retries); }
    public void addWallTimeMs(long wallMs) {
        sumWallMs.addAndGet(wallMs);
        pagesTimed.incrementAndGet();
    }
    public void pageVisited() { pagesVisited.incrementAndGet(); }
    public void pageFailed() { pagesFailed.incrementAndGet(); }
    public void duplicateDiscarded() { duplicatesDiscarded.incrementAndGet(); }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long timed = Math.max(1, pagesTimed.get());
        return new Snapshot(
                pagesVisited.get(),
                pagesFailed.get(),
                duplicatesDiscarded.get(),
                fetchesTotal.get(),
                retriesTotal.get(),
                maxObservedConcurrency.get(),
                sumWallMs.get() / timed);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int pagesVisited;
        public final int pagesFailed;
        public final int duplicatesDiscarded;
        public final long fetchesTotal;
        public final long retriesTotal;
        public final int maxObservedConcurrency;
        public final long avgPageMs;

        public Snapshot(int visited, int failed, int dup, long fetches, long retries, int cc, long avg) {
            this.pagesVisited = visited;
            this.pagesFailed = failed;
            this.duplicatesDiscarded = dup;
            this.fetchesTotal = fetches;
            this.retriesTotal = retries;
            this.maxObservedConcurrency = cc;
            this.avgPageMs = avg;
        }
    }
}
