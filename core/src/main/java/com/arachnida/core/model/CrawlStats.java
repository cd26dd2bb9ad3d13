package com.arachnida.core.model;

import java.util.concurrent.atomic.AtomicInteger;

/** 런타임 카운터 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicInteger pagesFetched = new AtomicInteger(0);
    private final AtomicInteger pagesFailed = new AtomicInteger(0);
    private final AtomicInteger imagesSaved = new AtomicInteger(0);
    private final AtomicInteger imagesFailed = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void pageFetched() { pagesFetched.incrementAndGet(); }
    public void pageFailed() { pagesFailed.incrementAndGet(); }
    public void imageSaved() { imagesSaved.incrementAndGet(); }
    public void imageFailed() { imagesFailed.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(pagesFetched.get(), pagesFailed.get(),
                imagesSaved.get(), imagesFailed.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int pagesFetched;
        public final int pagesFailed;
        public final int imagesSaved;
        public final int imagesFailed;
        public final int maxObservedConcurrency;
        public Snapshot(int pf, int pfail, int is, int ifail, int cc) {
            this.pagesFetched = pf;
            this.pagesFailed = pfail;
            this.imagesSaved = is;
            this.imagesFailed = ifail;
            this.maxObservedConcurrency = cc;
        }
    }
}
