package com.refharvest.core.model;

import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);   // 재시도 횟수 총합
    private final AtomicLong pagesFetched  = new AtomicLong(0);
    private final AtomicLong bytesWritten  = new AtomicLong(0);

    /** attempts = (1 + retries) for a request */
    public void addAttempts(long attempts) { requestsTotal.addAndGet(attempts); }
    public void addRetries(long retries) { retriesTotal.addAndGet(retries); }
    public void pageFetched() { pagesFetched.incrementAndGet(); }
    public void addBytes(long n) { bytesWritten.addAndGet(n); }

    public Snapshot snapshot() {
        return new Snapshot(requestsTotal.get(), retriesTotal.get(), pagesFetched.get(), bytesWritten.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final long pagesFetched;
        public final long bytesWritten;
        public Snapshot(long r, long t, long p, long b) {
            this.requestsTotal = r;
            this.retriesTotal = t;
            this.pagesFetched = p;
            this.bytesWritten = b;
        }
    }
}
