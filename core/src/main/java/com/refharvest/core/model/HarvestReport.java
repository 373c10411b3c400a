package com.refharvest.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** 한 번의 수집 실행 요약. JSON 리포트(Jackson) 직렬화 대상이라 게터만 노출. */
public final class HarvestReport {

    /** 다운로드 결과 한 줄 */
    public static final class Entry {
        private final String url;
        private final String name;
        private final String status;
        private final long bytes;
        private final String reason;

        Entry(DownloadOutcome o) {
            this.url = o.getUrl().toString();
            this.name = o.getName();
            this.status = o.getStatus().name();
            this.bytes = o.getBytes();
            this.reason = o.getReason();
        }

        public String getUrl() { return url; }
        public String getName() { return name; }
        public String getStatus() { return status; }
        public long getBytes() { return bytes; }
        public String getReason() { return reason; }
    }

    private final String profile;
    private final List<String> seeds;
    private final boolean authenticated;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final int pagesVisited;
    private final long requestsTotal;
    private final long retriesTotal;
    private final List<Entry> downloads;

    public HarvestReport(String profile, List<String> seeds, boolean authenticated,
                         Instant startedAt, Instant finishedAt, int pagesVisited,
                         CrawlStats.Snapshot stats, List<DownloadOutcome> outcomes) {
        this.profile = profile;
        this.seeds = List.copyOf(seeds);
        this.authenticated = authenticated;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.pagesVisited = pagesVisited;
        this.requestsTotal = stats.requestsTotal;
        this.retriesTotal = stats.retriesTotal;
        List<Entry> es = new ArrayList<>(outcomes.size());
        for (DownloadOutcome o : outcomes) es.add(new Entry(o));
        this.downloads = List.copyOf(es);
    }

    public String getProfile() { return profile; }
    public List<String> getSeeds() { return seeds; }
    public boolean isAuthenticated() { return authenticated; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public int getPagesVisited() { return pagesVisited; }
    public long getRequestsTotal() { return requestsTotal; }
    public long getRetriesTotal() { return retriesTotal; }
    public List<Entry> getDownloads() { return downloads; }

    public long getFilesDownloaded() { return count("SUCCESS"); }
    public long getFilesSkipped() { return count("SKIP"); }
    public long getFilesFailed() { return count("FAILURE"); }

    public long getBytesDownloaded() {
        long n = 0;
        for (Entry e : downloads) n += e.getBytes();
        return n;
    }

    private long count(String status) {
        return downloads.stream().filter(e -> status.equals(e.getStatus())).count();
    }
}
