package com.refharvest.core.crawler;

import com.refharvest.core.auth.Authenticator;
import com.refharvest.core.download.Downloader;
import com.refharvest.core.download.ResourceSink;
import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.error.ParseFailureException;
import com.refharvest.core.http.Session;
import com.refharvest.core.model.CrawlStats;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.FetchedPage;
import com.refharvest.core.model.ResourceRef;
import com.refharvest.core.util.ProgressListener;
import com.refharvest.core.util.Sleeper;
import com.refharvest.core.util.StructuredLog;
import com.refharvest.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 깊이 제한 재귀 크롤러(순차 실행).
 * - 방문 집합/다운로드 집합은 엔진 인스턴스가 소유(CrawlState)
 * - 확장자로 파일이 확정되면 페이지로 가져오지 않고 Downloader에 위임
 * - 페이지 응답이 바이너리면 Downloader로 넘긴다(재요청)
 * - 약관 트리거 URL이면 Authenticator의 약관 동의 흐름을 태운다
 * 실행 시드의 페이지 요청 실패만 호출자에게 전파된다.
 */
public class CrawlEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlEngine.class);

    private final HarvestConfig config;
    private final Session session;
    private final LinkExtractor extractor;
    private final ResourceClassifier classifier;
    private final Authenticator authenticator;   // null 허용(약관 흐름 생략)
    private final Sleeper sleeper;
    private final ProgressListener progress;
    private final CrawlStats stats;
    private final CrawlState state = new CrawlState();
    private final Downloader downloader;

    private volatile boolean cancelled = false;

    public CrawlEngine(HarvestConfig config, Session session, ResourceSink sink,
                       Authenticator authenticator, Sleeper sleeper) {
        this(config, session, sink, authenticator, sleeper, null, null, null);
    }

    public CrawlEngine(HarvestConfig config, Session session, ResourceSink sink,
                       Authenticator authenticator, Sleeper sleeper,
                       LinkExtractor extractor, ProgressListener progress, CrawlStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.session = Objects.requireNonNull(session, "session");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.authenticator = authenticator;
        this.classifier = ResourceClassifier.from(config.links());
        this.extractor = (extractor != null) ? extractor : new JsoupLinkExtractor(classifier);
        this.progress = (progress != null) ? progress : ProgressListener.NONE;
        this.stats = (stats != null) ? stats : new CrawlStats();
        this.downloader = new Downloader(state, Objects.requireNonNull(sink, "sink"), config.download(), this.stats);
    }

    /**
     * 시드 하나를 깊이 0부터 크롤.
     * @throws NetworkFailureException 시드 페이지 자체를 가져오지 못한 경우
     */
    public void crawlSeed(URI seed) throws NetworkFailureException, InterruptedException {
        URI s = UrlUtils.normalize(Objects.requireNonNull(seed, "seed"));
        LOG.info("Crawling from {} (maxDepth={})", s, config.getMaxDepth());
        crawl(s, 0, s, true);
    }

    /** 진행 중 크롤 중단 요청(다음 프레임에서 멈춤) */
    public void cancel() { this.cancelled = true; }

    public boolean isCancelled() { return cancelled; }

    public CrawlState state() { return state; }

    public Downloader downloader() { return downloader; }

    private void crawl(URI url, int depth, URI seed, boolean isSeed)
            throws NetworkFailureException, InterruptedException {
        if (cancelled) return;
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("crawl interrupted");
        if (depth > config.getMaxDepth()) return;
        if (state.isVisited(url)) return;
        if (state.visitedCount() >= config.getMaxPages()) {
            LOG.warn("Page limit {} reached, not visiting {}", config.getMaxPages(), url);
            return;
        }

        // 확장자로 확정된 파일: 페이지로 가져오지 않는다
        if (classifier.hasFileExtension(url)) {
            download(ResourceRef.file(url));
            return;
        }

        state.markVisited(url);
        LOG.info("{}Visiting: {}", indent(depth), url);
        progress.onProgress("crawl", url.toString(), state.visitedCount(), downloader.successCount());

        HttpResponse<InputStream> resp;
        try {
            resp = session.open(url, session.getPageTimeout());
        } catch (NetworkFailureException e) {
            LOG.warn("{}Error fetching {}: {}", indent(depth), url, e.getMessage());
            SLOG.warn("page-failed", "url", url, "depth", depth, "status", e.getStatusCode(), "reason", e.getMessage());
            if (isSeed) throw e;
            return;
        }

        String contentType = resp.headers().firstValue("Content-Type").orElse(null);
        if (classifier.isFile(url, contentType)) {
            closeQuietly(url, resp);
            LOG.info("{}Binary content at {} ({}), downloading", indent(depth), url, contentType);
            download(ResourceRef.file(url));
            return;
        }

        FetchedPage page;
        try {
            page = Session.buffer(url, resp);
        } catch (NetworkFailureException e) {
            LOG.warn("{}Error reading {}: {}", indent(depth), url, e.getMessage());
            SLOG.warn("page-failed", "url", url, "depth", depth, "reason", e.getMessage());
            if (isSeed) throw e;
            return;
        }
        stats.pageFetched();
        URI base = page.baseUri();
        if (!base.equals(url)) state.markVisited(base);
        SLOG.info("page-fetch", "url", url, "finalUrl", base, "depth", depth,
                "status", page.getStatusCode(), "bytes", page.size(), "ms", page.getReadMillis());

        Document doc;
        try {
            doc = parse(page, base);
        } catch (ParseFailureException e) {
            LOG.warn("{}Could not parse {}: {}", indent(depth), url, e.getMessage());
            SLOG.warn("page-failed", "url", url, "depth", depth, "reason", "parse");
            return;
        }

        Set<ResourceRef> refs = extractor.extract(doc, base);
        List<ResourceRef> files = new ArrayList<>();
        List<ResourceRef> pages = new ArrayList<>();
        for (ResourceRef ref : refs) {
            (ref.isFile() ? files : pages).add(ref);
        }
        downloadAll(files);

        if (authenticator != null && isTermsTrigger(url)) {
            downloadAll(authenticator.acceptTerms(session, base, doc));
        }

        if (depth + 1 > config.getMaxDepth()) return;
        for (ResourceRef ref : pages) {
            if (cancelled) return;
            URI next = ref.getUrl();
            if (config.isSameOriginOnly() && !UrlUtils.sameOrigin(seed, next)) continue;
            if (state.isVisited(next)) continue;
            pause(config.politeness().getPageDelayMs());
            crawl(next, depth + 1, seed, false);
        }
    }

    /** 아직 받지 않은 파일 참조를 순서대로 저장(각 다운로드 뒤 지연) */
    public void downloadAll(List<ResourceRef> refs) throws InterruptedException {
        for (ResourceRef ref : refs) {
            if (cancelled) return;
            if (state.isDownloaded(ref.getUrl())) continue;
            download(ref);
            pause(config.politeness().getDownloadDelayMs());
        }
    }

    private void download(ResourceRef ref) throws InterruptedException {
        downloader.save(session, ref);
        progress.onProgress("download", ref.getUrl().toString(), state.visitedCount(), downloader.successCount());
    }

    private boolean isTermsTrigger(URI url) {
        String s = url.toString().toLowerCase(Locale.ROOT);
        for (String t : config.links().getTermsTriggers()) {
            if (s.contains(t)) return true;
        }
        return false;
    }

    private static Document parse(FetchedPage page, URI base) throws ParseFailureException {
        try {
            return Jsoup.parse(page.bodyText(), base.toString());
        } catch (RuntimeException e) {
            throw new ParseFailureException(base, e);
        }
    }

    private void pause(long ms) throws InterruptedException {
        if (ms > 0) sleeper.sleep(Duration.ofMillis(ms));
    }

    private static void closeQuietly(URI url, HttpResponse<InputStream> resp) {
        InputStream in = resp.body();
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("could not close body of {}: {}", url, e.toString());
        }
    }

    private static String indent(int depth) {
        return "  ".repeat(Math.max(0, depth));
    }
}
