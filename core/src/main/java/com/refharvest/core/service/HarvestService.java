package com.refharvest.core.service;

import com.refharvest.core.auth.Authenticator;
import com.refharvest.core.crawler.CrawlEngine;
import com.refharvest.core.download.FileSystemSink;
import com.refharvest.core.download.ResourceSink;
import com.refharvest.core.error.AuthFailureException;
import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.http.Session;
import com.refharvest.core.model.CrawlStats;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.HarvestReport;
import com.refharvest.core.service.export.JsonRunReportExporter;
import com.refharvest.core.service.export.ReportExporter;
import com.refharvest.core.util.DefaultSleeper;
import com.refharvest.core.util.ProgressListener;
import com.refharvest.core.util.Sleeper;
import com.refharvest.core.util.StructuredLog;
import com.refharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 수집 오케스트레이터:
 *  - (설정 시) 로그인 → 로그인 후 대기 → 사전 약관 페이지 → 시드 크롤 → 추가 시드 크롤 → 리포트
 *  - 로그인 실패는 비치명(미인증 세션으로 계속)
 *  - 실행 시드의 페이지 요청 실패만 NetworkFailureException으로 전파
 */
public final class HarvestService {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestService.class);
    private static final StructuredLog SLOG = StructuredLog.get(HarvestService.class);

    private final HarvestConfig config;
    private final Sleeper sleeper;
    private final ResourceSink sink;
    private final ProgressListener progress;
    private final ReportExporter exporter;
    private final Authenticator authenticator;
    private final CrawlStats stats = new CrawlStats();

    private volatile CrawlEngine engine;
    private volatile boolean cancelled = false;
    private volatile Path lastReport;

    /** 기본 구성: 실제 지연, 출력 디렉터리 싱크 */
    public HarvestService(HarvestConfig config) {
        this(config, new DefaultSleeper(), null, ProgressListener.NONE);
    }

    /** 테스트/임베딩용 */
    public HarvestService(HarvestConfig config, Sleeper sleeper, ResourceSink sink, ProgressListener progress) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        if (UrlUtils.parseHttp(config.getTarget()) == null)
            throw new IllegalArgumentException("target is not an absolute http(s) URL: " + config.getTarget());
        if (config.auth().hasLogin() && UrlUtils.parseHttp(config.auth().getLoginUrl()) == null)
            throw new IllegalArgumentException("auth.loginUrl is not an absolute http(s) URL: " + config.auth().getLoginUrl());
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.sink = (sink != null) ? sink : new FileSystemSink(config.getOutputDir());
        this.progress = (progress != null) ? progress : ProgressListener.NONE;
        this.exporter = new JsonRunReportExporter();
        // 알 수 없는 auth.formAdapter는 실행 전에 여기서 IllegalArgumentException
        this.authenticator = Authenticator.from(config);
    }

    public HarvestReport run() throws NetworkFailureException, InterruptedException {
        Instant started = Instant.now();
        List<String> seeds = config.allSeeds();
        LOG.info("Harvest start: profile={}, target={}, maxDepth={}, out={}",
                config.getName(), config.getTarget(), config.getMaxDepth(), config.getOutputDir());
        SLOG.info("harvest-start",
                "profile", config.getName(),
                "target", config.getTarget(),
                "seeds", seeds.size(),
                "maxDepth", config.getMaxDepth(),
                "login", config.auth().hasLogin());

        Session session = Session.create(config, sleeper, stats);
        CrawlEngine eng = new CrawlEngine(config, session, sink, authenticator, sleeper, null, progress, stats);
        this.engine = eng;
        if (cancelled) eng.cancel();

        if (config.auth().hasLogin()) {
            progress.onProgress("login", config.auth().getLoginUrl(), 0, 0);
            try {
                authenticator.login(session, config.auth().credentials(), UrlUtils.parseHttp(config.auth().getLoginUrl()));
            } catch (AuthFailureException e) {
                LOG.warn("Login failed ({}), continuing unauthenticated", e.getMessage());
            }
            pause(config.politeness().getPostLoginDelayMs());
        }

        for (String page : config.auth().getTermsPages()) {
            if (eng.isCancelled()) break;
            URI u = UrlUtils.parseHttp(page);
            if (u == null) {
                LOG.warn("Ignoring invalid terms page URL: {}", page);
                continue;
            }
            progress.onProgress("terms", u.toString(), eng.state().visitedCount(), eng.downloader().successCount());
            eng.downloadAll(authenticator.acceptTerms(session, u));
        }

        eng.crawlSeed(UrlUtils.parseHttp(config.getTarget()));

        for (String extra : seeds.subList(1, seeds.size())) {
            if (eng.isCancelled()) break;
            URI u = UrlUtils.parseHttp(extra);
            if (u == null) {
                LOG.warn("Ignoring invalid seed URL: {}", extra);
                continue;
            }
            try {
                pause(config.politeness().getPageDelayMs());
                eng.crawlSeed(u);
            } catch (NetworkFailureException e) {
                LOG.warn("Extra seed {} unreachable: {}", u, e.getMessage());
            }
        }

        HarvestReport report = new HarvestReport(config.getName(), seeds, session.isAuthenticated(),
                started, Instant.now(), eng.state().visitedCount(), stats.snapshot(), eng.downloader().outcomes());

        if (config.isWriteReport()) {
            try {
                lastReport = exporter.export(config.getOutputDir(), config.getTarget(), report);
                LOG.info("Report written: {}", lastReport);
            } catch (IOException e) {
                LOG.warn("Could not write run report: {}", e.toString());
            }
        }

        progress.onProgress("done", null, report.getPagesVisited(), report.getFilesDownloaded());
        LOG.info("Harvest done. pages={}, downloaded={}, skipped={}, failed={}, bytes={}",
                report.getPagesVisited(), report.getFilesDownloaded(), report.getFilesSkipped(),
                report.getFilesFailed(), report.getBytesDownloaded());
        SLOG.info("harvest-done",
                "pages", report.getPagesVisited(),
                "downloaded", report.getFilesDownloaded(),
                "skipped", report.getFilesSkipped(),
                "failed", report.getFilesFailed(),
                "requests", report.getRequestsTotal(),
                "retries", report.getRetriesTotal());
        return report;
    }

    /** 진행 중 실행 취소(다음 크롤 프레임에서 멈춤) */
    public void cancel() {
        this.cancelled = true;
        CrawlEngine eng = this.engine;
        if (eng != null) eng.cancel();
    }

    /** 마지막 실행에서 쓴 리포트 경로(없으면 null) */
    public Path getLastReport() { return lastReport; }

    public CrawlStats.Snapshot getRuntimeSnapshot() { return stats.snapshot(); }

    private void pause(long ms) throws InterruptedException {
        if (ms > 0) sleeper.sleep(Duration.ofMillis(ms));
    }
}
