package com.refharvest.core.download;

import com.refharvest.core.crawler.CrawlState;
import com.refharvest.core.error.FilesystemFailureException;
import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.http.Session;
import com.refharvest.core.model.CrawlStats;
import com.refharvest.core.model.DownloadOutcome;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.Placement;
import com.refharvest.core.model.ResourceRef;
import com.refharvest.core.util.ContentTypes;
import com.refharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 자원 URL 하나를 받아 싱크로 스트리밍 저장.
 * - 이미 다운로드 집합에 있으면 SKIP(쓰기 0회)
 * - 싱크에 같은 이름이 이미 있으면 SKIP(재실행 멱등성)
 * - HTML류 Content-Type + 본문이 임계값 미만이면 로그인/리다이렉트 페이지로 보고 SKIP
 * - 네트워크/파일 시스템 오류는 FAILURE로 돌려준다(예외로 올리지 않음)
 */
public final class Downloader {

    private static final Logger LOG = LoggerFactory.getLogger(Downloader.class);
    private static final StructuredLog SLOG = StructuredLog.get(Downloader.class);

    private final CrawlState state;
    private final ResourceSink sink;
    private final int htmlSkipThreshold;
    private final int chunkSize;
    private final boolean skipExisting;
    private final CrawlStats stats;
    private final List<DownloadOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger fallbackSeq = new AtomicInteger(0);

    public Downloader(CrawlState state, ResourceSink sink, HarvestConfig.DownloadCfg cfg, CrawlStats stats) {
        this.state = Objects.requireNonNull(state, "state");
        this.sink = Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cfg, "cfg");
        this.htmlSkipThreshold = cfg.getHtmlSkipThresholdBytes();
        this.chunkSize = cfg.getChunkSize();
        this.skipExisting = cfg.isSeedFromDisk();
        this.stats = (stats != null) ? stats : new CrawlStats();
    }

    /** 이름을 URL에서 유도(placement 규칙). URL에 파일 이름이 없으면 Content-Disposition → file_N. */
    public DownloadOutcome save(Session session, ResourceRef ref) throws InterruptedException {
        URI url = ref.getUrl();
        String fromUrl = FileNaming.fileNameOf(url);
        if (fromUrl != null) {
            return transfer(session, url, FileNaming.nameFor(url, ref.getPlacement(), fromUrl), ref.getPlacement());
        }
        return transfer(session, url, null, ref.getPlacement());
    }

    /** 싱크 내 이름을 직접 지정 */
    public DownloadOutcome save(Session session, URI url, String name) throws InterruptedException {
        Objects.requireNonNull(name, "name");
        return transfer(session, url, name, Placement.FLAT);
    }

    /** 지금까지의 결과(실행 내 중복 스킵은 제외) */
    public List<DownloadOutcome> outcomes() {
        synchronized (outcomes) {
            return List.copyOf(outcomes);
        }
    }

    public long successCount() {
        synchronized (outcomes) {
            return outcomes.stream().filter(DownloadOutcome::isSuccess).count();
        }
    }

    private DownloadOutcome transfer(Session session, URI url, String fixedName, Placement placement)
            throws InterruptedException {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(url, "url");

        if (!state.claimDownload(url)) {
            LOG.debug("Already downloaded in this run: {}", url);
            return DownloadOutcome.skip(url, fixedName, "already downloaded");
        }
        if (fixedName != null && skipExisting && sink.exists(fixedName)) {
            return record(DownloadOutcome.skip(url, fixedName, "already on disk"));
        }

        HttpResponse<InputStream> resp;
        try {
            resp = session.openFile(url);
        } catch (NetworkFailureException e) {
            return record(DownloadOutcome.failure(url, fixedName, e));
        }

        String name = fixedName;
        InputStream raw = resp.body();
        try {
            if (name == null) {
                String cd = FileNaming.fromContentDisposition(resp.headers().firstValue("Content-Disposition").orElse(null));
                name = FileNaming.nameFor(url, placement, cd != null ? cd : "file_" + fallbackSeq.incrementAndGet());
                if (skipExisting && sink.exists(name)) {
                    return record(DownloadOutcome.skip(url, name, "already on disk"));
                }
            }

            InputStream body = new NetworkReadStream(raw == null ? InputStream.nullInputStream() : raw);
            String contentType = resp.headers().firstValue("Content-Type").orElse(null);
            if (ContentTypes.isHtmlLike(contentType)) {
                byte[] head = body.readNBytes(htmlSkipThreshold);
                if (head.length < htmlSkipThreshold) {
                    return record(DownloadOutcome.skip(url, name,
                            "appears to be HTML (" + head.length + " bytes, " + contentType + ")"));
                }
                body = new SequenceInputStream(new ByteArrayInputStream(head), body);
            }

            long n = sink.write(name, body, chunkSize);
            stats.addBytes(n);
            return record(DownloadOutcome.success(url, name, n));
        } catch (NetworkReadException e) {
            return record(DownloadOutcome.failure(url, name,
                    new NetworkFailureException(url, resp.statusCode(), 1, e.getCause())));
        } catch (IOException e) {
            Path where = (sink instanceof FileSystemSink fs && name != null) ? fs.getRoot().resolve(name) : Path.of(String.valueOf(name));
            return record(DownloadOutcome.failure(url, name, new FilesystemFailureException(url, where, e)));
        } finally {
            closeBody(url, raw);
        }
    }

    private static void closeBody(URI url, InputStream raw) {
        if (raw == null) return;
        try {
            raw.close();
        } catch (IOException e) {
            LOG.debug("could not close body of {}: {}", url, e.toString());
        }
    }

    private DownloadOutcome record(DownloadOutcome o) {
        outcomes.add(o);
        switch (o.getStatus()) {
            case SUCCESS:
                LOG.info("  Downloaded: {} ({} bytes)", o.getName(), String.format("%,d", o.getBytes()));
                SLOG.info("download-ok", "url", o.getUrl(), "name", o.getName(), "bytes", o.getBytes());
                break;
            case SKIP:
                LOG.info("  Skipping {}: {}", o.getName() != null ? o.getName() : o.getUrl(), o.getReason());
                SLOG.info("download-skip", "url", o.getUrl(), "name", o.getName(), "reason", o.getReason());
                break;
            default:
                LOG.warn("  Failed to download {}: {}", o.getUrl(), o.getReason());
                SLOG.warn("download-failed", "url", o.getUrl(), "name", o.getName(), "reason", o.getReason());
        }
        return o;
    }

    /** 본문 읽기 실패를 파일 쓰기 실패와 구분하기 위한 표식 */
    private static final class NetworkReadException extends IOException {
        NetworkReadException(IOException cause) { super(cause.getMessage(), cause); }
    }

    private static final class NetworkReadStream extends FilterInputStream {
        NetworkReadStream(InputStream in) { super(in); }

        @Override public int read() throws IOException {
            try { return super.read(); } catch (IOException e) { throw wrap(e); }
        }

        @Override public int read(byte[] b, int off, int len) throws IOException {
            try { return super.read(b, off, len); } catch (IOException e) { throw wrap(e); }
        }

        private static IOException wrap(IOException e) {
            return (e instanceof NetworkReadException) ? e : new NetworkReadException(e);
        }
    }
}
