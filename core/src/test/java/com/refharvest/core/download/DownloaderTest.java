package com.refharvest.core.download;

import com.refharvest.core.crawler.CrawlState;
import com.refharvest.core.error.FilesystemFailureException;
import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.http.Session;
import com.refharvest.core.model.CrawlStats;
import com.refharvest.core.model.DownloadOutcome;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.ResourceRef;
import com.refharvest.core.support.FakeSite;
import com.refharvest.core.support.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Downloader — 저장/스킵/실패 판정")
class DownloaderTest {

    @TempDir Path out;

    private FakeSite site;
    private HarvestConfig cfg;
    private Session session;
    private CrawlState state;
    private CrawlStats stats;

    @BeforeEach
    void setUp() throws Exception {
        site = FakeSite.start();
        cfg = HarvestConfig.defaults().setTarget(site.base() + "/").setOutputDir(out).withoutDelays();
        session = Session.create(cfg, new RecordingSleeper(), null);
        state = new CrawlState();
        stats = new CrawlStats();
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private Downloader downloader(ResourceSink sink) {
        return new Downloader(state, sink, cfg.download(), stats);
    }

    private Downloader downloader() {
        return downloader(new FileSystemSink(out));
    }

    @Test
    @DisplayName("작은 HTML 응답은 로그인/리다이렉트 페이지로 보고 건너뛴다")
    void small_html_is_skipped() throws Exception {
        site.html("/protected/codes.zip", "<html><body>Please log in</body></html>");

        DownloadOutcome o = downloader().save(session, ResourceRef.file(site.url("/protected/codes.zip")));

        assertThat(o.isSkip()).isTrue();
        assertThat(o.getReason()).contains("appears to be HTML");
        assertThat(out.resolve("protected/codes.zip")).doesNotExist();
    }

    @Test
    @DisplayName("임계값 이상의 HTML은 앞부분까지 온전히 저장")
    void large_html_is_written_whole() throws Exception {
        cfg.download().setHtmlSkipThresholdBytes(16);
        String body = "<html>" + "x".repeat(100) + "</html>";
        site.html("/docs/table.xml", body);

        DownloadOutcome o = downloader().save(session, ResourceRef.file(site.url("/docs/table.xml")));

        assertThat(o.isSuccess()).isTrue();
        assertThat(out.resolve("docs/table.xml")).hasContent(body);
        assertThat(stats.snapshot().bytesWritten).isEqualTo(body.length());
    }

    @Test
    @DisplayName("같은 실행에서 두 번째 요청은 네트워크/쓰기 없이 건너뛴다")
    void in_run_duplicate_is_skipped_without_io() throws Exception {
        site.bytes("/a.zip", "application/zip", new byte[]{1, 2, 3});
        Downloader d = downloader();

        d.save(session, ResourceRef.file(site.url("/a.zip")));
        DownloadOutcome second = d.save(session, ResourceRef.file(site.url("/a.zip")));

        assertThat(second.isSkip()).isTrue();
        assertThat(site.hits("/a.zip")).isEqualTo(1);
        assertThat(d.outcomes()).hasSize(1);
        assertThat(d.successCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("디스크에 이미 있으면 요청하지 않는다(재실행 멱등성)")
    void existing_file_on_disk_is_skipped() throws Exception {
        Files.write(out.resolve("a.zip"), new byte[]{9});
        site.bytes("/a.zip", "application/zip", new byte[]{1, 2, 3});

        DownloadOutcome o = downloader().save(session, ResourceRef.file(site.url("/a.zip")));

        assertThat(o.isSkip()).isTrue();
        assertThat(o.getReason()).isEqualTo("already on disk");
        assertThat(site.hits("/a.zip")).isZero();
        assertThat(Files.readAllBytes(out.resolve("a.zip"))).containsExactly(9);
    }

    @Test
    @DisplayName("seedFromDisk=false면 덮어쓴다")
    void existing_file_is_replaced_when_disk_seeding_is_off() throws Exception {
        cfg.download().setSeedFromDisk(false);
        Files.write(out.resolve("a.zip"), new byte[]{9});
        site.bytes("/a.zip", "application/zip", new byte[]{1, 2, 3});

        DownloadOutcome o = downloader().save(session, ResourceRef.file(site.url("/a.zip")));

        assertThat(o.isSuccess()).isTrue();
        assertThat(Files.readAllBytes(out.resolve("a.zip"))).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("URL에 이름이 없으면 Content-Disposition 이름을 쓴다")
    void content_disposition_name() throws Exception {
        site.route("/export", (ex, r) -> {
            ex.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"codes.csv\"");
            FakeSite.send(ex, 200, "text/csv", "a,b".getBytes(StandardCharsets.UTF_8));
        });

        DownloadOutcome o = downloader().save(session, ResourceRef.file(site.url("/export?id=1")));

        assertThat(o.getName()).isEqualTo("codes.csv");
        assertThat(out.resolve("codes.csv")).hasContent("a,b");
    }

    @Test
    void explicit_name() throws Exception {
        site.bytes("/x", "application/octet-stream", new byte[]{4, 2});

        DownloadOutcome o = downloader().save(session, site.url("/x"), "named/output.bin");

        assertThat(o.isSuccess()).isTrue();
        assertThat(out.resolve("named/output.bin")).exists();
    }

    @Test
    @DisplayName("HTTP 오류는 재시도 후 FAILURE(예외 전파 없음)")
    void network_failure_is_recorded() throws Exception {
        site.status("/broken.zip", 500);

        DownloadOutcome o = downloader().save(session, ResourceRef.file(site.url("/broken.zip")));

        assertThat(o.isFailure()).isTrue();
        assertThat(o.getCause()).isInstanceOf(NetworkFailureException.class);
        assertThat(site.hits("/broken.zip")).isEqualTo(3);
    }

    @Test
    @DisplayName("싱크 쓰기 오류는 FilesystemFailureException 원인의 FAILURE")
    void filesystem_failure_is_recorded() throws Exception {
        site.bytes("/a.zip", "application/zip", new byte[]{1});
        ResourceSink readOnly = new ResourceSink() {
            @Override public boolean exists(String name) { return false; }
            @Override public long write(String name, InputStream body, int chunkSize) throws IOException {
                throw new IOException("read-only file system");
            }
        };

        DownloadOutcome o = downloader(readOnly).save(session, ResourceRef.file(site.url("/a.zip")));

        assertThat(o.isFailure()).isTrue();
        assertThat(o.getCause()).isInstanceOf(FilesystemFailureException.class);
        assertThat(o.getReason()).contains("read-only file system");
    }
}
