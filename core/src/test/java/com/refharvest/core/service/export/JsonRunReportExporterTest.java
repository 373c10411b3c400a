package com.refharvest.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.refharvest.core.model.CrawlStats;
import com.refharvest.core.model.DownloadOutcome;
import com.refharvest.core.model.HarvestReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonRunReportExporterTest {

    @TempDir
    Path tmp;

    @Test
    void export_shouldWriteReportUnderHostDir_withCountsAndIsoDates() throws Exception {
        // given
        Instant started = Instant.parse("2024-05-01T10:15:30Z");
        URI zip = URI.create("https://www.cms.gov/files/zip/codes.zip");
        HarvestReport report = new HarvestReport("cms-hcpcs", List.of("https://www.cms.gov/medicare/coding/"),
                false, started, started.plusSeconds(42), 7,
                new CrawlStats.Snapshot(12, 2, 7, 1234),
                List.of(DownloadOutcome.success(zip, "files/zip/codes.zip", 1234),
                        DownloadOutcome.skip(URI.create("https://www.cms.gov/a.pdf"), "a.pdf", "already on disk"),
                        DownloadOutcome.failure(URI.create("https://www.cms.gov/b.pdf"), "b.pdf", new IOException("boom"))));
        ReportExporter exporter = new JsonRunReportExporter();

        // when
        Path out = exporter.export(tmp, "https://www.cms.gov/medicare/coding/", report);

        // then
        assertTrue(Files.exists(out), "Report file should exist");
        assertEquals(tmp.resolve("reports").resolve("www.cms.gov"), out.getParent());
        assertTrue(out.getFileName().toString().startsWith("harvest-cms-hcpcs-"));

        JsonNode json = new ObjectMapper().readTree(out.toFile());
        assertEquals("cms-hcpcs", json.get("profile").asText());
        assertEquals("2024-05-01T10:15:30Z", json.get("startedAt").asText());
        assertEquals(7, json.get("pagesVisited").asInt());
        assertEquals(12, json.get("requestsTotal").asLong());
        assertEquals(1, json.get("filesDownloaded").asLong());
        assertEquals(1, json.get("filesSkipped").asLong());
        assertEquals(1, json.get("filesFailed").asLong());
        assertEquals(1234, json.get("bytesDownloaded").asLong());
        assertEquals(3, json.get("downloads").size());
        assertEquals("boom", json.get("downloads").get(2).get("reason").asText());
    }

    @Test
    void naming_shouldSanitizeHostAndSlug() {
        assertEquals("loinc.org", ReportNaming.hostOf("https://LOINC.org/file-access/"));
        assertEquals("unknown-host", ReportNaming.hostOf("not a url"));
        assertEquals("loinc.org-file-access-download-id-470626", ReportNaming.slugOf("https://loinc.org/file-access/download-id/470626/"));
        assertEquals("no-url", ReportNaming.slugOf(null));

        var loc = ReportNaming.locate(null, "https://loinc.org/", null, Instant.EPOCH);
        assertEquals(Path.of("downloads", "reports", "loinc.org"), loc.dir());
        assertTrue(loc.fileName().startsWith("harvest-loinc.org-"));
        assertTrue(loc.fileName().endsWith(".json"));

        var named = ReportNaming.locate(Path.of("out"), "https://loinc.org/", "LOINC Full", Instant.EPOCH);
        assertTrue(named.fileName().startsWith("harvest-loinc-full-"));
    }
}
