package com.refharvest.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.refharvest.core.model.HarvestReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** HarvestReport → JSON(Jackson, ISO-8601 날짜, pretty print) */
public class JsonRunReportExporter implements ReportExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public Path export(Path baseDir, String target, HarvestReport report) throws IOException {
        Objects.requireNonNull(report, "report");
        ReportNaming.Location loc = ReportNaming.locate(baseDir, target, report.getProfile(), report.getStartedAt());
        Files.createDirectories(loc.dir());
        Path outFile = loc.file();
        om.writerWithDefaultPrettyPrinter().writeValue(outFile.toFile(), report);
        return outFile;
    }
}
