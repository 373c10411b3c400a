package com.refharvest.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 실행 리포트 위치: {@code <out>/reports/<host>/harvest-<label>-<yyyyMMdd-HHmmss>.json}.
 * label은 프로필 이름이 있으면 그것, 없으면 대상 URL에서 만든 slug.
 */
public final class ReportNaming {
    private ReportNaming() {}

    static final String UNKNOWN_HOST = "unknown-host";
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    public record Location(Path dir, String fileName) {
        public Path file() { return dir.resolve(fileName); }
    }

    public static Location locate(Path outputDir, String target, String profile, Instant startedAt) {
        Path base = (outputDir != null) ? outputDir : Path.of("downloads");
        String label = (profile != null && !profile.isBlank()) ? sanitize(profile, 40) : slugOf(target);
        Instant at = (startedAt != null) ? startedAt : Instant.now();
        return new Location(base.resolve("reports").resolve(hostOf(target)),
                "harvest-" + label + "-" + STAMP.format(at) + ".json");
    }

    static String hostOf(String target) {
        if (target == null || target.isBlank()) return UNKNOWN_HOST;
        try {
            String h = URI.create(target.trim()).getHost();
            return (h == null) ? UNKNOWN_HOST : sanitize(h, 100);
        } catch (IllegalArgumentException e) {
            return UNKNOWN_HOST;
        }
    }

    /** 스킴을 뺀 URL을 파일명에 쓸 수 있게 줄인다. */
    static String slugOf(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = sanitize(url.replaceFirst("(?i)^https?://", "").replace('/', '-'), 60);
        return s.isEmpty() ? "no-url" : s;
    }

    private static String sanitize(String s, int max) {
        String r = s.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9._-]", "-")
                .replaceAll("-{2,}", "-");
        if (r.length() > max) r = r.substring(0, max);
        return r.replaceAll("^-+|-+$", "");
    }
}
