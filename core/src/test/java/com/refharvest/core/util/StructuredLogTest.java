package com.refharvest.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    @DisplayName("기본 필드와 값 타입별 렌더링")
    void renders_fields_in_order() {
        String line = slog.render(Level.INFO, "download-ok",
                "url", URI.create("https://h/a.zip"), "path", Path.of("out"), "wait", Duration.ofSeconds(2), "bytes", 10L);

        assertTrue(line.startsWith("{\"at\":\""), line);
        assertTrue(line.endsWith("}"), line);
        assertTrue(line.contains("\"level\":\"INFO\",\"src\":\"StructuredLogTest\",\"event\":\"download-ok\""), line);
        for (String part : new String[]{"\"url\":\"https://h/a.zip\"", "\"path\":\"out\"", "\"wait\":2000", "\"bytes\":10"}) {
            assertTrue(line.contains(part), () -> part + " missing in " + line);
        }
    }

    @Test
    @DisplayName("비밀 키는 가리고 따옴표/개행은 이스케이프")
    void masks_secrets_and_escapes() {
        String line = slog.render(Level.WARNING, "login-failed", "Password", "hunter2", "reason", "bad \"x\"\nline");

        assertTrue(line.contains("\"level\":\"WARN\""), line);
        assertTrue(line.contains("\"Password\":\"***\""), line);
        assertFalse(line.contains("hunter2"));
        assertTrue(line.contains("\"reason\":\"bad \\\"x\\\"\\nline\""), line);
    }

    @Test
    @DisplayName("홀수 개 필드는 남은 키를 _dangling으로 기록")
    void odd_field_count() {
        String line = slog.render(Level.INFO, "e", "a", 1, "orphan");
        assertTrue(line.endsWith("\"a\":1,\"_dangling\":\"orphan\"}"), line);
    }
}
