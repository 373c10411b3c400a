package com.refharvest.core.util;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 수집 이벤트(로그인, 페이지 조회, 다운로드 결과)를 한 줄 JSON으로 남기는 로거.
 * 핸들러는 LogSetup이 붙인 JUL 핸들러를 그대로 쓴다.
 *
 * <p>값 렌더링: URI/Path는 문자열, Duration은 밀리초 숫자, 비밀 키(password 등)는 가림.
 */
public final class StructuredLog {
    static final String MASK = "***";
    private static final Set<String> SECRET_KEYS = Set.of("password", "secret", "token", "cookie", "authorization");

    private final Logger jul;
    private final String source;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.source = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void info(String event, Object... fields) { emit(Level.INFO, event, fields); }
    public void warn(String event, Object... fields) { emit(Level.WARNING, event, fields); }

    private void emit(Level level, String event, Object... fields) {
        if (!jul.isLoggable(level)) return;
        jul.log(level, render(level, event, fields));
    }

    /** fields는 key, value 교대. 홀수 개면 남는 키는 "_dangling"으로 기록. */
    String render(Level level, String event, Object... fields) {
        JsonLine line = new JsonLine()
                .put("at", Instant.now().toString())
                .put("level", level == Level.WARNING ? "WARN" : level.getName())
                .put("src", source)
                .put("event", event);
        if (fields != null) {
            int i = 0;
            for (; i + 1 < fields.length; i += 2) {
                String key = String.valueOf(fields[i]);
                line.put(key, isSecret(key) ? MASK : fields[i + 1]);
            }
            if (i < fields.length) line.put("_dangling", String.valueOf(fields[i]));
        }
        return line.close();
    }

    static boolean isSecret(String key) {
        return SECRET_KEYS.contains(key.toLowerCase(Locale.ROOT));
    }

    /** 키 순서를 유지하는 최소 JSON 객체 빌더. */
    private static final class JsonLine {
        private final StringBuilder sb = new StringBuilder(160).append('{');
        private boolean first = true;

        JsonLine put(String key, Object value) {
            if (!first) sb.append(',');
            first = false;
            quote(key);
            sb.append(':');
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Duration) {
                sb.append(((Duration) value).toMillis());
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof URI || value instanceof Path) {
                quote(value.toString());
            } else {
                quote(String.valueOf(value));
            }
            return this;
        }

        String close() {
            return sb.append('}').toString();
        }

        private void quote(String s) {
            sb.append('"');
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == '"' || c == '\\') {
                    sb.append('\\').append(c);
                } else if (c == '\n') {
                    sb.append("\\n");
                } else if (c == '\r') {
                    sb.append("\\r");
                } else if (c == '\t') {
                    sb.append("\\t");
                } else if (c < 0x20) {
                    sb.append(String.format("\\u%04x", (int) c));
                } else {
                    sb.append(c);
                }
            }
            sb.append('"');
        }
    }
}
