package com.refharvest.core.util;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** Content-Type 헤더의 거친 판별(HTML 페이지 vs 바이너리 파일). */
public final class ContentTypes {
    private ContentTypes() {}

    public static boolean isHtmlLike(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** application/*(xhtml 제외), pdf, zip, octet-stream 이면 파일로 본다. */
    public static boolean isBinary(String contentType) {
        if (contentType == null || contentType.isBlank()) return false;
        if (isHtmlLike(contentType)) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("application/") || ct.contains("pdf")
                || ct.contains("zip") || ct.contains("octet-stream");
    }

    public static Charset charsetOf(String contentType) {
        if (contentType != null) {
            for (String part : contentType.split(";")) {
                String p = part.trim();
                if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                    String name = p.substring(8).replace("\"", "").trim();
                    try {
                        return Charset.forName(name);
                    } catch (IllegalArgumentException e) {
                        return StandardCharsets.UTF_8; // 알 수 없는 charset
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
