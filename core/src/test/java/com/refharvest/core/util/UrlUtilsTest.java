package com.refharvest.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    @DisplayName("정규화: fragment 제거, scheme/host 소문자, 기본 포트 제거, 끝 슬래시 유지")
    void normalize_rules() {
        assertEquals("https://example.com/a/b/",
                UrlUtils.normalize(URI.create("HTTPS://Example.COM:443/a//b/#frag")).toString());
        assertEquals("http://example.com/",
                UrlUtils.normalize(URI.create("http://example.com:80")).toString());
        assertEquals("http://example.com:8080/docs/more/?x=1",
                UrlUtils.normalize(URI.create("http://example.com:8080/docs/more/?x=1")).toString());
    }

    @Test
    @DisplayName("인코딩된 예약 문자(%26 %3D %2B %2F)는 풀지 않는다")
    void normalize_keeps_percent_escapes() {
        assertEquals("https://h.org/get?file=a%26b.zip&id=1",
                UrlUtils.parseHttp("https://h.org/get?file=a%26b.zip&id=1").toString());
        assertEquals("https://h.org/a%2Fb/x.zip",
                UrlUtils.parseHttp("https://h.org/a%2Fb/x.zip").toString());
        assertEquals("https://h.org/dl?token=x%3Dy%2Bz",
                UrlUtils.parseHttp("https://H.org//dl?token=x%3Dy%2Bz#top").toString());

        URI encoded = UrlUtils.parseHttp("https://h.org/get?file=a%26b.zip");
        URI plain = UrlUtils.parseHttp("https://h.org/get?file=a&b.zip");
        assertNotEquals(plain, encoded, "distinct resources must not collapse");
    }

    @Test
    @DisplayName("parseHttp: 비 http 스킴/상대 경로/공백은 null")
    void parseHttp_rejects_non_http() {
        assertNull(UrlUtils.parseHttp("mailto:a@b.c"));
        assertNull(UrlUtils.parseHttp("javascript:void(0)"));
        assertNull(UrlUtils.parseHttp("/relative/path"));
        assertNull(UrlUtils.parseHttp("  "));
        assertEquals("https://example.com/a%20file.pdf",
                UrlUtils.parseHttp("https://example.com/a file.pdf").toString());
    }

    @Test
    void resolve_relative_against_base() {
        URI base = URI.create("https://example.com/docs/index.html");
        assertEquals("https://example.com/docs/report.pdf", UrlUtils.resolve(base, "report.pdf").toString());
        assertEquals("https://example.com/more/", UrlUtils.resolve(base, "/more/").toString());
        assertEquals("https://example.com/docs/index.html", UrlUtils.resolve(base, "#top").toString());
        assertEquals("https://example.com/dl?token=x%3Dy%26z&f=1",
                UrlUtils.resolve(base, "/dl?token=x%3Dy%26z&f=1").toString());
        assertNull(UrlUtils.resolve(base, ""));
    }

    @Test
    @DisplayName("same-origin은 scheme/host/유효 포트가 모두 같아야 한다")
    void sameOrigin() {
        URI a = URI.create("https://example.com/x");
        assertTrue(UrlUtils.sameOrigin(a, URI.create("https://example.com:443/y")));
        assertFalse(UrlUtils.sameOrigin(a, URI.create("http://example.com/y")));
        assertFalse(UrlUtils.sameOrigin(a, URI.create("https://cdn.example.com/y")));
        assertTrue(UrlUtils.sameDomain(a, URI.create("http://EXAMPLE.com/y")));
    }

    @Test
    void lowerPath_defaults_to_slash() {
        assertEquals("/", UrlUtils.lowerPath(URI.create("https://example.com")));
        assertEquals("/data/codes.zip", UrlUtils.lowerPath(URI.create("https://example.com/Data/CODES.ZIP")));
    }
}
