package com.refharvest.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + same-origin 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     * 경로와 쿼리는 raw(인코딩된) 형태 그대로 다룬다. %26, %2F 같은 이스케이프는 풀지 않는다.
     * 경로 끝의 "/"는 유지한다(/docs/more/ 와 /docs/more 는 다른 자원일 수 있음).
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = (u.getHost() != null) ? u.getHost() : u.getRawAuthority();
        if (host == null) return u;

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String rawPath = u.getRawPath();
        String path = (rawPath == null || rawPath.isEmpty()) ? "/" : rawPath.replaceAll("/{2,}", "/");

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            // 재조립 실패 시 원본 유지
            return u;
        }
    }

    /** 문자열 → 정규화된 절대 http(s) URI. 해석 불가/비 http 스킴이면 null. */
    public static URI parseHttp(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI u = new URI(raw.trim().replace(" ", "%20"));
            String s = u.getScheme();
            if (s == null) return null;
            if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) return null;
            if (u.getHost() == null) return null;
            return normalize(u);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** base 기준으로 href를 해석. 실패 시 null. */
    public static URI resolve(URI base, String href) {
        if (href == null || href.isBlank()) return null;
        try {
            return parseHttp(base.resolve(href.trim().replace(" ", "%20")).toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    /** scheme + host + (유효)포트 모두 같으면 same-origin */
    public static boolean sameOrigin(URI a, URI b) {
        if (!sameDomain(a, b)) return false;
        String sa = a.getScheme() == null ? "" : a.getScheme().toLowerCase(Locale.ROOT);
        String sb = b.getScheme() == null ? "" : b.getScheme().toLowerCase(Locale.ROOT);
        return sa.equals(sb) && effectivePort(a) == effectivePort(b);
    }

    /** 소문자 경로(없으면 "/") */
    public static String lowerPath(URI u) {
        String p = (u == null || u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        return p.toLowerCase(Locale.ROOT);
    }

    private static int effectivePort(URI u) {
        if (u.getPort() != -1) return u.getPort();
        return "https".equalsIgnoreCase(u.getScheme()) ? 443 : 80;
    }
}
