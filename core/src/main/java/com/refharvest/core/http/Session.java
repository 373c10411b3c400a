package com.refharvest.core.http;

import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.model.CrawlStats;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.FetchedPage;
import com.refharvest.core.util.Sleeper;

import java.io.IOException;
import java.io.InputStream;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * HttpFetcher + 쿠키 저장소. 한 실행 동안 유지되며 인증 상태를 암묵적으로 공유한다.
 * 모든 네트워크 접근은 Session을 거친다.
 */
public final class Session {

    private final HttpFetcher fetcher;
    private final CookieManager cookies;
    private final Duration pageTimeout;
    private final Duration fileTimeout;
    private volatile boolean authenticated = false;

    public Session(HttpFetcher fetcher, CookieManager cookies, Duration pageTimeout, Duration fileTimeout) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.cookies = Objects.requireNonNull(cookies, "cookies");
        this.pageTimeout = Objects.requireNonNull(pageTimeout, "pageTimeout");
        this.fileTimeout = Objects.requireNonNull(fileTimeout, "fileTimeout");
    }

    /** 설정 기반 기본 구성: 쿠키 전부 수용, 리다이렉트 NORMAL, 고정 간격 재시도 */
    public static Session create(HarvestConfig cfg, Sleeper sleeper, CrawlStats stats) {
        Objects.requireNonNull(cfg, "cfg");
        CookieManager jar = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        HttpClient client = HttpClient.newBuilder()
                .cookieHandler(jar)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(cfg.http().getPageTimeout())
                .build();
        RetryPolicy policy = new FixedStepRetryPolicy(cfg.http().getMaxAttempts(), cfg.http().getRetryStepMs());
        HttpFetcher fetcher = new HttpFetcher(client, cfg.getUserAgent(), policy, sleeper, stats);
        return new Session(fetcher, jar, cfg.http().getPageTimeout(), cfg.http().getFileTimeout());
    }

    /** 페이지 GET(본문 버퍼링, 페이지 타임아웃) */
    public FetchedPage getPage(URI url) throws NetworkFailureException, InterruptedException {
        return buffer(url, open(url, pageTimeout));
    }

    /** 스트림 GET. 호출자가 body를 닫는다. */
    public HttpResponse<InputStream> open(URI url, Duration timeout) throws NetworkFailureException, InterruptedException {
        return fetcher.fetch(url, HttpMethod.GET, null, timeout, null);
    }

    /** 파일 본문용 스트림 GET(긴 타임아웃 + Referer=origin) */
    public HttpResponse<InputStream> openFile(URI url) throws NetworkFailureException, InterruptedException {
        return fetcher.fetch(url, HttpMethod.GET, null, fileTimeout, Map.of("Referer", origin(url) + "/"));
    }

    /** 폼 POST(x-www-form-urlencoded). 응답은 스트림 그대로. */
    public HttpResponse<InputStream> submitForm(URI action, Map<String, String> fields, URI referer)
            throws NetworkFailureException, InterruptedException {
        Map<String, String> headers = new LinkedHashMap<>();
        if (referer != null) headers.put("Referer", referer.toString());
        headers.put("Origin", origin(action));
        return fetcher.fetch(action, HttpMethod.POST, fields, pageTimeout, headers);
    }

    /** 폼 POST 후 본문까지 읽어 돌려준다(로그인 응답처럼 작은 HTML 전용). */
    public FetchedPage submitFormBuffered(URI action, Map<String, String> fields, URI referer)
            throws NetworkFailureException, InterruptedException {
        return buffer(action, submitForm(action, fields, referer));
    }

    public boolean isAuthenticated() { return authenticated; }
    public void markAuthenticated() { this.authenticated = true; }

    /** 현재 쿠키 스냅샷 */
    public List<HttpCookie> cookies() { return List.copyOf(cookies.getCookieStore().getCookies()); }

    public Duration getPageTimeout() { return pageTimeout; }
    public Duration getFileTimeout() { return fileTimeout; }

    /** 응답 본문을 모두 읽어 FetchedPage로 만든다. 읽기 실패는 NetworkFailure. */
    public static FetchedPage buffer(URI requested, HttpResponse<InputStream> resp) throws NetworkFailureException {
        long start = System.nanoTime();
        byte[] bytes;
        try (InputStream in = resp.body()) {
            bytes = (in == null) ? new byte[0] : in.readAllBytes();
        } catch (IOException e) {
            throw new NetworkFailureException(requested, resp.statusCode(), 1, e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        return new FetchedPage(requested, resp.uri(), resp.statusCode(),
                resp.headers().firstValue("Content-Type").orElse(null), bytes, elapsedMs);
    }

    private static String origin(URI u) {
        return u.getScheme() + "://" + u.getRawAuthority();
    }
}
