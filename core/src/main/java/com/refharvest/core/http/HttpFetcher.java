package com.refharvest.core.http;

import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.model.CrawlStats;
import com.refharvest.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * 재시도 포함 HTTP 송신기.
 * - 고정 브라우저 User-Agent
 * - 2xx 외 응답/예외는 실패 시도로 보고 RetryPolicy에 따라 재시도, Retry-After 우선(상한 30s)
 * - 마지막 시도까지 실패하면 NetworkFailureException
 * 리다이렉트는 전송 계층(HttpClient)이 따라가며, 여기서는 추가로 처리하지 않는다.
 */
public class HttpFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);
    private static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<InputStream> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final HttpSender sender;
    private final String userAgent;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final CrawlStats stats;

    public HttpFetcher(HttpClient client, String userAgent, RetryPolicy policy, Sleeper sleeper, CrawlStats stats) {
        this(req -> Objects.requireNonNull(client, "client").send(req, HttpResponse.BodyHandlers.ofInputStream()),
                userAgent, policy, sleeper, stats);
    }

    /** 송신 훅 주입 */
    public HttpFetcher(HttpSender sender, String userAgent, RetryPolicy policy, Sleeper sleeper, CrawlStats stats) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = (stats != null) ? stats : new CrawlStats();
    }

    /**
     * 요청을 보내고 2xx 응답을 스트림 본문 그대로 돌려준다. 호출자가 body를 닫아야 한다.
     *
     * @param form    POST일 때 x-www-form-urlencoded로 보낼 필드(순서 유지). GET이면 무시.
     * @param headers 추가 헤더(Referer 등). null 허용.
     */
    public HttpResponse<InputStream> fetch(URI url, HttpMethod method, Map<String, String> form,
                                           Duration timeout, Map<String, String> headers)
            throws NetworkFailureException, InterruptedException {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(method, "method");

        CountingRetryPolicy counting = new CountingRetryPolicy(policy);
        int attempt = 1;
        int lastStatus = -1;
        IOException lastError = null;
        try {
            while (true) {
                Duration retryAfter = null;
                try {
                    HttpResponse<InputStream> resp = sender.send(buildRequest(url, method, form, timeout, headers));
                    lastStatus = resp.statusCode();
                    lastError = null;
                    if (RetryPolicy.isSuccess(lastStatus)) {
                        return resp;
                    }
                    retryAfter = parseRetryAfter(resp.headers().firstValue("Retry-After").orElse(null));
                    discard(resp);
                } catch (IOException e) {
                    lastStatus = -1;
                    lastError = e;
                }

                if (!counting.shouldRetry(lastStatus, attempt)) break;

                Duration delay = (retryAfter != null) ? retryAfter : counting.nextDelay(attempt);
                LOG.info("  Retry {}/{} for {} (status={}, wait={}ms)",
                        attempt, counting.maxAttempts(), url, lastStatus, delay.toMillis());
                sleeper.sleep(delay);
                attempt++;
            }
        } finally {
            counting.flushTo(stats, attempt);
        }
        LOG.debug("Giving up on {} after statuses {}", url, counting.failedStatuses());
        throw new NetworkFailureException(url, lastStatus, attempt, lastError);
    }

    private HttpRequest buildRequest(URI url, HttpMethod method, Map<String, String> form,
                                     Duration timeout, Map<String, String> headers) {
        HttpRequest.Builder b = HttpRequest.newBuilder(url)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        if (timeout != null) b.timeout(timeout);
        if (headers != null) headers.forEach(b::header);

        if (method == HttpMethod.POST) {
            b.header("Content-Type", "application/x-www-form-urlencoded")
             .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form), StandardCharsets.UTF_8));
        } else {
            b.GET();
        }
        return b.build();
    }

    /** key=value&... (UTF-8 URL 인코딩) */
    static String encodeForm(Map<String, String> form) {
        if (form == null || form.isEmpty()) return "";
        StringJoiner j = new StringJoiner("&");
        for (var e : form.entrySet()) {
            if (e.getKey() == null) continue;
            String v = e.getValue() == null ? "" : e.getValue();
            j.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(v, StandardCharsets.UTF_8));
        }
        return j.toString();
    }

    /** Retry-After 초 단위만 존중, 상한 30초. HTTP-date 형태는 정책 지연 사용. */
    static Duration parseRetryAfter(String v) {
        if (v == null || v.isBlank()) return null;
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return null;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void discard(HttpResponse<InputStream> resp) {
        InputStream body = resp.body();
        if (body == null) return;
        try {
            body.close();
        } catch (IOException e) {
            LOG.debug("could not close discarded body of {}: {}", resp.uri(), e.toString());
        }
    }
}
