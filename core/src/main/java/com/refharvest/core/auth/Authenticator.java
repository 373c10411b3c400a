package com.refharvest.core.auth;

import com.refharvest.core.crawler.ResourceClassifier;
import com.refharvest.core.error.AuthFailureException;
import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.http.Session;
import com.refharvest.core.model.Credentials;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.FetchedPage;
import com.refharvest.core.model.ResourceRef;
import com.refharvest.core.util.ContentTypes;
import com.refharvest.core.util.StructuredLog;
import com.refharvest.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 로그인 + 약관 동의 워크플로. 폼 필드 수집은 FormAdapter에 위임.
 * 로그인 실패는 AuthFailureException(호출자가 비치명으로 처리),
 * 약관 동의는 실패해도 빈 목록을 돌려준다.
 */
public class Authenticator {

    private static final Logger LOG = LoggerFactory.getLogger(Authenticator.class);
    private static final StructuredLog SLOG = StructuredLog.get(Authenticator.class);

    static final String LOGIN_DUMP_FILE = "login_response.html";

    private final FormAdapter adapter;
    private final ResourceClassifier classifier;
    private final List<String> successFragments;
    private final Path dumpDir;   // null이면 실패 응답 저장 안 함

    public Authenticator(FormAdapter adapter, ResourceClassifier classifier,
                         List<String> successFragments, Path dumpDir) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        List<String> frags = new ArrayList<>();
        if (successFragments != null) frags.addAll(successFragments);
        frags.addAll(adapter.successUrlFragments());
        this.successFragments = List.copyOf(frags);
        this.dumpDir = dumpDir;
    }

    public static Authenticator from(HarvestConfig cfg) {
        HarvestConfig.AuthCfg auth = cfg.auth();
        return new Authenticator(
                FormAdapters.forName(auth.getFormAdapter(), auth.getRedirectTo()),
                ResourceClassifier.from(cfg.links()),
                auth.getSuccessUrlFragments(),
                auth.isDumpFailedLogin() ? cfg.getOutputDir() : null);
    }

    /**
     * 로그인 페이지 GET → 폼 필드 수집 → POST.
     * 성공 판정: 최종 URL이 로그인 URL과 다름 / 본문에 사용자명 / 최종 URL에 성공 조각.
     */
    public void login(Session session, Credentials credentials, URI loginUrl)
            throws AuthFailureException, InterruptedException {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(credentials, "credentials");
        URI login = UrlUtils.normalize(Objects.requireNonNull(loginUrl, "loginUrl"));
        LOG.info("Logging in as {} at {}", credentials.username(), login);

        FetchedPage page;
        try {
            page = session.getPage(login);
        } catch (NetworkFailureException e) {
            throw failed(login, "login page unreachable", e);
        }

        Document doc = Jsoup.parse(page.bodyText(), baseOf(page, login).toString());
        Optional<Element> form = adapter.loginForm(doc);
        if (form.isEmpty()) throw failed(login, "login form not found", null);

        Map<String, String> fields = adapter.loginFields(form.get(), credentials);
        URI action = actionOf(form.get(), login);

        FetchedPage resp;
        try {
            resp = session.submitFormBuffered(action, fields, login);
        } catch (NetworkFailureException e) {
            throw failed(login, "login POST failed", e);
        }

        URI finalUrl = baseOf(resp, action);
        if (!looksLoggedIn(finalUrl, resp.bodyText(), login, credentials)) {
            dumpFailedResponse(resp);
            throw failed(login, "still on login page (final URL " + finalUrl + ")", null);
        }

        session.markAuthenticated();
        LOG.info("  Login successful");
        SLOG.info("login-ok", "url", login, "finalUrl", finalUrl, "user", credentials.username());
    }

    /** 보호 페이지를 직접 가져와서 약관 동의 */
    public List<ResourceRef> acceptTerms(Session session, URI pageUrl) throws InterruptedException {
        URI page = UrlUtils.normalize(Objects.requireNonNull(pageUrl, "pageUrl"));
        FetchedPage resp;
        try {
            resp = session.getPage(page);
        } catch (NetworkFailureException e) {
            LOG.warn("  Could not open terms page {}: {}", page, e.getMessage());
            return List.of();
        }
        return acceptTerms(session, page, Jsoup.parse(resp.bodyText(), baseOf(resp, page).toString()));
    }

    /**
     * 이미 가져온 페이지 문서로 약관 동의 폼 제출.
     * 응답 앵커 중 파일 확장자 링크 + 응답 자체가 바이너리면 최종 URL, 모두 FLAT 배치.
     */
    public List<ResourceRef> acceptTerms(Session session, URI pageUrl, Document page) throws InterruptedException {
        Objects.requireNonNull(session, "session");
        Optional<Element> form = adapter.termsForm(page);
        if (form.isEmpty()) {
            LOG.info("  No form found on {}", pageUrl);
            return List.of();
        }

        Map<String, String> fields = adapter.termsFields(form.get());
        URI action = actionOf(form.get(), pageUrl);
        LOG.info("  Accepting terms at {} ({} fields)", action, fields.size());

        HttpResponse<InputStream> resp;
        try {
            resp = session.submitForm(action, fields, pageUrl);
        } catch (NetworkFailureException e) {
            LOG.warn("  Error submitting terms form {}: {}", action, e.getMessage());
            return List.of();
        }

        URI finalUrl = (resp.uri() != null) ? UrlUtils.normalize(resp.uri()) : action;
        String contentType = resp.headers().firstValue("Content-Type").orElse(null);
        if (ContentTypes.isBinary(contentType)) {
            close(resp);
            SLOG.info("terms-submitted", "url", pageUrl, "action", action, "finalUrl", finalUrl, "files", 1);
            return List.of(ResourceRef.flatFile(finalUrl));
        }

        FetchedPage data;
        try {
            data = Session.buffer(action, resp);
        } catch (NetworkFailureException e) {
            LOG.warn("  Error reading terms response {}: {}", action, e.getMessage());
            return List.of();
        }

        Document doc = Jsoup.parse(data.bodyText(), finalUrl.toString());
        Set<ResourceRef> out = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            URI u = UrlUtils.parseHttp(a.absUrl("href"));
            if (u != null && classifier.hasFileExtension(u)) out.add(ResourceRef.flatFile(u));
        }
        SLOG.info("terms-submitted", "url", pageUrl, "action", action, "finalUrl", finalUrl, "files", out.size());
        return new ArrayList<>(out);
    }

    boolean looksLoggedIn(URI finalUrl, String body, URI loginUrl, Credentials credentials) {
        if (!finalUrl.equals(loginUrl)) return true;
        String user = credentials.username().toLowerCase(Locale.ROOT);
        if (!user.isEmpty() && body != null && body.toLowerCase(Locale.ROOT).contains(user)) return true;
        String f = finalUrl.toString();
        for (String frag : successFragments) {
            if (!frag.isEmpty() && f.contains(frag)) return true;
        }
        return false;
    }

    private void dumpFailedResponse(FetchedPage resp) {
        if (dumpDir == null) return;
        Path target = dumpDir.resolve(LOGIN_DUMP_FILE);
        try {
            Files.createDirectories(dumpDir);
            Files.write(target, resp.getBody());
            LOG.info("  Saved login response to {} for debugging", target);
        } catch (IOException e) {
            LOG.warn("  Could not save login response to {}: {}", target, e.toString());
        }
    }

    private static AuthFailureException failed(URI login, String reason, Throwable cause) {
        LOG.warn("  Login failed: {}", reason);
        SLOG.warn("login-failed", "url", login, "reason", reason);
        return new AuthFailureException(login, reason, cause);
    }

    private static URI actionOf(Element form, URI fallback) {
        if (!form.hasAttr("action") || form.attr("action").isBlank()) return fallback;
        URI u = UrlUtils.parseHttp(form.absUrl("action"));
        if (u == null) u = UrlUtils.resolve(fallback, form.attr("action"));
        return (u != null) ? u : fallback;
    }

    private static URI baseOf(FetchedPage resp, URI fallback) {
        URI base = resp.baseUri();
        return (base != null) ? base : fallback;
    }

    private static void close(HttpResponse<InputStream> resp) {
        InputStream in = resp.body();
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("could not close body of {}: {}", resp.uri(), e.toString());
        }
    }
}
