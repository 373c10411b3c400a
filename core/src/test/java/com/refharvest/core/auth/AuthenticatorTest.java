package com.refharvest.core.auth;

import com.refharvest.core.crawler.ResourceClassifier;
import com.refharvest.core.error.AuthFailureException;
import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.http.Session;
import com.refharvest.core.model.Credentials;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.Placement;
import com.refharvest.core.model.ResourceRef;
import com.refharvest.core.support.FakeSite;
import com.refharvest.core.support.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Authenticator — 로그인 판정 + 약관 동의")
class AuthenticatorTest {

    private static final Credentials ALICE = new Credentials("alice", "s3cret");
    private static final String LOGIN_FORM = "<form method=\"post\">"
            + "<input type=\"hidden\" name=\"nonce\" value=\"n-42\">"
            + "<input type=\"text\" name=\"username\"><input type=\"password\" name=\"password\">"
            + "<input type=\"submit\" name=\"login\" value=\"Log In\"></form>";

    @TempDir Path out;

    private FakeSite site;
    private Session session;

    @BeforeEach
    void setUp() throws Exception {
        site = FakeSite.start();
        HarvestConfig cfg = HarvestConfig.defaults().setTarget(site.base() + "/").withoutDelays();
        session = Session.create(cfg, new RecordingSleeper(), null);
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private Authenticator authenticator(Path dumpDir) {
        return new Authenticator(new DefaultFormAdapter(),
                ResourceClassifier.from(new HarvestConfig.LinksCfg()), List.of(), dumpDir);
    }

    /** GET은 로그인 폼, POST는 주어진 응답 */
    private void loginRoute(FakeSite.Responder onPost) {
        site.route("/login", (ex, r) -> {
            if ("POST".equals(r.method())) onPost.respond(ex, r);
            else FakeSite.send(ex, 200, "text/html", LOGIN_FORM.getBytes(StandardCharsets.UTF_8));
        });
    }

    @Test
    @DisplayName("POST 뒤 다른 URL로 리다이렉트되면 성공")
    void success_by_redirect() throws Exception {
        loginRoute((ex, r) -> FakeSite.redirect(ex, "/account/"));
        site.html("/account/", "<p>Welcome</p>");

        authenticator(null).login(session, ALICE, site.url("/login"));

        assertThat(session.isAuthenticated()).isTrue();
        FakeSite.Request post = site.requests("POST", "/login").get(0);
        assertThat(post.body()).contains("nonce=n-42", "username=alice", "password=s3cret", "login=Log+In");
        assertThat(post.referer()).isEqualTo(site.url("/login").toString());
    }

    @Test
    @DisplayName("같은 URL이어도 본문에 사용자명이 있으면 성공")
    void success_by_username_in_body() throws Exception {
        loginRoute((ex, r) -> FakeSite.send(ex, 200, "text/html",
                "<p>Signed in as Alice</p>".getBytes(StandardCharsets.UTF_8)));

        authenticator(null).login(session, ALICE, site.url("/login"));

        assertThat(session.isAuthenticated()).isTrue();
    }

    @Test
    @DisplayName("로그인 페이지에 그대로 머물면 실패 + 응답 덤프")
    void failure_dumps_response() throws Exception {
        loginRoute((ex, r) -> FakeSite.send(ex, 200, "text/html",
                "<p>Invalid credentials</p>".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> authenticator(out).login(session, ALICE, site.url("/login")))
                .isInstanceOf(AuthFailureException.class)
                .hasMessageContaining("still on login page");

        assertThat(session.isAuthenticated()).isFalse();
        assertThat(out.resolve(Authenticator.LOGIN_DUMP_FILE)).hasContent("<p>Invalid credentials</p>");
    }

    @Test
    void missing_form_fails() {
        site.html("/login", "<p>maintenance</p>");

        assertThatThrownBy(() -> authenticator(null).login(session, ALICE, site.url("/login")))
                .isInstanceOf(AuthFailureException.class)
                .hasMessageContaining("login form not found");
        assertThat(site.requests("POST", "/login")).isEmpty();
    }

    @Test
    void unreachable_login_page_keeps_cause() {
        assertThatThrownBy(() -> authenticator(null).login(session, ALICE, site.url("/login")))
                .isInstanceOf(AuthFailureException.class)
                .hasCauseInstanceOf(NetworkFailureException.class);
    }

    @Test
    @DisplayName("URL 조각 휴리스틱: 설정값 + 어댑터 기본값")
    void success_fragments() {
        Authenticator a = new Authenticator(new WordPressFormAdapter(null),
                ResourceClassifier.from(new HarvestConfig.LinksCfg()), List.of("members"), null);
        URI login = URI.create("https://ex.com/members/wp-login.php");
        URI wpLogin = URI.create("https://ex.com/wp-admin/login.php");

        assertThat(a.looksLoggedIn(login, "", login, ALICE)).isTrue();
        assertThat(a.looksLoggedIn(wpLogin, "", wpLogin, ALICE)).isTrue();
        assertThat(authenticator(null).looksLoggedIn(login, "<p>nope</p>", login, ALICE)).isFalse();
    }

    @Test
    @DisplayName("약관 동의 응답의 파일 링크는 FLAT 배치 참조로")
    void terms_response_anchors_become_flat_refs() throws Exception {
        site.html("/file-access/", "<form action=\"/agree\" method=\"post\">"
                + "<input type=\"checkbox\" name=\"accept_terms\"><input type=\"submit\" value=\"Go\"></form>")
            .route("/agree", (ex, r) -> FakeSite.send(ex, 200, "text/html",
                    ("<a href=\"/files/Loinc_2.77.zip\">zip</a><a href=\"/help/\">help</a>")
                            .getBytes(StandardCharsets.UTF_8)));

        List<ResourceRef> refs = authenticator(null).acceptTerms(session, site.url("/file-access/"));

        assertThat(refs).containsExactly(ResourceRef.flatFile(site.url("/files/Loinc_2.77.zip")));
        assertThat(refs.get(0).getPlacement()).isEqualTo(Placement.FLAT);
        assertThat(site.requests("POST", "/agree").get(0).body()).isEqualTo("accept_terms=1");
    }

    @Test
    @DisplayName("약관 동의 응답이 바로 파일이면 최종 URL 하나")
    void terms_binary_response_yields_final_url() throws Exception {
        site.html("/file-access/", "<form action=\"/agree\" method=\"post\">"
                + "<input type=\"checkbox\" name=\"terms\"></form>")
            .route("/agree", (ex, r) -> FakeSite.redirect(ex, "/files/get?id=3"))
            .bytes("/files/get", "application/zip", new byte[]{1, 2});

        List<ResourceRef> refs = authenticator(null).acceptTerms(session, site.url("/file-access/"));

        assertThat(refs).containsExactly(ResourceRef.flatFile(site.url("/files/get?id=3")));
    }

    @Test
    void terms_page_unreachable_is_empty() throws Exception {
        assertThat(authenticator(null).acceptTerms(session, site.url("/gone/"))).isEmpty();
    }
}
