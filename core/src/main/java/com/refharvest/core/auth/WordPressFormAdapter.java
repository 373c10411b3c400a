package com.refharvest.core.auth;

import com.refharvest.core.model.Credentials;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** wp-login.php 스타일 로그인(form#loginform, log/pwd, testcookie). 약관 폼은 기본 규칙. */
public class WordPressFormAdapter extends DefaultFormAdapter {

    private final String redirectTo;

    public WordPressFormAdapter(String redirectTo) {
        this.redirectTo = redirectTo;
    }

    @Override
    public Optional<Element> loginForm(Document page) {
        if (page == null) return Optional.empty();
        Element wp = page.selectFirst("form#loginform");
        return (wp != null) ? Optional.of(wp) : super.loginForm(page);
    }

    @Override
    public Map<String, String> loginFields(Element form, Credentials credentials) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("log", credentials.username());
        out.put("pwd", credentials.password());
        out.put("wp-submit", "Log In");
        if (redirectTo != null) out.put("redirect_to", redirectTo);
        out.put("testcookie", "1");
        // nonce 등 숨김 필드는 페이지 값이 우선
        for (Element hidden : form.select("input[type=hidden][name]")) {
            out.put(hidden.attr("name"), hidden.attr("value"));
        }
        return out;
    }

    @Override
    public List<String> successUrlFragments() {
        return List.of("wp-admin");
    }
}
