package com.refharvest.core.auth;

import com.refharvest.core.model.Credentials;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 일반 HTML 폼용 휴리스틱.
 * - 로그인: 숨김 필드는 그대로 복사, 알려진 이름의 사용자/비밀번호 필드에 값 주입
 * - 약관: 이름이 terms/accept/tc인 체크박스는 "1", 그 외 기본값 있는 필드는 복사,
 *   "download" 성격의 submit 컨트롤 하나를 보존
 */
public class DefaultFormAdapter implements FormAdapter {

    static final Pattern TERMS_CHECKBOX = Pattern.compile("(?i)terms|accept|tc");

    private static final Set<String> USER_FIELDS = Set.of("log", "user_login", "username", "user", "login", "email");
    private static final Set<String> PASSWORD_FIELDS = Set.of("pwd", "password", "pass");
    private static final List<String> SUBMIT_HINTS = List.of("download", "submit");

    @Override
    public Optional<Element> loginForm(Document page) {
        if (page == null) return Optional.empty();
        for (Element form : page.select("form")) {
            if (!form.select("input[type=password]").isEmpty()) return Optional.of(form);
        }
        return Optional.ofNullable(page.selectFirst("form"));
    }

    @Override
    public Map<String, String> loginFields(Element form, Credentials credentials) {
        Map<String, String> out = new LinkedHashMap<>();
        String userField = null;
        String passField = null;

        for (Element in : form.select("input[name]")) {
            String name = in.attr("name");
            String type = in.attr("type").toLowerCase(Locale.ROOT);
            String lname = name.toLowerCase(Locale.ROOT);
            if (type.equals("hidden")) {
                out.put(name, in.attr("value"));
            } else if (passField == null && (type.equals("password") || PASSWORD_FIELDS.contains(lname))) {
                passField = name;
            } else if (userField == null && USER_FIELDS.contains(lname)) {
                userField = name;
            }
        }

        out.put(userField != null ? userField : "username", credentials.username());
        out.put(passField != null ? passField : "password", credentials.password());

        Element submit = pickSubmit(form, List.of());
        if (submit != null) out.put(submit.attr("name"), submitValue(submit, "Log In"));
        return out;
    }

    @Override
    public Optional<Element> termsForm(Document page) {
        if (page == null) return Optional.empty();
        for (Element form : page.select("form")) {
            for (Element cb : form.select("input[type=checkbox][name]")) {
                if (TERMS_CHECKBOX.matcher(cb.attr("name")).find()) return Optional.of(form);
            }
        }
        // 약관 체크박스가 없으면 download 액션/버튼이 있는 폼만
        for (Element form : page.select("form")) {
            if (isDownloadForm(form)) return Optional.of(form);
        }
        return Optional.empty();
    }

    private static boolean isDownloadForm(Element form) {
        if (form.attr("action").toLowerCase(Locale.ROOT).contains("download")) return true;
        for (Element submit : form.select("input[type=submit], button")) {
            String label = submit.attr("value") + " " + submit.text();
            if (label.toLowerCase(Locale.ROOT).contains("download")) return true;
        }
        return false;
    }

    @Override
    public Map<String, String> termsFields(Element form) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Element el : form.select("input[name], select[name], textarea[name]")) {
            String name = el.attr("name");
            String tag = el.normalName();
            String type = el.attr("type").toLowerCase(Locale.ROOT);

            if (tag.equals("select")) {
                Element opt = el.selectFirst("option[selected]");
                if (opt == null) opt = el.selectFirst("option");
                if (opt != null) putIfPresent(out, name, opt.hasAttr("value") ? opt.attr("value") : opt.text());
            } else if (tag.equals("textarea")) {
                putIfPresent(out, name, el.text());
            } else if (type.equals("checkbox")) {
                if (TERMS_CHECKBOX.matcher(name).find()) {
                    out.put(name, "1");
                } else if (el.hasAttr("checked")) {
                    out.put(name, el.hasAttr("value") ? el.attr("value") : "on");
                }
            } else if (type.equals("radio")) {
                if (el.hasAttr("checked")) out.put(name, el.attr("value"));
            } else if (!isSubmit(el)) {
                putIfPresent(out, name, el.attr("value"));
            }
        }

        Element submit = pickSubmit(form, SUBMIT_HINTS);
        if (submit != null) out.put(submit.attr("name"), submitValue(submit, "Submit"));
        return out;
    }

    /** 힌트가 값/라벨에 들어간 submit 우선, 없으면 첫 번째 이름 있는 submit */
    static Element pickSubmit(Element form, List<String> hints) {
        Element first = null;
        for (Element el : form.select("input[name], button[name]")) {
            if (!isSubmit(el)) continue;
            if (first == null) first = el;
            String label = (el.attr("value") + " " + el.text()).toLowerCase(Locale.ROOT);
            for (String h : hints) {
                if (label.contains(h)) return el;
            }
        }
        return first;
    }

    static boolean isSubmit(Element el) {
        String type = el.attr("type").toLowerCase(Locale.ROOT);
        if (el.normalName().equals("button")) return type.isEmpty() || type.equals("submit");
        return type.equals("submit") || type.equals("image");
    }

    private static String submitValue(Element el, String fallback) {
        if (el.hasAttr("value")) return el.attr("value");
        String text = el.text();
        return text.isBlank() ? fallback : text.trim();
    }

    private static void putIfPresent(Map<String, String> out, String name, String value) {
        if (value != null && !value.isEmpty()) out.put(name, value);
    }
}
