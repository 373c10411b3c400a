package com.refharvest.core.crawler;

import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.ResourceKind;
import com.refharvest.core.util.ContentTypes;
import com.refharvest.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 링크 분류 규칙(허용 목록 기반).
 * - 경로가 알려진 확장자로 끝나면 FILE (페이지 내용과 무관)
 * - 아니면 경로에 주제 키워드가 있으면 PAGE (키워드 목록이 비면 모두 PAGE)
 */
public final class ResourceClassifier {

    private final List<String> extensions;
    private final List<String> pageKeywords;
    private final List<String> formActionKeywords;
    private final Pattern embeddedUrl;

    public ResourceClassifier(List<String> extensions, List<String> pageKeywords, List<String> formActionKeywords) {
        if (extensions == null || extensions.isEmpty()) throw new IllegalArgumentException("extensions must not be empty");
        this.extensions = List.copyOf(extensions);
        this.pageKeywords = (pageKeywords == null) ? List.of() : List.copyOf(pageKeywords);
        this.formActionKeywords = (formActionKeywords == null) ? List.of() : List.copyOf(formActionKeywords);
        this.embeddedUrl = buildEmbeddedUrlPattern(this.extensions);
    }

    public static ResourceClassifier from(HarvestConfig.LinksCfg links) {
        return new ResourceClassifier(links.getFileExtensions(), links.getPageKeywords(), links.getFormActionKeywords());
    }

    /** 경로 접미사가 허용 확장자인가 */
    public boolean hasFileExtension(URI u) {
        if (u == null) return false;
        String path = UrlUtils.lowerPath(u);
        for (String ext : extensions) {
            if (path.endsWith("." + ext)) return true;
        }
        return false;
    }

    public boolean isPageCandidate(URI u) {
        if (u == null) return false;
        if (pageKeywords.isEmpty()) return true;
        String path = UrlUtils.lowerPath(u);
        for (String k : pageKeywords) {
            if (path.contains(k)) return true;
        }
        return false;
    }

    /** 가져오기 전에 알 수 있는 분류. 둘 다 아니면 empty(무시 대상). */
    public Optional<ResourceKind> classify(URI u) {
        if (hasFileExtension(u)) return Optional.of(ResourceKind.FILE);
        if (isPageCandidate(u)) return Optional.of(ResourceKind.PAGE);
        return Optional.empty();
    }

    /** 가져온 뒤의 판정: 확장자 또는 선언된 Content-Type이 바이너리 */
    public boolean isFile(URI u, String contentType) {
        return hasFileExtension(u) || ContentTypes.isBinary(contentType);
    }

    public boolean isDownloadFormAction(URI action) {
        if (action == null) return false;
        String s = action.toString().toLowerCase(Locale.ROOT);
        for (String k : formActionKeywords) {
            if (s.contains(k)) return true;
        }
        return false;
    }

    /** 스크립트/속성 안에 박힌 "https?://...\.(ext)" 패턴 */
    public Pattern embeddedUrlPattern() { return embeddedUrl; }

    private static Pattern buildEmbeddedUrlPattern(List<String> exts) {
        // 긴 확장자 먼저(xlsx가 xls보다 앞)
        List<String> sorted = new ArrayList<>(exts);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        StringBuilder alt = new StringBuilder();
        for (String e : sorted) {
            if (alt.length() > 0) alt.append('|');
            alt.append(Pattern.quote(e));
        }
        return Pattern.compile("https?://[^\\s<>\"'{}|\\\\^`\\[\\]]+\\.(?:" + alt + ")(?![\\w/-]|\\.\\w)",
                Pattern.CASE_INSENSITIVE);
    }
}
