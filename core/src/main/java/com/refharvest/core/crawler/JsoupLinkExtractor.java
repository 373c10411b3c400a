package com.refharvest.core.crawler;

import com.refharvest.core.model.Placement;
import com.refharvest.core.model.ResourceKind;
import com.refharvest.core.model.ResourceRef;
import com.refharvest.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * 기본 JSoup 기반 링크 추출기.
 * 1) a[href] → 절대 URL → 확장자면 FILE, 키워드면 PAGE
 * 2) 원문 텍스트 정규식 스캔(스크립트/속성에 박힌 파일 URL)
 * 3) action에 다운로드 키워드가 있는 form → PAGE 후보(약관 동의가 필요할 수 있음)
 */
public class JsoupLinkExtractor implements LinkExtractor {

    private final ResourceClassifier classifier;

    public JsoupLinkExtractor(ResourceClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public Set<ResourceRef> extract(Document doc, URI source) {
        Set<ResourceRef> out = new LinkedHashSet<>();
        if (doc == null) return out;

        for (Element a : doc.select("a[href]")) {
            URI u = absolute(a, "href", source);
            if (u == null) continue;
            Optional<ResourceKind> kind = classifier.classify(u);
            kind.ifPresent(k -> out.add(new ResourceRef(u, k, Placement.MIRRORED)));
        }

        Matcher m = classifier.embeddedUrlPattern().matcher(doc.outerHtml());
        while (m.find()) {
            URI u = UrlUtils.parseHttp(Parser.unescapeEntities(m.group(), true));
            if (u != null && classifier.hasFileExtension(u)) out.add(ResourceRef.file(u));
        }

        for (Element form : doc.select("form[action]")) {
            URI action = absolute(form, "action", source);
            if (action == null || !classifier.isDownloadFormAction(action)) continue;
            out.add(classifier.hasFileExtension(action) ? ResourceRef.file(action) : ResourceRef.page(action));
        }
        return out;
    }

    /** abs:attr 우선(<base href> 존중), 안 되면 source 기준 해석 */
    private static URI absolute(Element el, String attr, URI source) {
        String abs = el.absUrl(attr);
        URI u = UrlUtils.parseHttp(abs);
        if (u != null) return u;
        return (source == null) ? null : UrlUtils.resolve(source, el.attr(attr));
    }
}
