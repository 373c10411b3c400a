package com.refharvest.core.crawler;

import com.refharvest.core.model.ResourceRef;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.Set;

/** 파싱된 페이지에서 절대 URL을 추출·분류하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * @param doc    파싱된 HTML
     * @param source 문서를 가져온 URL(리다이렉트 후 최종 URL). 상대 링크 해석 기준.
     * @return 중복 제거된 ResourceRef 집합(순서는 발견 순)
     */
    Set<ResourceRef> extract(Document doc, URI source);
}
