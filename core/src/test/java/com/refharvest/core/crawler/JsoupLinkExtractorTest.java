package com.refharvest.core.crawler;

import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.ResourceRef;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsoupLinkExtractorTest {

    private static final URI SRC = URI.create("https://ex.com/index.html");
    private final JsoupLinkExtractor extractor =
            new JsoupLinkExtractor(ResourceClassifier.from(new HarvestConfig.LinksCfg()));

    private Set<ResourceRef> extract(String html) {
        Document doc = Jsoup.parse(html, SRC.toString());
        return extractor.extract(doc, SRC);
    }

    @Test
    @DisplayName("report.pdf는 FILE, /docs/more/는 PAGE")
    void pdf_and_page() {
        Set<ResourceRef> refs = extract("<a href=\"/docs/report.pdf\">r</a><a href=\"/docs/more/\">m</a>");

        assertEquals(List.of(
                ResourceRef.file(URI.create("https://ex.com/docs/report.pdf")),
                ResourceRef.page(URI.create("https://ex.com/docs/more/"))), new ArrayList<>(refs));
    }

    @Test
    @DisplayName("스크립트에 박힌 파일 URL도 찾는다")
    void embedded_urls_in_script() {
        Set<ResourceRef> refs = extract("<script>var f = \"https://cdn.ex.com/data/codes.zip\";</script>");

        assertEquals(List.of(ResourceRef.file(URI.create("https://cdn.ex.com/data/codes.zip"))), new ArrayList<>(refs));
    }

    @Test
    @DisplayName("다운로드 키워드가 있는 form action은 PAGE 후보")
    void download_form_action_is_page_candidate() {
        Set<ResourceRef> refs = extract("<form action=\"/download/confirm\" method=\"post\"></form>"
                + "<form action=\"/search\"></form>");

        assertEquals(List.of(ResourceRef.page(URI.create("https://ex.com/download/confirm"))), new ArrayList<>(refs));
    }

    @Test
    void duplicates_fragments_and_non_http_are_dropped() {
        Set<ResourceRef> refs = extract(
                "<a href=\"a.zip\">1</a><a href=\"a.zip#x\">2</a>"
                + "<a href=\"mailto:x@ex.com\">m</a><a href=\"javascript:void(0)\">j</a>");

        assertEquals(List.of(ResourceRef.file(URI.create("https://ex.com/a.zip"))), new ArrayList<>(refs));
    }

    @Test
    @DisplayName("href의 퍼센트 인코딩은 그대로 유지")
    void encoded_query_survives() {
        Set<ResourceRef> refs = extract("<a href='/dl?token=x%3Dy%26z&f=1'>d</a>"
                + "<a href='/get?file=a%26b.zip'>z</a>");

        assertEquals(List.of(
                ResourceRef.page(URI.create("https://ex.com/dl?token=x%3Dy%26z&f=1")),
                ResourceRef.page(URI.create("https://ex.com/get?file=a%26b.zip"))), new ArrayList<>(refs));
    }

    @Test
    void null_document_yields_empty() {
        assertTrue(extractor.extract(null, SRC).isEmpty());
    }
}
