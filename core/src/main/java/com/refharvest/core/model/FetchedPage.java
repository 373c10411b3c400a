package com.refharvest.core.model;

import com.refharvest.core.util.ContentTypes;
import com.refharvest.core.util.UrlUtils;
import com.refharvest.core.util.UrlUtils;

import java.net.URI;
import java.util.Objects;

/**
 * 메모리에 다 읽어 둔 2xx 응답 한 건. 로그인/약관/크롤 페이지처럼 파싱할 HTML 용도이고,
 * 파일 본문은 Session.open 스트림으로 받는다.
 */
public final class FetchedPage {
    private final URI requested;
    private final URI finalUrl;
    private final int status;
    private final String contentType;
    private final byte[] body;
    private final long readMillis;

    public FetchedPage(URI requested, URI finalUrl, int status, String contentType, byte[] body, long readMillis) {
        this.requested = Objects.requireNonNull(requested, "requested");
        this.finalUrl = (finalUrl != null) ? finalUrl : requested;
        this.status = status;
        this.contentType = contentType;
        this.body = (body != null) ? body : new byte[0];
        this.readMillis = readMillis;
    }

    public URI getUrl() { return requested; }
    /** 리다이렉트를 따라간 뒤의 최종 URL */
    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return status; }
    public String getContentType() { return contentType; }
    public byte[] getBody() { return body; }
    public long getReadMillis() { return readMillis; }
    public int size() { return body.length; }

    /** 상대 링크 해석 기준. 최종 URL을 정규화한 값. */
    public URI baseUri() {
        URI n = UrlUtils.normalize(finalUrl);
        return (n != null) ? n : requested;
    }

    /** Content-Type charset 기준 디코딩(없으면 UTF-8) */
    public String bodyText() {
        return new String(body, ContentTypes.charsetOf(contentType));
    }
}
