package com.refharvest.core.model;

import java.net.URI;
import java.util.Objects;

/** 정규화된 절대 URL + 분류 태그. equals/hashCode는 url+kind 기준(배치 방식은 제외). */
public final class ResourceRef {
    private final URI url;
    private final ResourceKind kind;
    private final Placement placement;

    public ResourceRef(URI url, ResourceKind kind, Placement placement) {
        this.url = Objects.requireNonNull(url, "url");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.placement = Objects.requireNonNull(placement, "placement");
    }

    public static ResourceRef page(URI url) { return new ResourceRef(url, ResourceKind.PAGE, Placement.MIRRORED); }
    public static ResourceRef file(URI url) { return new ResourceRef(url, ResourceKind.FILE, Placement.MIRRORED); }
    public static ResourceRef flatFile(URI url) { return new ResourceRef(url, ResourceKind.FILE, Placement.FLAT); }

    public URI getUrl() { return url; }
    public ResourceKind getKind() { return kind; }
    public Placement getPlacement() { return placement; }

    public boolean isFile() { return kind == ResourceKind.FILE; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceRef)) return false;
        ResourceRef r = (ResourceRef) o;
        return url.equals(r.url) && kind == r.kind;
    }

    @Override public int hashCode() { return Objects.hash(url, kind); }

    @Override public String toString() { return kind + " " + url; }
}
