package com.refharvest.core.error;

import java.net.URI;

/** 수집 과정 실패의 공통 상위 타입. 어떤 자원(URL)에서 났는지 함께 보관한다. */
public abstract class HarvestException extends Exception {
    private final URI resource;

    protected HarvestException(URI resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }

    /** 실패한 자원. 알 수 없으면 null. */
    public URI getResource() { return resource; }
}
