package com.refharvest.core.error;

import java.net.URI;

/** 로그인 폼 미발견, 전송 실패, 성공 휴리스틱 불충족. 실행은 비인증 세션으로 계속된다. */
public class AuthFailureException extends HarvestException {
    public AuthFailureException(URI resource, String message) {
        super(resource, message, null);
    }

    public AuthFailureException(URI resource, String message, Throwable cause) {
        super(resource, message, cause);
    }
}
