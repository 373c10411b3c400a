package com.refharvest.core.error;

import java.net.URI;

/** 타임아웃/연결 오류/비 2xx 응답이 재시도 한도를 넘긴 경우. */
public class NetworkFailureException extends HarvestException {
    private final int statusCode;
    private final int attempts;

    public NetworkFailureException(URI resource, int statusCode, int attempts, Throwable cause) {
        super(resource, describe(resource, statusCode, attempts, cause), cause);
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    /** 마지막 시도의 HTTP 상태. 응답 자체가 없었으면 -1. */
    public int getStatusCode() { return statusCode; }
    public int getAttempts() { return attempts; }

    private static String describe(URI resource, int status, int attempts, Throwable cause) {
        String why = (status > 0) ? "HTTP " + status
                : (cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "no response");
        return "fetch failed after " + attempts + " attempt(s) for " + resource + " (" + why + ")";
    }
}
