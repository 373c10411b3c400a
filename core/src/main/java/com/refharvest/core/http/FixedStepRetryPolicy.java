package com.refharvest.core.http;

import java.time.Duration;

/**
 * 2xx가 아니면(응답 없음 -1 포함) 재시도. 지연은 고정 간격의 선형 증가:
 * step=1000ms → 1000ms → 2000ms (지터 없음, 지수 아님)
 */
public final class FixedStepRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long stepMillis;

    public FixedStepRetryPolicy() { this(3, 1000); }
    public FixedStepRetryPolicy(int maxAttempts, long stepMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.stepMillis = Math.max(0, stepMillis);
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return !RetryPolicy.isSuccess(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        return Duration.ofMillis(stepMillis * Math.max(1, attempt));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
