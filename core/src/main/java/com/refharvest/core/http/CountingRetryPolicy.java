package com.refharvest.core.http;

import com.refharvest.core.model.CrawlStats;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 요청 한 건 동안만 쓰는 정책 래퍼. 판정을 위임하면서 실패 상태코드 이력과
 * 허용된 재시도 수를 기록하고, 끝나면 {@link #flushTo(CrawlStats)}로 누적기에 넘긴다.
 */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private final List<Integer> failedStatuses = new ArrayList<>();
    private int granted;

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(int statusCode, int attempt) {
        boolean again = delegate.shouldRetry(statusCode, attempt);
        if (!RetryPolicy.isSuccess(statusCode)) failedStatuses.add(statusCode);
        if (again) granted++;
        return again;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public int getRetryCount() {
        return granted;
    }

    /** 실패로 판정된 시도의 상태코드(-1 = 연결 오류), 시도 순서대로. */
    public List<Integer> failedStatuses() {
        return Collections.unmodifiableList(failedStatuses);
    }

    /** 마지막 시도 번호까지의 시도 수와 재시도 수를 stats에 더한다. */
    public void flushTo(CrawlStats stats, int attemptsMade) {
        if (stats == null) return;
        stats.addAttempts(Math.max(1, attemptsMade));
        stats.addRetries(granted);
    }
}
