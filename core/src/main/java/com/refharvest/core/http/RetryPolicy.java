package com.refharvest.core.http;

import java.time.Duration;

/**
 * HttpFetcher가 실패한 시도 뒤에 다시 보낼지 정하는 정책.
 * 상태코드 -1은 응답을 받지 못한 경우(타임아웃, 연결 오류).
 */
public interface RetryPolicy {
    /** attempt는 방금 끝난 시도 번호(1부터). */
    boolean shouldRetry(int statusCode, int attempt);

    /** attempt번째 실패 뒤 기다릴 시간. 서버 Retry-After가 있으면 그쪽이 우선. */
    Duration nextDelay(int attempt);

    /** 첫 시도를 포함한 최대 시도 수. */
    int maxAttempts();

    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
