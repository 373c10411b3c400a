package com.refharvest.core.util;

import java.time.Duration;

/**
 * 재시도 간격, 페이지 간 예의 지연, 로그인 직후 대기가 모두 이걸 거친다.
 * 테스트는 기록만 하는 구현으로 바꿔 끼운다.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
