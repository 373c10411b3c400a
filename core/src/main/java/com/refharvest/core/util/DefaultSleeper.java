package com.refharvest.core.util;

import java.time.Duration;

/** 실제 Thread.sleep. null 또는 0 이하 대기는 바로 반환. */
public final class DefaultSleeper implements Sleeper {
    @Override public void sleep(Duration d) throws InterruptedException {
        if (d == null || d.isZero() || d.isNegative()) return;
        Thread.sleep(d.toMillis());
    }
}
