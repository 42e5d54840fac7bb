package com.studioscout.core.util;

import java.time.Duration;

/** 재시도 대기 훅. 테스트에서는 기록만 하는 구현으로 바꿔 끼운다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** 실제로 잠드는 기본 구현(null/음수는 즉시 반환) */
    Sleeper THREAD = d -> {
        long ms = (d == null) ? 0 : Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    };
}
