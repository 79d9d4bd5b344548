package com.ryuqq.watchdog.adapter.network;

import java.time.Duration;

/**
 * JDK 블로킹 API용 밀리초 타임아웃 변환.
 */
final class TimeoutMillis {

    private TimeoutMillis() {
    }

    /**
     * @return 남은 시간이 없으면 0, 1ms 미만의 양수는 1, 그 외는 int 범위로 포화된 밀리초
     */
    static int of(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return 0;
        }
        long millis = timeout.toMillis();
        if (millis == 0) {
            return 1;
        }
        return (int) Math.min(millis, Integer.MAX_VALUE);
    }
}
