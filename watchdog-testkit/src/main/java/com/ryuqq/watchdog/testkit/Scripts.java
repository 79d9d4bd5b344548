package com.ryuqq.watchdog.testkit;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 키별 시도 순서 시나리오와 시도 횟수 기록.
 *
 * @param <T> 시도 결과 타입
 */
final class Scripts<T> {

    private final Map<String, List<T>> sequences = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final AtomicInteger total = new AtomicInteger();
    private volatile T fallback;

    Scripts(T fallback) {
        this.fallback = fallback;
    }

    @SafeVarargs
    final void script(String key, T... outcomes) {
        if (outcomes.length == 0) {
            throw new IllegalArgumentException("at least one outcome is required");
        }
        sequences.put(key, List.of(outcomes));
    }

    void otherwise(T outcome) {
        this.fallback = outcome;
    }

    T next(String key) {
        int attempt = attempts.computeIfAbsent(key, k -> new AtomicInteger()).getAndIncrement();
        total.incrementAndGet();
        List<T> sequence = sequences.get(key);
        if (sequence == null) {
            return fallback;
        }
        return sequence.get(Math.min(attempt, sequence.size() - 1));
    }

    int attempts(String key) {
        AtomicInteger count = attempts.get(key);
        return count == null ? 0 : count.get();
    }

    int totalAttempts() {
        return total.get();
    }
}
