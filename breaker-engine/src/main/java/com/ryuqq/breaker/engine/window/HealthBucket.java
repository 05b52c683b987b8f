package com.ryuqq.breaker.engine.window;

/**
 * 샘플링 윈도우의 하위 버킷 1칸.
 *
 * <p>{@code index}는 버킷 시작 시각을 버킷 폭으로 나눈 값이며, 순환 버퍼의 같은 칸이
 * 다른 시간 구간에 재사용될 때 이전 구간의 값을 구분하는 키로 쓰입니다.</p>
 */
final class HealthBucket {

    static final long UNUSED = Long.MIN_VALUE;

    private long index = UNUSED;
    private long successes;
    private long failures;

    long index() {
        return index;
    }

    long successes() {
        return successes;
    }

    long failures() {
        return failures;
    }

    void add(boolean success) {
        if (success) {
            successes++;
        } else {
            failures++;
        }
    }

    /**
     * 새 시간 구간으로 재사용.
     */
    void restart(long newIndex) {
        index = newIndex;
        successes = 0;
        failures = 0;
    }

    void clear() {
        restart(UNUSED);
    }
}
