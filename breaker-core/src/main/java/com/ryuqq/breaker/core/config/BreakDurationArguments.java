package com.ryuqq.breaker.core.config;

/**
 * BreakDuration 생성기 입력.
 *
 * @param failureCount OPEN 진입 시점 윈도우의 실패 수
 * @param totalThroughput OPEN 진입 시점 윈도우의 전체 실행 수
 * @param consecutiveOpenCount CLOSED 이후 연속 OPEN 진입 횟수 (첫 OPEN = 1, 프로브 실패마다 +1)
 * @author Breaker Team
 * @since 1.0.0
 */
public record BreakDurationArguments(long failureCount, long totalThroughput, int consecutiveOpenCount) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 음수 값이거나 consecutiveOpenCount가 1 미만인 경우
     */
    public BreakDurationArguments {
        if (failureCount < 0 || totalThroughput < 0) {
            throw new IllegalArgumentException(
                "counts cannot be negative (failureCount: " + failureCount + ", totalThroughput: " + totalThroughput + ")"
            );
        }
        if (consecutiveOpenCount < 1) {
            throw new IllegalArgumentException(
                "consecutiveOpenCount must be positive (current: " + consecutiveOpenCount + ")"
            );
        }
    }

    /**
     * 실패율.
     *
     * @return 0.0 ~ 1.0, 처리량이 0이면 0.0
     */
    public double failureRatio() {
        return totalThroughput == 0 ? 0.0 : (double) failureCount / totalThroughput;
    }
}
