package com.ryuqq.breaker.core.model;

/**
 * 특정 시점의 샘플링 윈도우 집계.
 *
 * <p>윈도우에 살아 있는 버킷들의 성공/실패 합계를 한 번에 읽어 온 일관된 쌍입니다.
 * 상태 전이 판단과 전이 이벤트 모두 이 값을 사용합니다.</p>
 *
 * @param total 윈도우 내 전체 실행 수 (성공 + 실패)
 * @param failures 윈도우 내 실패 수
 * @author Breaker Team
 * @since 1.0.0
 */
public record WindowSnapshot(long total, long failures) {

    /**
     * 비어 있는 스냅샷.
     */
    public static final WindowSnapshot EMPTY = new WindowSnapshot(0, 0);

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException 음수이거나 failures가 total을 초과하는 경우
     */
    public WindowSnapshot {
        if (total < 0 || failures < 0) {
            throw new IllegalArgumentException(
                "counts cannot be negative (total: " + total + ", failures: " + failures + ")"
            );
        }
        if (failures > total) {
            throw new IllegalArgumentException(
                "failures cannot exceed total (total: " + total + ", failures: " + failures + ")"
            );
        }
    }

    /**
     * 성공 수.
     *
     * @return total - failures
     */
    public long successes() {
        return total - failures;
    }

    /**
     * 실패율.
     *
     * @return 0.0 ~ 1.0, 샘플이 없으면 0.0
     */
    public double failureRatio() {
        return total == 0 ? 0.0 : (double) failures / total;
    }
}
