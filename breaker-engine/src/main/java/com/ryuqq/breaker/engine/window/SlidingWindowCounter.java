package com.ryuqq.breaker.engine.window;

import com.ryuqq.breaker.core.model.WindowSnapshot;

import java.time.Duration;

/**
 * 시간 기반 슬라이딩 윈도우 성공/실패 카운터.
 *
 * <p>샘플링 구간을 같은 폭의 버킷 {@code bucketCount}개로 나누어 순환 버퍼에 보관합니다.
 * 개별 샘플을 저장하지 않으므로 호출량과 무관하게 메모리와 연산량이 버킷 수로 제한됩니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * bucketIndex = floor(now / bucketWidth)
 * slot        = bucketIndex mod bucketCount
 * live        = bucketIndex - bucketCount + 1 .. bucketIndex
 *
 * record(success, now):
 *   1. live 범위 밖의 버킷을 비움 (접근 시점에만, 별도 스윕 없음)
 *   2. slot의 index가 bucketIndex와 다르면 재시작
 *   3. 성공/실패 카운트 증가
 *
 * snapshot(now):
 *   live 범위 버킷의 합계
 * </pre>
 *
 * <p>만료 해상도는 버킷 폭 1칸입니다. 예: samplingDuration=2s, bucketCount=10이면
 * 샘플은 기록 후 1.8s~2.0s 사이에 윈도우에서 빠집니다.</p>
 *
 * <p><strong>동시성:</strong> 내부 동기화가 없습니다. 기록과 전이 판단용 읽기가 하나의 임계 구역에서
 * 일어나야 하므로 소유자({@code CircuitStateMachine})의 잠금 아래에서만 호출해야 합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class SlidingWindowCounter {

    /**
     * 기본 버킷 수.
     */
    public static final int DEFAULT_BUCKET_COUNT = 10;

    private final long samplingNanos;
    private final long bucketNanos;
    private final HealthBucket[] buckets;

    /**
     * 기본 버킷 수(10)로 생성.
     *
     * @param samplingDuration 샘플링 구간 (양수)
     * @throws IllegalArgumentException samplingDuration이 null이거나 양수가 아닌 경우
     */
    public SlidingWindowCounter(Duration samplingDuration) {
        this(samplingDuration, DEFAULT_BUCKET_COUNT);
    }

    /**
     * 버킷 수를 지정해 생성.
     *
     * <p>샘플링 구간이 버킷 수보다 짧은(나노초 단위) 경우 버킷 수가 줄어듭니다.</p>
     *
     * @param samplingDuration 샘플링 구간 (양수)
     * @param bucketCount 버킷 수 (양수)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SlidingWindowCounter(Duration samplingDuration, int bucketCount) {
        if (samplingDuration == null || samplingDuration.isZero() || samplingDuration.isNegative()) {
            throw new IllegalArgumentException("samplingDuration must be positive (current: " + samplingDuration + ")");
        }
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucketCount must be positive (current: " + bucketCount + ")");
        }
        this.samplingNanos = toNanosSaturated(samplingDuration);
        int effectiveCount = (int) Math.min(bucketCount, samplingNanos);
        this.bucketNanos = samplingNanos / effectiveCount + (samplingNanos % effectiveCount == 0 ? 0 : 1);
        this.buckets = new HealthBucket[effectiveCount];
        for (int i = 0; i < effectiveCount; i++) {
            buckets[i] = new HealthBucket();
        }
    }

    /**
     * 실행 결과 1건 기록.
     *
     * @param success 성공 여부
     * @param nowNanos 현재 단조 시각 (나노초)
     */
    public void record(boolean success, long nowNanos) {
        long current = bucketIndex(nowNanos);
        evictExpired(current);

        HealthBucket bucket = buckets[slotOf(current)];
        if (bucket.index() != current) {
            bucket.restart(current);
        }
        bucket.add(success);
    }

    /**
     * 현재 윈도우 집계.
     *
     * @param nowNanos 현재 단조 시각 (나노초)
     * @return 살아 있는 버킷의 합계
     */
    public WindowSnapshot snapshot(long nowNanos) {
        long current = bucketIndex(nowNanos);
        evictExpired(current);

        long successes = 0;
        long failures = 0;
        for (HealthBucket bucket : buckets) {
            if (bucket.index() != HealthBucket.UNUSED && bucket.index() <= current) {
                successes += bucket.successes();
                failures += bucket.failures();
            }
        }
        return new WindowSnapshot(successes + failures, failures);
    }

    /**
     * 모든 버킷 초기화.
     */
    public void reset() {
        for (HealthBucket bucket : buckets) {
            bucket.clear();
        }
    }

    /**
     * 샘플링 구간.
     *
     * @return samplingDuration
     */
    public Duration samplingDuration() {
        return Duration.ofNanos(samplingNanos);
    }

    /**
     * 실제 사용 중인 버킷 수.
     *
     * @return 버킷 수
     */
    public int bucketCount() {
        return buckets.length;
    }

    private void evictExpired(long currentIndex) {
        long oldestLive = currentIndex - buckets.length + 1;
        for (HealthBucket bucket : buckets) {
            if (bucket.index() != HealthBucket.UNUSED && bucket.index() < oldestLive) {
                bucket.clear();
            }
        }
    }

    private long bucketIndex(long nowNanos) {
        return Math.floorDiv(nowNanos, bucketNanos);
    }

    private int slotOf(long index) {
        return (int) Math.floorMod(index, (long) buckets.length);
    }

    private static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
