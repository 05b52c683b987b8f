package com.ryuqq.breaker.core.clock;

import java.time.Clock;
import java.time.Instant;

/**
 * 시간 공급자.
 *
 * <p>기간 계산(윈도우 버킷, BreakDeadline)에는 단조 증가하는 {@link #nanoTime()}을,
 * 이벤트 타임스탬프에는 {@link #instant()}를 사용합니다.
 * 테스트에서는 수동으로 전진시키는 구현을 주입합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface ClockSource {

    /**
     * 단조 증가 시각 (나노초). 절대값에는 의미가 없고 차이만 의미가 있습니다.
     *
     * @return 현재 단조 시각
     */
    long nanoTime();

    /**
     * 벽시계 시각.
     *
     * @return 현재 시각
     */
    Instant instant();

    /**
     * 시스템 시계.
     *
     * @return {@link System#nanoTime()}과 UTC 시계를 사용하는 ClockSource
     */
    static ClockSource system() {
        return SystemClockSource.INSTANCE;
    }

    /**
     * 시스템 ClockSource 구현.
     */
    final class SystemClockSource implements ClockSource {

        private static final SystemClockSource INSTANCE = new SystemClockSource();

        private final Clock wallClock = Clock.systemUTC();

        private SystemClockSource() {
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public Instant instant() {
            return wallClock.instant();
        }
    }
}
