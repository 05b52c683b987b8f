package com.ryuqq.breaker.engine.policy;

import com.ryuqq.breaker.core.config.BreakDurationArguments;

import java.time.Duration;

/**
 * 모든 OPEN 진입에 같은 BreakDuration을 적용하는 정책.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class FixedBreakDurationPolicy implements BreakDurationPolicy {

    private final Duration duration;

    /**
     * 생성자.
     *
     * @param duration 고정 BreakDuration (양수)
     * @throws IllegalArgumentException duration이 null이거나 양수가 아닌 경우
     */
    public FixedBreakDurationPolicy(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be positive (current: " + duration + ")");
        }
        this.duration = duration;
    }

    @Override
    public Duration breakDuration(BreakDurationArguments arguments) {
        return duration;
    }

    /**
     * 고정 BreakDuration.
     *
     * @return 매 OPEN 전이에 사용하는 duration
     */
    public Duration getDuration() {
        return duration;
    }
}
