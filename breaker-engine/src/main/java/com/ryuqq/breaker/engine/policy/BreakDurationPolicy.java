package com.ryuqq.breaker.engine.policy;

import com.ryuqq.breaker.core.config.BreakDurationArguments;
import com.ryuqq.breaker.core.config.CircuitBreakerOptions;
import com.ryuqq.breaker.core.protection.PolicyEvaluationException;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * OPEN 구간 길이(BreakDuration) 결정 정책.
 *
 * <p>OPEN 진입 1회당 정확히 한 번 호출되며, 결과로 BreakDeadline이 고정됩니다.
 * 구현체는 예외를 던지지 않고 항상 양수 Duration을 반환해야 합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface BreakDurationPolicy {

    /**
     * BreakDuration 결정.
     *
     * @param arguments OPEN 진입 시점 통계
     * @return 양수 Duration
     */
    Duration breakDuration(BreakDurationArguments arguments);

    /**
     * 설정에 맞는 정책 생성.
     *
     * @param options Circuit Breaker 설정
     * @param failureSink 동적 정책 평가 실패 보고 대상
     * @return 고정 또는 동적 정책
     */
    static BreakDurationPolicy from(CircuitBreakerOptions options, Consumer<PolicyEvaluationException> failureSink) {
        if (options.usesDynamicBreakDuration()) {
            return new DynamicBreakDurationPolicy(
                options.name(),
                options.breakDurationGenerator(),
                CircuitBreakerOptions.DEFAULT_BREAK_DURATION,
                failureSink
            );
        }
        return new FixedBreakDurationPolicy(options.breakDuration());
    }
}
