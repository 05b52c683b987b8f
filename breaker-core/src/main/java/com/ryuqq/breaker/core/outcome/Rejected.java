package com.ryuqq.breaker.core.outcome;

import com.ryuqq.breaker.core.protection.CircuitRejectedException;

import java.util.Optional;

/**
 * Circuit Breaker가 작업 실행을 차단한 결과.
 *
 * <p>작업은 호출되지 않았으며 샘플링 윈도우에도 기록되지 않습니다.</p>
 *
 * @param rejection 차단 사유 ({@code BrokenCircuitException} 또는 {@code IsolatedCircuitException})
 * @param <T> 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
public record Rejected<T>(CircuitRejectedException rejection) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException rejection이 null인 경우
     */
    public Rejected {
        if (rejection == null) {
            throw new IllegalArgumentException("rejection cannot be null");
        }
    }

    @Override
    public T getOrThrow() {
        throw rejection;
    }

    @Override
    public Optional<Throwable> failure() {
        return Optional.of(rejection);
    }
}
