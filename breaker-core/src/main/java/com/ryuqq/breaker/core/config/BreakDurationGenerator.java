package com.ryuqq.breaker.core.config;

import java.time.Duration;

/**
 * OPEN 진입마다 BreakDuration을 동적으로 계산하는 함수.
 *
 * <p>OPEN 진입 1회당 정확히 한 번 평가되며(거부된 호출마다 평가되지 않음), 그 결과는
 * 해당 OPEN 구간 동안 유지됩니다. Circuit 잠금 안에서 호출되므로 빠르고 블로킹 없이 끝나야 합니다.</p>
 *
 * <p>예외를 던지거나 null/0 이하를 반환하면 기본값(5초)이 적용됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BreakDurationGenerator {

    /**
     * BreakDuration 계산.
     *
     * @param arguments 실패 수, 처리량, 연속 OPEN 횟수
     * @return 양수 Duration
     */
    Duration generate(BreakDurationArguments arguments);
}
