package com.ryuqq.breaker.core.event;

import com.ryuqq.breaker.core.model.OperationId;
import com.ryuqq.breaker.core.model.WindowSnapshot;
import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.state.CircuitState;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 실제로 일어난 상태 전이 1건.
 *
 * <p>전이 1건당 정확히 하나의 이벤트가 생성되며, 상태가 바뀌지 않은 수동 호출은
 * 이벤트를 만들지 않습니다.</p>
 *
 * @param type 이벤트 종류 (심각도 포함)
 * @param circuitName 이벤트를 낸 Circuit Breaker 이름
 * @param fromState 이전 상태
 * @param toState 새 상태
 * @param snapshot 전이 시점 윈도우 집계 (초기화 직전 값)
 * @param timestamp 전이 시각
 * @param operationId 전이를 유발한 호출 식별자
 * @param lastOutcome 전이를 유발한 결과 (HALF_OPEN 진입과 수동 전이에는 null)
 * @param manual isolate()/close()에 의한 전이인지 여부
 * @param breakDuration OPEN 진입 시 적용된 BreakDuration (그 외 null)
 * @author Breaker Team
 * @since 1.0.0
 */
public record CircuitTransitionEvent(
    CircuitEventType type,
    String circuitName,
    CircuitState fromState,
    CircuitState toState,
    WindowSnapshot snapshot,
    Instant timestamp,
    OperationId operationId,
    Outcome<?> lastOutcome,
    boolean manual,
    Duration breakDuration
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 fromState와 toState가 같은 경우
     */
    public CircuitTransitionEvent {
        if (type == null || fromState == null || toState == null) {
            throw new IllegalArgumentException("type, fromState and toState cannot be null");
        }
        if (fromState == toState) {
            throw new IllegalArgumentException("fromState and toState must differ (state: " + fromState + ")");
        }
        if (snapshot == null || timestamp == null || operationId == null) {
            throw new IllegalArgumentException("snapshot, timestamp and operationId cannot be null");
        }
        if (circuitName == null || circuitName.isBlank()) {
            throw new IllegalArgumentException("circuitName cannot be null or blank");
        }
    }

    /**
     * 이벤트 심각도.
     *
     * @return type의 심각도
     */
    public Severity severity() {
        return type.severity();
    }

    public Optional<Outcome<?>> outcome() {
        return Optional.ofNullable(lastOutcome);
    }

    public Optional<Duration> appliedBreakDuration() {
        return Optional.ofNullable(breakDuration);
    }
}
