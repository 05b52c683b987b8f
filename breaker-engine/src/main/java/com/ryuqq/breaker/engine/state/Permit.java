package com.ryuqq.breaker.engine.state;

import com.ryuqq.breaker.core.model.OperationId;

/**
 * 입장 허가.
 *
 * <p>{@link CircuitStateMachine#acquire(OperationId)}가 발급하고, 작업 완료 후
 * {@link CircuitStateMachine#onCompletion}에 되돌려줍니다.
 * {@code generation}은 허가 당시의 Circuit 세대이며, 그 사이 전이가 있었다면
 * 이 허가의 결과는 현재 구간에 반영되지 않습니다.</p>
 *
 * @param operationId 호출 식별자
 * @param probe HALF_OPEN 프로브 여부
 * @param generation 허가 시점 세대
 * @author Breaker Team
 * @since 1.0.0
 */
public record Permit(OperationId operationId, boolean probe, long generation) {

    public Permit {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
    }
}
