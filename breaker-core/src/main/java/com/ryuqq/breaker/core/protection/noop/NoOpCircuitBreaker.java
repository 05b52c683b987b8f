package com.ryuqq.breaker.core.protection.noop;

import com.ryuqq.breaker.core.event.TransitionListener;
import com.ryuqq.breaker.core.model.OperationId;
import com.ryuqq.breaker.core.outcome.Fail;
import com.ryuqq.breaker.core.outcome.Ok;
import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.Subscription;
import com.ryuqq.breaker.core.protection.UnitOfWork;
import com.ryuqq.breaker.core.state.CircuitState;

import java.util.Optional;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 실행하며, 상태 추적을 하지 않습니다.
 * 보호 없이 실행하고자 하는 개발 및 테스트 환경에서 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 작업을 바로 실행, 예외는 그대로 전파</li>
 *   <li>isolate() / close(): 아무 동작 안 함</li>
 *   <li>currentState(): 항상 CLOSED 반환</li>
 *   <li>subscribe(): 이벤트가 발생하지 않으므로 리스너는 호출되지 않음</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public <T> T execute(OperationId operationId, UnitOfWork<T> work) throws Exception {
        return work.run();
    }

    @Override
    public <T> Outcome<T> tryExecute(OperationId operationId, UnitOfWork<T> work) {
        try {
            return Ok.of(work.run());
        } catch (Exception e) {
            return Fail.of(e);
        }
    }

    @Override
    public void isolate() {
        // NoOp
    }

    @Override
    public void close() {
        // NoOp
    }

    @Override
    public CircuitState currentState() {
        return CircuitState.CLOSED;
    }

    @Override
    public Optional<Outcome<?>> lastOutcome() {
        return Optional.empty();
    }

    @Override
    public Subscription subscribe(TransitionListener listener) {
        return () -> { };
    }
}
