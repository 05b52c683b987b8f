package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.event.TransitionListener;
import com.ryuqq.breaker.core.model.OperationId;
import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.state.CircuitState;

import java.util.Optional;

/**
 * Circuit Breaker.
 *
 * <p>보호 대상 리소스 호출의 실패율을 샘플링 윈도우로 추적하고, 임계값 초과 시
 * 빠르게 실패(Fail-Fast)하여 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 상태:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 실패율 추적</li>
 *   <li>OPEN: 요청 차단, BreakDeadline 후 프로브 허용</li>
 *   <li>HALF_OPEN: 프로브 1건으로 복구 테스트</li>
 *   <li>ISOLATED: 수동 격리, close() 전까지 차단</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * try {
 *     Result result = cb.execute(() -> externalApi.call());
 * } catch (BrokenCircuitException e) {
 *     // OPEN: e.getRetryAfter() 이후 재시도 가능
 * } catch (IsolatedCircuitException e) {
 *     // 수동 격리 상태
 * }
 * // externalApi.call()이 던진 예외는 래핑 없이 그대로 전파됩니다.
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 작업 실행 (식별자 자동 생성).
     *
     * @param work 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws CircuitRejectedException Circuit Breaker가 실행을 차단한 경우
     * @throws Exception 작업이 던진 원본 예외
     */
    default <T> T execute(UnitOfWork<T> work) throws Exception {
        return execute(OperationId.random(), work);
    }

    /**
     * 작업 실행.
     *
     * @param operationId 호출 식별자 (전이 이벤트에 기록)
     * @param work 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws CircuitRejectedException Circuit Breaker가 실행을 차단한 경우
     * @throws Exception 작업이 던진 원본 예외
     */
    <T> T execute(OperationId operationId, UnitOfWork<T> work) throws Exception;

    /**
     * 작업 실행 후 결과를 예외 없이 {@link Outcome}으로 반환.
     *
     * @param operationId 호출 식별자
     * @param work 작업
     * @param <T> 결과 타입
     * @return Ok, Fail 또는 Rejected
     */
    <T> Outcome<T> tryExecute(OperationId operationId, UnitOfWork<T> work);

    /**
     * {@link #tryExecute(OperationId, UnitOfWork)} (식별자 자동 생성).
     *
     * @param work 작업
     * @param <T> 결과 타입
     * @return Ok, Fail 또는 Rejected
     */
    default <T> Outcome<T> tryExecute(UnitOfWork<T> work) {
        return tryExecute(OperationId.random(), work);
    }

    /**
     * Circuit을 즉시 ISOLATED로 전환합니다.
     *
     * <p>진행 중인 프로브의 결과 평가보다 우선하며, 이미 격리 상태라면 아무 일도 하지 않습니다.</p>
     */
    void isolate();

    /**
     * 수동 격리를 해제하고 CLOSED로 강제 전환합니다.
     *
     * <p>샘플링 윈도우를 초기화하여 과거 실패 이력으로 곧바로 다시 열리지 않게 합니다.
     * 이미 CLOSED라면 윈도우만 초기화하고 전이 이벤트는 발생하지 않습니다.</p>
     */
    void close();

    /**
     * 현재 Circuit 상태 조회.
     *
     * <p>OPEN의 BreakDeadline이 지났더라도 다음 호출이 들어오기 전까지는 OPEN으로 보고합니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN, ISOLATED 중 하나
     */
    CircuitState currentState();

    /**
     * 마지막으로 처리 대상(SUCCESS/FAILURE)으로 분류된 결과.
     *
     * @return 마지막 결과, 없으면 empty
     */
    Optional<Outcome<?>> lastOutcome();

    /**
     * 전이 리스너 등록.
     *
     * @param listener 리스너
     * @return 등록 해제 핸들
     */
    Subscription subscribe(TransitionListener listener);
}
