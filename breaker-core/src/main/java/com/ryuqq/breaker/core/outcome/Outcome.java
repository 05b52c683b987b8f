package com.ryuqq.breaker.core.outcome;

import com.ryuqq.breaker.core.protection.CircuitRejectedException;

import java.util.Optional;

/**
 * Circuit Breaker를 통과한 호출의 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 작업이 실행되어 값을 반환함</li>
 *   <li>{@link Fail}: 작업이 실행되었으나 예외를 던짐</li>
 *   <li>{@link Rejected}: Circuit Breaker가 실행 자체를 차단함</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 구현 케이스가 이 세 가지로 고정됩니다.
 * {@code Fail}의 예외는 작업이 던진 원본 그대로이며, Circuit Breaker가 만든 예외는
 * 오직 {@code Rejected}에만 담깁니다.</p>
 *
 * @param <T> 작업 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail, Rejected {

    /**
     * 작업이 성공적으로 값을 반환했는지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 작업이 실행되었으나 실패했는지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * Circuit Breaker에 의해 차단되었는지 확인.
     *
     * @return 차단 여부
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * 작업이 실제로 실행되었는지 확인.
     *
     * @return Ok 또는 Fail이면 true
     */
    default boolean wasExecuted() {
        return !isRejected();
    }

    /**
     * 결과를 값으로 풀어냅니다.
     *
     * <p>Fail이면 원본 예외를, Rejected이면 차단 예외를 그대로 던집니다.</p>
     *
     * @return 작업 결과 값
     * @throws Exception 작업의 원본 예외 또는 {@link CircuitRejectedException}
     */
    T getOrThrow() throws Exception;

    /**
     * 실패 원인 조회.
     *
     * @return Fail/Rejected의 예외, Ok이면 empty
     */
    Optional<Throwable> failure();
}
