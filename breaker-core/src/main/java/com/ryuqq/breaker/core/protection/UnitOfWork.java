package com.ryuqq.breaker.core.protection;

/**
 * Circuit Breaker로 보호되는 작업 단위.
 *
 * @param <T> 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UnitOfWork<T> {

    /**
     * 작업 실행.
     *
     * @return 결과 값
     * @throws Exception 작업 실패 시 (Circuit Breaker가 그대로 전파)
     */
    T run() throws Exception;
}
