package com.ryuqq.breaker.core.outcome;

import java.util.Optional;

/**
 * 작업이 실행되어 값을 반환한 결과.
 *
 * @param value 작업 반환 값 (null 허용)
 * @param <T> 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Ok 생성.
     *
     * @param value 반환 값
     * @param <T> 결과 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }

    @Override
    public T getOrThrow() {
        return value;
    }

    @Override
    public Optional<Throwable> failure() {
        return Optional.empty();
    }
}
