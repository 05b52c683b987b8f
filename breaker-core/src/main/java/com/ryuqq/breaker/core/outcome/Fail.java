package com.ryuqq.breaker.core.outcome;

import java.util.Optional;

/**
 * 작업이 실행되었으나 예외로 끝난 결과.
 *
 * <p>{@code cause}는 작업이 던진 예외 그 자체이며 래핑되지 않습니다.</p>
 *
 * @param cause 작업이 던진 예외
 * @param <T> 결과 타입
 * @author Breaker Team
 * @since 1.0.0
 */
public record Fail<T>(Throwable cause) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public Fail {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    /**
     * Fail 생성.
     *
     * @param cause 작업 예외
     * @param <T> 결과 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(Throwable cause) {
        return new Fail<>(cause);
    }

    /**
     * 원본 예외를 그대로 던집니다.
     *
     * <p>checked 예외는 {@link Exception}으로, {@link Error}는 Error 그대로 전파됩니다.</p>
     */
    @Override
    public T getOrThrow() throws Exception {
        if (cause instanceof Exception exception) {
            throw exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Unsupported throwable type: " + cause.getClass().getName(), cause);
    }

    @Override
    public Optional<Throwable> failure() {
        return Optional.of(cause);
    }
}
