package com.ryuqq.breaker.core.protection;

/**
 * {@link CircuitBreaker#subscribe} 등록 해제 핸들.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    /**
     * 리스너 등록 해제. 여러 번 호출해도 안전합니다.
     */
    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
