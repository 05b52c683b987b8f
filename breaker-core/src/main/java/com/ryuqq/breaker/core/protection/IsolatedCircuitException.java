package com.ryuqq.breaker.core.protection;

import com.ryuqq.breaker.core.state.CircuitState;

/**
 * Circuit이 수동으로 격리(ISOLATED)되어 차단된 경우.
 *
 * <p>{@code close()}가 호출될 때까지 무기한 차단되므로 재시도 힌트가 없습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class IsolatedCircuitException extends CircuitRejectedException {

    /**
     * 생성자.
     *
     * @param message 차단 사유
     */
    public IsolatedCircuitException(String message) {
        super(message, CircuitState.ISOLATED);
    }
}
