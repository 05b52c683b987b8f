package com.ryuqq.breaker.core.protection;

import java.time.Duration;

/**
 * BreakDuration 생성기 평가 실패.
 *
 * <p>내부 전용 예외로, 호출자에게 던져지지 않습니다. 기본 BreakDuration으로 대체된 뒤
 * 로그와 {@link com.ryuqq.breaker.core.event.TransitionListener#onPolicyEvaluationFailure}로만 보고됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class PolicyEvaluationException extends RuntimeException {

    private final Duration fallbackDuration;

    /**
     * 생성자.
     *
     * @param message 실패 내용
     * @param cause 생성기가 던진 예외 (값 검증 실패라면 null)
     * @param fallbackDuration 대신 적용된 BreakDuration
     */
    public PolicyEvaluationException(String message, Throwable cause, Duration fallbackDuration) {
        super(message, cause);
        this.fallbackDuration = fallbackDuration;
    }

    /**
     * 대체 적용된 BreakDuration.
     *
     * @return fallback duration
     */
    public Duration getFallbackDuration() {
        return fallbackDuration;
    }
}
