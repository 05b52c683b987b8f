package com.ryuqq.breaker.core.outcome;

/**
 * {@link com.ryuqq.breaker.core.classifier.OutcomeClassifier}가 내린 판정.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum Classification {

    /**
     * 처리 대상 성공. 윈도우에 성공으로 기록됩니다.
     */
    SUCCESS,

    /**
     * 처리 대상 실패. 윈도우에 실패로 기록되고 전이 판단에 사용됩니다.
     */
    FAILURE,

    /**
     * 처리 대상 아님. 카운터와 상태에 영향 없이 그대로 통과합니다.
     */
    UNHANDLED
}
