package com.ryuqq.breaker.engine.policy;

import com.ryuqq.breaker.core.config.BreakDurationArguments;
import com.ryuqq.breaker.core.config.BreakDurationGenerator;
import com.ryuqq.breaker.core.protection.PolicyEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * 사용자 생성기로 BreakDuration을 계산하는 정책.
 *
 * <p><strong>평가 규칙:</strong></p>
 * <ol>
 *   <li>생성기 호출 (실패 수, 처리량, 연속 OPEN 횟수)</li>
 *   <li>양수 Duration이면 그대로 사용</li>
 *   <li>예외, null, 0 이하이면 fallback 적용</li>
 *   <li>실패는 WARN 로그와 failureSink로만 보고 (호출자에게 전파하지 않음)</li>
 * </ol>
 *
 * <p>예: 연속 OPEN 횟수에 비례해 늘리는 생성기</p>
 * <pre>{@code
 * args -> Duration.ofSeconds(Math.min(60, 5L << (args.consecutiveOpenCount() - 1)))
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class DynamicBreakDurationPolicy implements BreakDurationPolicy {

    private static final Logger log = LoggerFactory.getLogger(DynamicBreakDurationPolicy.class);

    private final String circuitName;
    private final BreakDurationGenerator generator;
    private final Duration fallback;
    private final Consumer<PolicyEvaluationException> failureSink;

    /**
     * 생성자.
     *
     * @param circuitName 로그용 Circuit Breaker 이름
     * @param generator BreakDuration 생성기
     * @param fallback 생성기 실패 시 적용할 기본값 (양수)
     * @param failureSink 평가 실패 보고 대상
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DynamicBreakDurationPolicy(
        String circuitName,
        BreakDurationGenerator generator,
        Duration fallback,
        Consumer<PolicyEvaluationException> failureSink
    ) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        if (fallback == null || fallback.isZero() || fallback.isNegative()) {
            throw new IllegalArgumentException("fallback must be positive (current: " + fallback + ")");
        }
        if (failureSink == null) {
            throw new IllegalArgumentException("failureSink cannot be null");
        }
        this.circuitName = circuitName;
        this.generator = generator;
        this.fallback = fallback;
        this.failureSink = failureSink;
    }

    @Override
    public Duration breakDuration(BreakDurationArguments arguments) {
        Duration generated;
        try {
            generated = generator.generate(arguments);
        } catch (RuntimeException e) {
            return fallBack("Break duration generator threw " + e.getClass().getSimpleName(), e, arguments);
        }

        if (generated == null || generated.isZero() || generated.isNegative()) {
            return fallBack("Break duration generator returned non-positive duration: " + generated, null, arguments);
        }
        return generated;
    }

    private Duration fallBack(String message, Throwable cause, BreakDurationArguments arguments) {
        PolicyEvaluationException failure = new PolicyEvaluationException(message, cause, fallback);
        log.warn("Circuit {} fell back to default break duration {} ({}, arguments: {})",
            circuitName, fallback, message, arguments, failure);
        failureSink.accept(failure);
        return fallback;
    }
}
