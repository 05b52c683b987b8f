package com.ryuqq.breaker.core.classifier;

import com.ryuqq.breaker.core.outcome.Classification;
import com.ryuqq.breaker.core.outcome.Fail;
import com.ryuqq.breaker.core.outcome.Ok;
import com.ryuqq.breaker.core.outcome.Outcome;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

/**
 * 실행된 작업의 결과를 Circuit Breaker 관점에서 분류합니다.
 *
 * <p>입력은 항상 {@link Ok} 또는 {@link Fail}이며, 차단된 호출은 분류되지 않습니다.
 * 분류기가 예외를 던지면 해당 결과는 {@link Classification#UNHANDLED}로 취급됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OutcomeClassifier {

    /**
     * 결과 분류.
     *
     * @param outcome 실행된 작업의 결과 (Ok 또는 Fail)
     * @return SUCCESS, FAILURE, UNHANDLED 중 하나
     */
    Classification classify(Outcome<?> outcome);

    /**
     * 모든 예외를 실패로, 모든 반환 값을 성공으로 분류합니다.
     *
     * <p>취소({@link CancellationException})와 인터럽트({@link InterruptedException})는
     * 리소스 상태와 무관하므로 UNHANDLED로 통과시킵니다.</p>
     *
     * @return 기본 분류기
     */
    static OutcomeClassifier handleAllFailures() {
        return handling(List.of(Throwable.class));
    }

    /**
     * 지정한 예외 타입(하위 타입 포함)만 실패로 분류합니다.
     *
     * <p>그 외 예외는 UNHANDLED, 반환 값은 SUCCESS입니다.
     * 취소와 인터럽트는 항상 UNHANDLED입니다.</p>
     *
     * @param handled 실패로 볼 예외 타입 목록
     * @return 분류기
     * @throws IllegalArgumentException handled가 null이거나 비어 있는 경우
     */
    static OutcomeClassifier handling(List<Class<? extends Throwable>> handled) {
        if (handled == null || handled.isEmpty()) {
            throw new IllegalArgumentException("handled exception types cannot be null or empty");
        }
        List<Class<? extends Throwable>> types = List.copyOf(handled);
        return outcome -> {
            Throwable cause = outcome.failure().orElse(null);
            if (cause == null) {
                return Classification.SUCCESS;
            }
            if (cause instanceof CancellationException || cause instanceof InterruptedException) {
                return Classification.UNHANDLED;
            }
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(cause)) {
                    return Classification.FAILURE;
                }
            }
            return Classification.UNHANDLED;
        };
    }

    /**
     * 반환 값도 검사하는 분류기를 만듭니다.
     *
     * <p>예외는 {@code this}의 판정을 따르고, 반환 값이 {@code failedResult}를 만족하면 FAILURE로 분류합니다.</p>
     *
     * @param failedResult 실패로 볼 반환 값 조건
     * @return 결합된 분류기
     */
    default OutcomeClassifier orResult(Predicate<Object> failedResult) {
        if (failedResult == null) {
            throw new IllegalArgumentException("failedResult cannot be null");
        }
        return outcome -> {
            if (outcome instanceof Ok<?> ok && failedResult.test(ok.value())) {
                return Classification.FAILURE;
            }
            return classify(outcome);
        };
    }
}
