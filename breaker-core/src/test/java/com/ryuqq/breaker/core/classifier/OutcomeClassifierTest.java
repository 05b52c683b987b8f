package com.ryuqq.breaker.core.classifier;

import com.ryuqq.breaker.core.outcome.Classification;
import com.ryuqq.breaker.core.outcome.Fail;
import com.ryuqq.breaker.core.outcome.Ok;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketException;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OutcomeClassifier 기본 구현 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("OutcomeClassifier 테스트")
class OutcomeClassifierTest {

    @Test
    @DisplayName("handleAllFailures: 값은 SUCCESS, 예외는 FAILURE")
    void handleAllFailures_기본_분류() {
        OutcomeClassifier classifier = OutcomeClassifier.handleAllFailures();

        assertThat(classifier.classify(Ok.of("v"))).isEqualTo(Classification.SUCCESS);
        assertThat(classifier.classify(Ok.of(null))).isEqualTo(Classification.SUCCESS);
        assertThat(classifier.classify(Fail.of(new IOException("io")))).isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(Fail.of(new OutOfMemoryError()))).isEqualTo(Classification.FAILURE);
    }

    @Test
    @DisplayName("취소와 인터럽트는 항상 UNHANDLED")
    void 취소_인터럽트_UNHANDLED() {
        OutcomeClassifier classifier = OutcomeClassifier.handleAllFailures();

        assertThat(classifier.classify(Fail.of(new CancellationException())))
            .isEqualTo(Classification.UNHANDLED);
        assertThat(classifier.classify(Fail.of(new InterruptedException())))
            .isEqualTo(Classification.UNHANDLED);
    }

    @Test
    @DisplayName("handling: 지정한 예외 타입(하위 타입 포함)만 FAILURE")
    void handling_지정_타입만_FAILURE() {
        OutcomeClassifier classifier = OutcomeClassifier.handling(List.of(IOException.class, TimeoutException.class));

        assertThat(classifier.classify(Fail.of(new SocketException("reset"))))
            .isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(Fail.of(new TimeoutException())))
            .isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(Fail.of(new IllegalArgumentException("bad input"))))
            .isEqualTo(Classification.UNHANDLED);
    }

    @Test
    @DisplayName("handling: 빈 목록은 거부")
    void handling_빈_목록_거부() {
        assertThatThrownBy(() -> OutcomeClassifier.handling(List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or empty");
    }

    @Test
    @DisplayName("orResult: 조건에 맞는 결과 값을 FAILURE로 분류")
    void orResult_결과값_FAILURE() {
        OutcomeClassifier classifier = OutcomeClassifier.handleAllFailures()
            .orResult(value -> Integer.valueOf(503).equals(value));

        assertThat(classifier.classify(Ok.of(503))).isEqualTo(Classification.FAILURE);
        assertThat(classifier.classify(Ok.of(200))).isEqualTo(Classification.SUCCESS);
        assertThat(classifier.classify(Fail.of(new IOException()))).isEqualTo(Classification.FAILURE);
    }
}
