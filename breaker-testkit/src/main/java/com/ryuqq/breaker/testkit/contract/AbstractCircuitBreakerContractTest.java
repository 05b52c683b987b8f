package com.ryuqq.breaker.testkit.contract;

import com.ryuqq.breaker.core.classifier.OutcomeClassifier;
import com.ryuqq.breaker.core.config.CircuitBreakerOptions;
import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.engine.gate.ExecutionGate;
import com.ryuqq.breaker.testkit.clock.ManualClockSource;
import com.ryuqq.breaker.testkit.listener.RecordingTransitionListener;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Circuit Breaker Contract Test 공통 기반.
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>ManualClockSource: 수동으로 전진하는 시계</li>
 *   <li>RecordingTransitionListener: 전이 이벤트 기록</li>
 *   <li>기본 설정: samplingDuration=2s, minimumThroughput=2, failureRatio=0.5, breakDuration=1s</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractCircuitBreakerContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         ExecutionGate breaker = newBreaker();
 *         failTimes(breaker, 2);
 *         assertState(breaker, CircuitState.OPEN);
 *     }
 * }
 * </pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public abstract class AbstractCircuitBreakerContractTest {

    protected ManualClockSource clock;
    protected RecordingTransitionListener recorder;

    /**
     * 각 테스트 전에 새 시계와 기록기를 준비합니다.
     */
    @BeforeEach
    void setUpContract() {
        clock = new ManualClockSource();
        recorder = new RecordingTransitionListener();
    }

    /**
     * 기본 계약 설정.
     *
     * @return samplingDuration=2s, minimumThroughput=2, failureRatio=0.5, breakDuration=1s
     */
    protected CircuitBreakerOptions baseOptions() {
        return CircuitBreakerOptions.defaults(OutcomeClassifier.handleAllFailures())
            .withName("contract-circuit")
            .withSamplingDuration(Duration.ofSeconds(2))
            .withMinimumThroughput(2)
            .withFailureRatio(0.5)
            .withBreakDuration(Duration.ofSeconds(1))
            .withClock(clock);
    }

    /**
     * 기본 설정으로 Circuit Breaker를 만들고 기록기를 연결합니다.
     *
     * @return 새 Circuit Breaker
     */
    protected ExecutionGate newBreaker() {
        return newBreaker(baseOptions());
    }

    protected ExecutionGate newBreaker(CircuitBreakerOptions options) {
        ExecutionGate breaker = ExecutionGate.create(options);
        breaker.subscribe(recorder);
        return breaker;
    }

    /**
     * 실패하는 작업을 n번 실행.
     */
    protected void failTimes(ExecutionGate breaker, int times) {
        for (int i = 0; i < times; i++) {
            Outcome<String> outcome = breaker.tryExecute(() -> {
                throw new IllegalStateException("downstream failure");
            });
            assertTrue(outcome.wasExecuted(), "failing call #" + (i + 1) + " should have executed");
        }
    }

    /**
     * 성공하는 작업을 n번 실행.
     */
    protected void succeedTimes(ExecutionGate breaker, int times) {
        for (int i = 0; i < times; i++) {
            Outcome<String> outcome = breaker.tryExecute(() -> "ok");
            assertTrue(outcome.isOk(), "succeeding call #" + (i + 1) + " should have returned a value");
        }
    }

    protected void assertState(ExecutionGate breaker, CircuitState expected) {
        assertEquals(expected, breaker.currentState(),
            "Circuit " + breaker.name() + " should be " + expected);
    }
}
