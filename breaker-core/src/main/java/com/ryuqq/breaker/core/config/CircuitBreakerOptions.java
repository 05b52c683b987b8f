package com.ryuqq.breaker.core.config;

import com.ryuqq.breaker.core.classifier.OutcomeClassifier;
import com.ryuqq.breaker.core.clock.ClockSource;
import com.ryuqq.breaker.core.control.CircuitBreakerManualControl;
import com.ryuqq.breaker.core.control.CircuitBreakerStateProvider;
import com.ryuqq.breaker.core.event.CircuitTransitionEvent;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureRatio: OPEN 전환 실패율 (0 &lt; r ≤ 1, 기본 0.1)</li>
 *   <li>minimumThroughput: 판단에 필요한 최소 샘플 수 (기본 100)</li>
 *   <li>samplingDuration: 샘플링 윈도우 길이 (기본 30초)</li>
 *   <li>breakDuration / breakDurationGenerator: 둘 중 정확히 하나 (기본 고정 5초)</li>
 *   <li>classifier: 결과 분류기 (필수)</li>
 *   <li>manualControl, stateProvider: 외부 핸들 (선택)</li>
 *   <li>onOpened, onClosed, onHalfOpened: 전이 콜백 (선택)</li>
 *   <li>clock: 시간 공급자 (기본 시스템 시계)</li>
 * </ul>
 *
 * <p>잘못된 설정은 호출 시점이 아니라 생성 시점에 {@link IllegalArgumentException}으로 실패합니다.
 * {@code breakDuration}과 {@code breakDurationGenerator}를 동시에 지정해도 실패합니다.</p>
 *
 * @param name Circuit Breaker 이름 (로그, 이벤트, 차단 메시지에 사용)
 * @param failureRatio OPEN 전환 실패율
 * @param minimumThroughput 최소 처리량
 * @param samplingDuration 샘플링 윈도우 길이
 * @param breakDuration 고정 BreakDuration (generator를 쓰면 null)
 * @param breakDurationGenerator 동적 BreakDuration (고정값을 쓰면 null)
 * @param classifier 결과 분류기
 * @param manualControl 수동 제어 핸들 (null 허용)
 * @param stateProvider 상태 조회 핸들 (null 허용)
 * @param onOpened OPEN/ISOLATED 진입 콜백 (null 허용)
 * @param onClosed CLOSED 진입 콜백 (null 허용)
 * @param onHalfOpened HALF_OPEN 진입 콜백 (null 허용)
 * @param clock 시간 공급자
 * @author Breaker Team
 * @since 1.0.0
 */
public record CircuitBreakerOptions(
    String name,
    double failureRatio,
    int minimumThroughput,
    Duration samplingDuration,
    Duration breakDuration,
    BreakDurationGenerator breakDurationGenerator,
    OutcomeClassifier classifier,
    CircuitBreakerManualControl manualControl,
    CircuitBreakerStateProvider stateProvider,
    Consumer<CircuitTransitionEvent> onOpened,
    Consumer<CircuitTransitionEvent> onClosed,
    Consumer<CircuitTransitionEvent> onHalfOpened,
    ClockSource clock
) {

    public static final String DEFAULT_NAME = "circuit-breaker";
    public static final double DEFAULT_FAILURE_RATIO = 0.1;
    public static final int DEFAULT_MINIMUM_THROUGHPUT = 100;
    public static final Duration DEFAULT_SAMPLING_DURATION = Duration.ofSeconds(30);
    public static final Duration DEFAULT_BREAK_DURATION = Duration.ofSeconds(5);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerOptions {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (Double.isNaN(failureRatio) || failureRatio <= 0.0 || failureRatio > 1.0) {
            throw new IllegalArgumentException(
                "failureRatio must be in (0, 1] (current: " + failureRatio + ")"
            );
        }
        if (minimumThroughput <= 0) {
            throw new IllegalArgumentException(
                "minimumThroughput must be positive (current: " + minimumThroughput + ")"
            );
        }
        requirePositive("samplingDuration", samplingDuration);
        if (breakDuration != null && breakDurationGenerator != null) {
            throw new IllegalArgumentException(
                "breakDuration and breakDurationGenerator cannot both be set (breakDuration: " + breakDuration + ")"
            );
        }
        if (breakDuration == null && breakDurationGenerator == null) {
            throw new IllegalArgumentException("either breakDuration or breakDurationGenerator must be set");
        }
        if (breakDuration != null) {
            requirePositive("breakDuration", breakDuration);
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
    }

    /**
     * 기본 설정 생성.
     *
     * <p>기본값: failureRatio=0.1, minimumThroughput=100, samplingDuration=30s, breakDuration=5s</p>
     *
     * @param classifier 결과 분류기
     * @return 기본 설정
     * @throws IllegalArgumentException classifier가 null인 경우
     */
    public static CircuitBreakerOptions defaults(OutcomeClassifier classifier) {
        return new CircuitBreakerOptions(
            DEFAULT_NAME,
            DEFAULT_FAILURE_RATIO,
            DEFAULT_MINIMUM_THROUGHPUT,
            DEFAULT_SAMPLING_DURATION,
            DEFAULT_BREAK_DURATION,
            null,
            classifier,
            null,
            null,
            null,
            null,
            null,
            ClockSource.system()
        );
    }

    private static void requirePositive(String option, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(option + " cannot be null");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(option + " must be positive (current: " + value + ")");
        }
    }

    /**
     * 동적 BreakDuration 사용 여부.
     *
     * @return generator가 설정되어 있으면 true
     */
    public boolean usesDynamicBreakDuration() {
        return breakDurationGenerator != null;
    }

    public CircuitBreakerOptions withName(String name) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withFailureRatio(double failureRatio) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withMinimumThroughput(int minimumThroughput) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withSamplingDuration(Duration samplingDuration) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    /**
     * 고정 BreakDuration으로 전환한 새 인스턴스 생성 (generator는 해제).
     */
    public CircuitBreakerOptions withBreakDuration(Duration breakDuration) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            null, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    /**
     * 동적 BreakDuration으로 전환한 새 인스턴스 생성 (고정값은 해제).
     */
    public CircuitBreakerOptions withBreakDurationGenerator(BreakDurationGenerator breakDurationGenerator) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, null,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withClassifier(OutcomeClassifier classifier) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withManualControl(CircuitBreakerManualControl manualControl) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withStateProvider(CircuitBreakerStateProvider stateProvider) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withOnOpened(Consumer<CircuitTransitionEvent> onOpened) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withOnClosed(Consumer<CircuitTransitionEvent> onClosed) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withOnHalfOpened(Consumer<CircuitTransitionEvent> onHalfOpened) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }

    public CircuitBreakerOptions withClock(ClockSource clock) {
        return new CircuitBreakerOptions(name, failureRatio, minimumThroughput, samplingDuration, breakDuration,
            breakDurationGenerator, classifier, manualControl, stateProvider, onOpened, onClosed, onHalfOpened, clock);
    }
}
