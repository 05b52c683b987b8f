package com.ryuqq.breaker.engine.gate;

import com.ryuqq.breaker.core.classifier.OutcomeClassifier;
import com.ryuqq.breaker.core.config.CircuitBreakerOptions;
import com.ryuqq.breaker.core.event.CircuitEventType;
import com.ryuqq.breaker.core.event.TransitionListener;
import com.ryuqq.breaker.core.model.OperationId;
import com.ryuqq.breaker.core.model.WindowSnapshot;
import com.ryuqq.breaker.core.outcome.Classification;
import com.ryuqq.breaker.core.outcome.Fail;
import com.ryuqq.breaker.core.outcome.Ok;
import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.outcome.Rejected;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.CircuitRejectedException;
import com.ryuqq.breaker.core.protection.Subscription;
import com.ryuqq.breaker.core.protection.UnitOfWork;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.engine.state.CircuitStateMachine;
import com.ryuqq.breaker.engine.state.Permit;
import com.ryuqq.breaker.engine.state.TransitionNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Circuit Breaker 진입점 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>이미 인터럽트된 스레드 → CancellationException (아무것도 기록하지 않음)</li>
 *   <li>상태 머신 입장 판단 → 차단 시 작업을 호출하지 않고 즉시 Rejected</li>
 *   <li>작업 실행 (상태 머신 잠금 밖)</li>
 *   <li>분류기로 결과 분류 (분류기 예외는 UNHANDLED, Error는 허가 반환 후 전파)</li>
 *   <li>상태 머신에 결과 반영</li>
 *   <li>원본 결과 또는 원본 예외를 그대로 반환</li>
 * </ol>
 *
 * <p>인스턴스 하나가 보호 대상 리소스 하나를 담당합니다. 여러 리소스에는 각각 별도 인스턴스를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreakerOptions options = CircuitBreakerOptions.defaults(OutcomeClassifier.handleAllFailures())
 *     .withName("payment-api")
 *     .withFailureRatio(0.5)
 *     .withMinimumThroughput(20)
 *     .withBreakDuration(Duration.ofSeconds(10));
 *
 * CircuitBreaker breaker = ExecutionGate.create(options);
 * PaymentResult result = breaker.execute(() -> paymentApi.pay(request));
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class ExecutionGate implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGate.class);

    private final CircuitBreakerOptions options;
    private final OutcomeClassifier classifier;
    private final TransitionNotifier notifier;
    private final CircuitStateMachine machine;

    private ExecutionGate(CircuitBreakerOptions options) {
        this.options = options;
        this.classifier = options.classifier();
        this.notifier = new TransitionNotifier(options.name());
        this.notifier.subscribe(CircuitEventType.CIRCUIT_OPENED, options.onOpened());
        this.notifier.subscribe(CircuitEventType.CIRCUIT_CLOSED, options.onClosed());
        this.notifier.subscribe(CircuitEventType.CIRCUIT_HALF_OPENED, options.onHalfOpened());
        this.machine = new CircuitStateMachine(options, notifier);
    }

    /**
     * Circuit Breaker 생성 후 설정의 외부 핸들(stateProvider, manualControl)에 연결합니다.
     *
     * <p>격리 상태인 manualControl에 연결되면 생성 직후 ISOLATED가 됩니다.</p>
     *
     * @param options 설정 (생성 시점에 이미 검증됨)
     * @return 새 Circuit Breaker
     * @throws IllegalArgumentException options가 null인 경우
     * @throws IllegalStateException stateProvider가 이미 다른 Circuit Breaker에 연결된 경우
     */
    public static ExecutionGate create(CircuitBreakerOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        ExecutionGate gate = new ExecutionGate(options);
        if (options.stateProvider() != null) {
            options.stateProvider().attach(gate);
        }
        if (options.manualControl() != null) {
            options.manualControl().attach(gate);
        }
        log.debug("Circuit {} created (failureRatio: {}, minimumThroughput: {}, samplingDuration: {}, dynamicBreak: {})",
            options.name(), options.failureRatio(), options.minimumThroughput(),
            options.samplingDuration(), options.usesDynamicBreakDuration());
        return gate;
    }

    @Override
    public <T> T execute(OperationId operationId, UnitOfWork<T> work) throws Exception {
        return tryExecute(operationId, work).getOrThrow();
    }

    @Override
    public <T> Outcome<T> tryExecute(OperationId operationId, UnitOfWork<T> work) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (Thread.currentThread().isInterrupted()) {
            return Fail.of(new CancellationException("Cancelled before admission: " + operationId.value()));
        }

        Permit permit;
        try {
            permit = machine.acquire(operationId);
        } catch (CircuitRejectedException e) {
            log.debug("Circuit {} rejected {} ({})", options.name(), operationId, e.getCircuitState());
            return new Rejected<>(e);
        }

        Outcome<T> outcome = invoke(work);
        Classification classification = Classification.UNHANDLED;
        try {
            classification = classify(operationId, outcome);
        } finally {
            // 분류기가 Error를 던져도 허가(HALF_OPEN 슬롯)는 반드시 반환
            machine.onCompletion(permit, outcome, classification);
        }
        return outcome;
    }

    @Override
    public void isolate() {
        machine.isolate(OperationId.random());
    }

    @Override
    public void close() {
        machine.close(OperationId.random());
    }

    @Override
    public CircuitState currentState() {
        return machine.currentState();
    }

    @Override
    public Optional<Outcome<?>> lastOutcome() {
        return machine.lastOutcome();
    }

    @Override
    public Subscription subscribe(TransitionListener listener) {
        return notifier.subscribe(listener);
    }

    /**
     * 현재 윈도우 집계 (모니터링용).
     *
     * @return 스냅샷
     */
    public WindowSnapshot snapshot() {
        return machine.snapshot();
    }

    public String name() {
        return options.name();
    }

    public CircuitBreakerOptions options() {
        return options;
    }

    private <T> Outcome<T> invoke(UnitOfWork<T> work) {
        try {
            return Ok.of(work.run());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fail.of(e);
        } catch (Throwable t) {
            return Fail.of(t);
        }
    }

    private Classification classify(OperationId operationId, Outcome<?> outcome) {
        try {
            Classification classification = classifier.classify(outcome);
            if (classification == null) {
                log.warn("Circuit {} classifier returned null for {}, treating as UNHANDLED", options.name(), operationId);
                return Classification.UNHANDLED;
            }
            return classification;
        } catch (RuntimeException e) {
            log.warn("Circuit {} classifier failed for {}, treating as UNHANDLED", options.name(), operationId, e);
            return Classification.UNHANDLED;
        }
    }

    @Override
    public String toString() {
        return "ExecutionGate{" + options.name() + ", state=" + machine.currentState() + '}';
    }
}
