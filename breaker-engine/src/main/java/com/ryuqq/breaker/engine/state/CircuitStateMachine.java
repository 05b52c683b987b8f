package com.ryuqq.breaker.engine.state;

import com.ryuqq.breaker.core.clock.ClockSource;
import com.ryuqq.breaker.core.config.BreakDurationArguments;
import com.ryuqq.breaker.core.config.CircuitBreakerOptions;
import com.ryuqq.breaker.core.event.CircuitEventType;
import com.ryuqq.breaker.core.event.CircuitTransitionEvent;
import com.ryuqq.breaker.core.model.OperationId;
import com.ryuqq.breaker.core.model.WindowSnapshot;
import com.ryuqq.breaker.core.outcome.Classification;
import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.protection.BrokenCircuitException;
import com.ryuqq.breaker.core.protection.IsolatedCircuitException;
import com.ryuqq.breaker.core.protection.PolicyEvaluationException;
import com.ryuqq.breaker.core.state.CircuitState;
import com.ryuqq.breaker.core.state.StateTransition;
import com.ryuqq.breaker.engine.policy.BreakDurationPolicy;
import com.ryuqq.breaker.engine.window.SlidingWindowCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Circuit 상태 머신.
 *
 * <p>상태, 샘플링 윈도우, BreakDeadline, 수동 제어 플래그, 프로브 슬롯, 세대를 하나의 가변 단위로 소유하고
 * 단일 {@link ReentrantLock}으로 보호합니다. 잠금 구간은 입장 판단과 결과 기록으로 한정되며,
 * 작업·분류기·리스너는 잠금 밖에서 실행됩니다.</p>
 *
 * <p><strong>입장 알고리즘 ({@link #acquire}):</strong></p>
 * <pre>
 * 1. 수동 격리 중 → IsolatedCircuitException
 * 2. CLOSED → 허가
 * 3. OPEN:
 *    now &lt; deadline → BrokenCircuitException(retryAfter = deadline - now)
 *    now ≥ deadline → HALF_OPEN 전이 + 프로브 허가
 * 4. HALF_OPEN:
 *    프로브 슬롯 비어 있음 → 점유 + 프로브 허가
 *    점유 중 → BrokenCircuitException(retryAfter 없음)
 * </pre>
 *
 * <p><strong>완료 알고리즘 ({@link #onCompletion}):</strong></p>
 * <pre>
 * 1. 현재 프로브의 허가라면 결과와 관계없이 슬롯 해제
 * 2. UNHANDLED → 종료 (카운터·상태 변화 없음)
 * 3. 격리 중이거나 허가 이후 전이가 있었음 → 종료 (이전 구간의 결과)
 * 4. CLOSED → 윈도우에 기록, 최소 처리량 충족 + 실패율 초과 시 OPEN
 * 5. HALF_OPEN 프로브 → 성공이면 CLOSED(윈도우 초기화), 실패면 OPEN(deadline 재계산)
 * </pre>
 *
 * <p>모든 전이는 세대를 1 증가시키고, 정확히 하나의 이벤트를 {@link TransitionNotifier}에 넣습니다.
 * 이벤트는 잠금 해제 후 호출자 스레드에서 전달됩니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class CircuitStateMachine {

    private static final Logger log = LoggerFactory.getLogger(CircuitStateMachine.class);

    /**
     * BreakDeadline 계산 시 오버플로를 피하기 위한 상한 (약 73년).
     */
    private static final long MAX_BREAK_NANOS = Long.MAX_VALUE / 4;

    private final String name;
    private final double failureRatio;
    private final int minimumThroughput;
    private final ClockSource clock;
    private final SlidingWindowCounter counter;
    private final BreakDurationPolicy policy;
    private final TransitionNotifier notifier;

    private final ReentrantLock lock = new ReentrantLock();
    private final ManualOverride override = new ManualOverride();

    // 아래 필드는 lock 아래에서만 변경
    private volatile CircuitState state = CircuitState.CLOSED;
    private volatile Outcome<?> lastOutcome;
    private long breakDeadlineNanos;
    private boolean probeInFlight;
    private long generation;
    private int consecutiveOpenCount;
    private boolean dispatchRequired;

    /**
     * 설정으로 생성.
     *
     * @param options Circuit Breaker 설정
     * @param notifier 전이 이벤트 전달자
     * @throws IllegalArgumentException options 또는 notifier가 null인 경우
     */
    public CircuitStateMachine(CircuitBreakerOptions options, TransitionNotifier notifier) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        this.name = options.name();
        this.failureRatio = options.failureRatio();
        this.minimumThroughput = options.minimumThroughput();
        this.clock = options.clock();
        this.counter = new SlidingWindowCounter(options.samplingDuration());
        this.notifier = notifier;
        this.policy = BreakDurationPolicy.from(options, this::reportPolicyFailure);
    }

    /**
     * 입장 판단. 입장 판단과 프로브 슬롯 점유는 하나의 원자적 구간입니다.
     *
     * @param operationId 호출 식별자
     * @return 입장 허가
     * @throws IsolatedCircuitException 수동 격리 중인 경우
     * @throws BrokenCircuitException OPEN이거나 프로브가 이미 진행 중인 경우
     */
    public Permit acquire(OperationId operationId) {
        lock.lock();
        try {
            if (override.isIsolated()) {
                throw new IsolatedCircuitException("Circuit '" + name + "' is isolated");
            }

            long now = clock.nanoTime();
            switch (state) {
                case CLOSED -> {
                    return new Permit(operationId, false, generation);
                }
                case OPEN -> {
                    long remaining = breakDeadlineNanos - now;
                    if (remaining > 0) {
                        throw new BrokenCircuitException(
                            "Circuit '" + name + "' is open", CircuitState.OPEN, Duration.ofNanos(remaining));
                    }
                    transitionTo(CircuitState.HALF_OPEN, operationId, null, false, null, counter.snapshot(now));
                    probeInFlight = true;
                    return new Permit(operationId, true, generation);
                }
                case HALF_OPEN -> {
                    if (probeInFlight) {
                        throw new BrokenCircuitException(
                            "Circuit '" + name + "' is half-open and a probe is in flight", CircuitState.HALF_OPEN, null);
                    }
                    probeInFlight = true;
                    return new Permit(operationId, true, generation);
                }
                default -> throw new IsolatedCircuitException("Circuit '" + name + "' is isolated");
            }
        } finally {
            unlockAndDispatch();
        }
    }

    /**
     * 작업 완료 후 결과 반영.
     *
     * @param permit {@link #acquire}가 발급한 허가
     * @param outcome 작업 결과 (Ok 또는 Fail)
     * @param classification 분류 결과
     */
    public void onCompletion(Permit permit, Outcome<?> outcome, Classification classification) {
        lock.lock();
        try {
            boolean currentProbe = permit.probe()
                && permit.generation() == generation
                && state == CircuitState.HALF_OPEN;
            if (currentProbe) {
                probeInFlight = false;
            }

            if (classification == Classification.UNHANDLED) {
                return;
            }
            if (override.isIsolated() || permit.generation() != generation) {
                log.debug("Circuit {} ignored stale outcome of {} (permit generation: {}, current: {})",
                    name, permit.operationId(), permit.generation(), generation);
                return;
            }

            long now = clock.nanoTime();
            boolean success = classification == Classification.SUCCESS;
            switch (state) {
                case CLOSED -> {
                    lastOutcome = outcome;
                    counter.record(success, now);
                    WindowSnapshot snapshot = counter.snapshot(now);
                    if (shouldBreak(snapshot)) {
                        openCircuit(permit.operationId(), outcome, snapshot, now);
                    }
                }
                case HALF_OPEN -> {
                    if (!currentProbe) {
                        return;
                    }
                    lastOutcome = outcome;
                    if (success) {
                        closeCircuit(permit.operationId(), outcome, false, now);
                    } else {
                        openCircuit(permit.operationId(), outcome, counter.snapshot(now), now);
                    }
                }
                default -> {
                    // OPEN, ISOLATED: 이전 구간의 결과
                }
            }
        } finally {
            unlockAndDispatch();
        }
    }

    /**
     * 수동 격리. 이미 격리 중이면 이벤트 없이 반환합니다.
     *
     * @param operationId 전이 이벤트에 기록할 식별자
     */
    public void isolate(OperationId operationId) {
        lock.lock();
        try {
            if (!override.isolate()) {
                return;
            }
            long now = clock.nanoTime();
            probeInFlight = false;
            transitionTo(CircuitState.ISOLATED, operationId, null, true, null, counter.snapshot(now));
        } finally {
            unlockAndDispatch();
        }
    }

    /**
     * 수동 복구. 격리를 해제하고 CLOSED로 강제 전환하며 윈도우를 초기화합니다.
     * 이미 CLOSED여도 윈도우와 연속 OPEN 횟수는 초기화하며, 이벤트만 생략합니다.
     *
     * @param operationId 전이 이벤트에 기록할 식별자
     */
    public void close(OperationId operationId) {
        lock.lock();
        try {
            override.requestClose();
            if (state != CircuitState.CLOSED) {
                closeCircuit(operationId, null, true, clock.nanoTime());
            } else {
                counter.reset();
                consecutiveOpenCount = 0;
                log.info("Circuit {} reset by manual close (already CLOSED)", name);
            }
            override.closeApplied();
        } finally {
            unlockAndDispatch();
        }
    }

    /**
     * 현재 상태. 잠금 없이 읽습니다.
     *
     * @return 현재 상태
     */
    public CircuitState currentState() {
        return state;
    }

    /**
     * 마지막으로 SUCCESS/FAILURE로 분류된 결과.
     *
     * @return 마지막 결과
     */
    public Optional<Outcome<?>> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    /**
     * 현재 윈도우 집계.
     *
     * @return 스냅샷
     */
    public WindowSnapshot snapshot() {
        lock.lock();
        try {
            return counter.snapshot(clock.nanoTime());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Circuit Breaker 이름.
     *
     * @return 설정의 name
     */
    public String name() {
        return name;
    }

    private boolean shouldBreak(WindowSnapshot snapshot) {
        return snapshot.total() >= minimumThroughput && snapshot.failureRatio() > failureRatio;
    }

    private void openCircuit(OperationId operationId, Outcome<?> outcome, WindowSnapshot snapshot, long now) {
        consecutiveOpenCount = state == CircuitState.HALF_OPEN ? consecutiveOpenCount + 1 : 1;
        BreakDurationArguments arguments =
            new BreakDurationArguments(snapshot.failures(), snapshot.total(), consecutiveOpenCount);
        Duration breakDuration = policy.breakDuration(arguments);

        breakDeadlineNanos = now + Math.min(toNanosSaturated(breakDuration), MAX_BREAK_NANOS);
        transitionTo(CircuitState.OPEN, operationId, outcome, false, breakDuration, snapshot);
    }

    private void closeCircuit(OperationId operationId, Outcome<?> outcome, boolean manual, long now) {
        WindowSnapshot snapshot = counter.snapshot(now);
        counter.reset();
        consecutiveOpenCount = 0;
        probeInFlight = false;
        transitionTo(CircuitState.CLOSED, operationId, outcome, manual, null, snapshot);
    }

    private void transitionTo(
        CircuitState to,
        OperationId operationId,
        Outcome<?> outcome,
        boolean manual,
        Duration breakDuration,
        WindowSnapshot snapshot
    ) {
        CircuitState from = state;
        state = StateTransition.transition(from, to, manual);
        generation++;

        CircuitEventType type = CircuitEventType.forTarget(to);
        switch (type) {
            case CIRCUIT_OPENED -> log.info("Circuit {} opened: {} → {} (failures: {}/{}, breakDuration: {}, manual: {})",
                name, from, to, snapshot.failures(), snapshot.total(), breakDuration, manual);
            case CIRCUIT_HALF_OPENED -> log.warn("Circuit {} half-opened: {} → {}, probing with {}",
                name, from, to, operationId);
            case CIRCUIT_CLOSED -> log.info("Circuit {} closed: {} → {} (manual: {})", name, from, to, manual);
        }

        notifier.enqueue(new CircuitTransitionEvent(
            type,
            name,
            from,
            to,
            snapshot,
            clock.instant(),
            operationId,
            type == CircuitEventType.CIRCUIT_HALF_OPENED ? null : outcome,
            manual,
            breakDuration
        ));
        dispatchRequired = true;
    }

    private void reportPolicyFailure(PolicyEvaluationException failure) {
        notifier.enqueue(failure);
        dispatchRequired = true;
    }

    private void unlockAndDispatch() {
        boolean dispatch = dispatchRequired;
        dispatchRequired = false;
        lock.unlock();
        if (dispatch) {
            notifier.dispatchPending();
        }
    }

    private static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
