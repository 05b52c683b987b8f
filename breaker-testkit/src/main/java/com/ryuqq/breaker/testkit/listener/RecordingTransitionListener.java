package com.ryuqq.breaker.testkit.listener;

import com.ryuqq.breaker.core.event.CircuitEventType;
import com.ryuqq.breaker.core.event.CircuitTransitionEvent;
import com.ryuqq.breaker.core.event.TransitionListener;
import com.ryuqq.breaker.core.protection.PolicyEvaluationException;
import com.ryuqq.breaker.core.state.CircuitState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 받은 이벤트를 순서대로 기록하는 리스너.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class RecordingTransitionListener implements TransitionListener {

    private final List<CircuitTransitionEvent> events = new CopyOnWriteArrayList<>();
    private final List<PolicyEvaluationException> policyFailures = new CopyOnWriteArrayList<>();

    @Override
    public void onTransition(CircuitTransitionEvent event) {
        events.add(event);
    }

    @Override
    public void onPolicyEvaluationFailure(PolicyEvaluationException failure) {
        policyFailures.add(failure);
    }

    public List<CircuitTransitionEvent> events() {
        return List.copyOf(events);
    }

    public List<PolicyEvaluationException> policyFailures() {
        return List.copyOf(policyFailures);
    }

    /**
     * 기록된 이벤트 종류 목록.
     *
     * @return 수신 순서대로의 이벤트 종류
     */
    public List<CircuitEventType> types() {
        return events.stream().map(CircuitTransitionEvent::type).collect(Collectors.toList());
    }

    /**
     * 기록된 목적지 상태 목록.
     *
     * @return 수신 순서대로의 toState
     */
    public List<CircuitState> targetStates() {
        return events.stream().map(CircuitTransitionEvent::toState).collect(Collectors.toList());
    }

    public long count(CircuitEventType type) {
        return events.stream().filter(event -> event.type() == type).count();
    }

    public CircuitTransitionEvent last() {
        if (events.isEmpty()) {
            throw new IllegalStateException("no events recorded");
        }
        return events.get(events.size() - 1);
    }

    public void clear() {
        events.clear();
        policyFailures.clear();
    }
}
