package com.ryuqq.breaker.core.event;

import com.ryuqq.breaker.core.state.CircuitState;

/**
 * 전이 이벤트 종류와 심각도.
 *
 * <ul>
 *   <li>CIRCUIT_CLOSED: INFO</li>
 *   <li>CIRCUIT_OPENED: ERROR (수동 격리 포함)</li>
 *   <li>CIRCUIT_HALF_OPENED: WARNING</li>
 * </ul>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public enum CircuitEventType {

    CIRCUIT_CLOSED("OnCircuitClosed", Severity.INFO),
    CIRCUIT_OPENED("OnCircuitOpened", Severity.ERROR),
    CIRCUIT_HALF_OPENED("OnCircuitHalfOpened", Severity.WARNING);

    private final String eventName;
    private final Severity severity;

    CircuitEventType(String eventName, Severity severity) {
        this.eventName = eventName;
        this.severity = severity;
    }

    /**
     * 텔레메트리에 기록되는 이벤트 이름.
     *
     * @return 이벤트 이름
     */
    public String eventName() {
        return eventName;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * 전이 목적지 상태에 해당하는 이벤트 종류.
     *
     * <p>ISOLATED 진입은 CIRCUIT_OPENED로 보고됩니다.</p>
     *
     * @param toState 목적지 상태
     * @return 이벤트 종류
     */
    public static CircuitEventType forTarget(CircuitState toState) {
        return switch (toState) {
            case CLOSED -> CIRCUIT_CLOSED;
            case OPEN, ISOLATED -> CIRCUIT_OPENED;
            case HALF_OPEN -> CIRCUIT_HALF_OPENED;
        };
    }
}
