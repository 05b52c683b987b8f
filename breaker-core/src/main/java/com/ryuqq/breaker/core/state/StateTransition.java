package com.ryuqq.breaker.core.state;

/**
 * Circuit 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (실패율 초과)</li>
 *   <li>OPEN → HALF_OPEN (BreakDeadline 경과)</li>
 *   <li>HALF_OPEN → CLOSED (프로브 성공)</li>
 *   <li>HALF_OPEN → OPEN (프로브 실패)</li>
 *   <li>CLOSED/OPEN/HALF_OPEN → ISOLATED (수동 격리)</li>
 *   <li>OPEN/HALF_OPEN/ISOLATED → CLOSED (수동 복구)</li>
 * </ul>
 *
 * <p>동일 상태로의 전이는 전이가 아니므로 허용되지 않습니다.
 * 호출 측은 상태가 실제로 바뀔 때만 이 검증을 거쳐야 합니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @param manual 수동 제어(isolate/close)에 의한 전이인지 여부
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitState from, CircuitState to, boolean manual) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to, manual)) {
            throw new IllegalStateException(
                String.format("Invalid circuit transition: %s → %s (manual: %s)", from, to, manual)
            );
        }
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @param manual 수동 제어 여부
     * @return next
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitState transition(CircuitState current, CircuitState next, boolean manual) {
        validate(current, next, manual);
        return next;
    }

    private static boolean isAllowed(CircuitState from, CircuitState to, boolean manual) {
        if (from == to) {
            return false;
        }
        if (manual) {
            return to == CircuitState.ISOLATED || to == CircuitState.CLOSED;
        }
        return switch (from) {
            case CLOSED -> to == CircuitState.OPEN;
            case OPEN -> to == CircuitState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitState.CLOSED || to == CircuitState.OPEN;
            case ISOLATED -> false; // 격리 해제는 수동으로만
        };
    }
}
