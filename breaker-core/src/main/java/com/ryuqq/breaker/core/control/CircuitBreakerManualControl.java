package com.ryuqq.breaker.core.control;

import com.ryuqq.breaker.core.protection.CircuitBreaker;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 하나 이상의 Circuit Breaker를 외부에서 격리/복구하는 핸들.
 *
 * <p>사용자가 생성해 {@link com.ryuqq.breaker.core.config.CircuitBreakerOptions#manualControl()}으로 전달하면,
 * Circuit Breaker가 생성될 때 스스로 {@link #attach(CircuitBreaker)}를 호출합니다.
 * 같은 핸들을 여러 Circuit Breaker가 공유할 수 있으며 {@link #isolate()} / {@link #close()}는
 * 연결된 모든 Circuit Breaker에 전파됩니다.</p>
 *
 * <p>이미 격리 상태인 핸들에 연결되는 Circuit Breaker는 연결 즉시 ISOLATED가 됩니다.</p>
 *
 * <p><strong>동시성:</strong> 플래그 변경과 전파는 fan-out 잠금 아래에서 하나씩 직렬화됩니다.
 * 따라서 동시에 호출된 attach / isolate / close가 끝나면 연결된 모든 Circuit Breaker는
 * {@link #isIsolated()}와 같은 격리 상태에 있습니다. 잠금은 재진입 가능하므로 같은 스레드의
 * 전이 리스너에서 이 핸들을 다시 호출할 수 있습니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerManualControl {

    private final ReentrantLock fanOutLock = new ReentrantLock();
    private final List<CircuitBreaker> breakers = new CopyOnWriteArrayList<>();
    private volatile boolean isolated;

    /**
     * 격리되지 않은 핸들 생성.
     */
    public CircuitBreakerManualControl() {
        this(false);
    }

    /**
     * 초기 격리 여부를 지정해 생성.
     *
     * @param isolated true이면 연결되는 Circuit Breaker가 ISOLATED로 시작
     */
    public CircuitBreakerManualControl(boolean isolated) {
        this.isolated = isolated;
    }

    /**
     * Circuit Breaker 연결. Circuit Breaker 구현체가 생성 시 호출합니다.
     *
     * @param breaker 연결할 Circuit Breaker
     * @throws IllegalArgumentException breaker가 null인 경우
     */
    public void attach(CircuitBreaker breaker) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        fanOutLock.lock();
        try {
            breakers.add(breaker);
            if (isolated) {
                breaker.isolate();
            }
        } finally {
            fanOutLock.unlock();
        }
    }

    /**
     * 연결된 모든 Circuit Breaker를 격리합니다.
     */
    public void isolate() {
        fanOutLock.lock();
        try {
            isolated = true;
            for (CircuitBreaker breaker : breakers) {
                breaker.isolate();
            }
        } finally {
            fanOutLock.unlock();
        }
    }

    /**
     * 연결된 모든 Circuit Breaker의 격리를 해제하고 CLOSED로 되돌립니다.
     */
    public void close() {
        fanOutLock.lock();
        try {
            isolated = false;
            for (CircuitBreaker breaker : breakers) {
                breaker.close();
            }
        } finally {
            fanOutLock.unlock();
        }
    }

    /**
     * 하나 이상의 Circuit Breaker가 연결되어 있는지 확인.
     *
     * @return 연결 여부
     */
    public boolean isAttached() {
        return !breakers.isEmpty();
    }

    /**
     * 핸들의 마지막 지시가 격리인지 확인.
     *
     * @return 격리 지시 상태
     */
    public boolean isIsolated() {
        return isolated;
    }
}
