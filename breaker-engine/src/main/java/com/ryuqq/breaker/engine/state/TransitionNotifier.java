package com.ryuqq.breaker.engine.state;

import com.ryuqq.breaker.core.event.CircuitEventType;
import com.ryuqq.breaker.core.event.CircuitTransitionEvent;
import com.ryuqq.breaker.core.event.TransitionListener;
import com.ryuqq.breaker.core.protection.PolicyEvaluationException;
import com.ryuqq.breaker.core.protection.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 전이 이벤트 전달자.
 *
 * <p><strong>전달 흐름:</strong></p>
 * <pre>
 * 1. 상태 머신이 잠금 안에서 enqueue() → 전이 순서대로 대기열에 쌓임
 * 2. 상태 머신 잠금 해제
 * 3. 같은 호출자 스레드가 dispatchPending() → dispatch 잠금 아래에서 대기열을 비움
 * 4. 호출자에게 제어 반환
 * </pre>
 *
 * <p>대기열은 상태 잠금 아래에서만 채워지고 dispatch 잠금 아래에서만 비워지므로
 * 리스너는 전이가 일어난 순서 그대로 이벤트를 받습니다. dispatch 잠금을 얻은 시점에는
 * 앞선 전달자가 이미 대기열을 다 비운 뒤이므로, 호출자는 자신이 만든 이벤트가 전달된 뒤에 반환됩니다.</p>
 *
 * <p>리스너 예외는 ERROR 로그로만 남기고 다음 리스너로 진행합니다 (Circuit 상태에 영향 없음).</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class TransitionNotifier {

    private static final Logger log = LoggerFactory.getLogger(TransitionNotifier.class);

    private final String circuitName;
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final Queue<Consumer<TransitionListener>> pending = new ConcurrentLinkedQueue<>();
    private final ReentrantLock dispatchLock = new ReentrantLock();

    /**
     * 생성자.
     *
     * @param circuitName 로그용 Circuit Breaker 이름
     */
    public TransitionNotifier(String circuitName) {
        this.circuitName = circuitName;
    }

    /**
     * 리스너 등록.
     *
     * @param listener 리스너
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Subscription subscribe(TransitionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * 특정 이벤트 종류만 받는 콜백 등록 (설정의 onOpened/onClosed/onHalfOpened).
     *
     * @param type 이벤트 종류
     * @param callback 콜백 (null이면 무시)
     */
    public void subscribe(CircuitEventType type, Consumer<CircuitTransitionEvent> callback) {
        if (callback == null) {
            return;
        }
        subscribe(event -> {
            if (event.type() == type) {
                callback.accept(event);
            }
        });
    }

    /**
     * 등록된 리스너 수 (설정 콜백 포함).
     *
     * @return 리스너 수
     */
    public int listenerCount() {
        return listeners.size();
    }

    /**
     * 전이 이벤트를 대기열에 추가. 상태 머신 잠금 안에서 호출합니다.
     *
     * @param event 전이 이벤트
     */
    void enqueue(CircuitTransitionEvent event) {
        pending.add(listener -> listener.onTransition(event));
    }

    /**
     * 정책 평가 실패를 대기열에 추가. 상태 머신 잠금 안에서 호출될 수 있습니다.
     *
     * @param failure 정책 평가 실패
     */
    void enqueue(PolicyEvaluationException failure) {
        pending.add(listener -> listener.onPolicyEvaluationFailure(failure));
    }

    /**
     * 대기 중인 통지를 모두 전달. 상태 머신 잠금 밖에서, 통지를 추가한 호출자만 호출합니다.
     */
    void dispatchPending() {
        dispatchLock.lock();
        try {
            Consumer<TransitionListener> notification;
            while ((notification = pending.poll()) != null) {
                deliver(notification);
            }
        } finally {
            dispatchLock.unlock();
        }
    }

    private void deliver(Consumer<TransitionListener> notification) {
        for (TransitionListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("Transition listener {} failed for circuit {}", listener, circuitName, e);
            }
        }
    }
}
