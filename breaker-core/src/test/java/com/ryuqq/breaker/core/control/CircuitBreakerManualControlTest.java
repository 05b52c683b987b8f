package com.ryuqq.breaker.core.control;

import com.ryuqq.breaker.core.event.TransitionListener;
import com.ryuqq.breaker.core.model.OperationId;
import com.ryuqq.breaker.core.outcome.Outcome;
import com.ryuqq.breaker.core.protection.CircuitBreaker;
import com.ryuqq.breaker.core.protection.Subscription;
import com.ryuqq.breaker.core.protection.UnitOfWork;
import com.ryuqq.breaker.core.state.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * CircuitBreakerManualControl 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CircuitBreakerManualControl 테스트")
class CircuitBreakerManualControlTest {

    @Mock
    private CircuitBreaker first;

    @Mock
    private CircuitBreaker second;

    @Test
    @DisplayName("isolate/close는 연결된 모든 Circuit Breaker에 전달된다")
    void 연결된_모든_breaker에_전달() {
        // given
        CircuitBreakerManualControl control = new CircuitBreakerManualControl();
        control.attach(first);
        control.attach(second);

        // when
        control.isolate();
        control.close();

        // then
        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).isolate();
        inOrder.verify(second).isolate();
        inOrder.verify(first).close();
        inOrder.verify(second).close();
        assertThat(control.isIsolated()).isFalse();
    }

    @Test
    @DisplayName("격리 상태의 핸들에 연결하면 즉시 격리된다")
    void 격리_핸들_연결시_즉시_격리() {
        // given
        CircuitBreakerManualControl control = new CircuitBreakerManualControl(true);

        // when
        control.attach(first);

        // then
        verify(first).isolate();
        assertThat(control.isIsolated()).isTrue();
    }

    @Test
    @DisplayName("격리 후 연결된 Circuit Breaker도 격리된다")
    void 격리_후_연결() {
        // given
        CircuitBreakerManualControl control = new CircuitBreakerManualControl();
        control.attach(first);
        control.isolate();

        // when
        control.attach(second);

        // then
        verify(first).isolate();
        verify(second).isolate();
    }

    @Test
    @DisplayName("연결 전에는 isAttached가 false")
    void isAttached() {
        CircuitBreakerManualControl control = new CircuitBreakerManualControl();
        assertThat(control.isAttached()).isFalse();

        control.attach(first);

        assertThat(control.isAttached()).isTrue();
        verifyNoInteractions(first);
    }

    @Test
    @DisplayName("null 연결은 거부")
    void null_연결_거부() {
        assertThatThrownBy(() -> new CircuitBreakerManualControl().attach(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("동시 isolate/close/attach 이후 모든 Circuit Breaker가 핸들의 마지막 지시를 따른다")
    void 동시_호출_후_격리_상태_일치() throws Exception {
        // given
        CircuitBreakerManualControl control = new CircuitBreakerManualControl();
        List<FlagBreaker> attached = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            FlagBreaker breaker = new FlagBreaker();
            attached.add(breaker);
            control.attach(breaker);
        }
        int threads = 8;
        int rounds = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<FlagBreaker> lateAttached = Collections.synchronizedList(new ArrayList<>());

        // when
        for (int t = 0; t < threads; t++) {
            int worker = t;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int r = 0; r < rounds; r++) {
                        switch ((worker + r) % 3) {
                            case 0:
                                control.isolate();
                                break;
                            case 1:
                                control.close();
                                break;
                            default:
                                if (r % 50 == 0) {
                                    FlagBreaker breaker = new FlagBreaker();
                                    lateAttached.add(breaker);
                                    control.attach(breaker);
                                }
                                break;
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        boolean finished = done.await(30, TimeUnit.SECONDS);
        executor.shutdown();

        // then
        assertThat(finished).isTrue();
        attached.addAll(lateAttached);
        boolean expected = control.isIsolated();
        assertThat(attached).isNotEmpty()
            .allSatisfy(breaker -> assertThat(breaker.isolated).isEqualTo(expected));
    }

    /**
     * 마지막 isolate/close 지시만 기억하는 Circuit Breaker.
     */
    private static final class FlagBreaker implements CircuitBreaker {

        private volatile boolean isolated;

        @Override
        public <T> T execute(OperationId operationId, UnitOfWork<T> work) throws Exception {
            return work.run();
        }

        @Override
        public <T> Outcome<T> tryExecute(OperationId operationId, UnitOfWork<T> work) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void isolate() {
            Thread.yield();
            isolated = true;
        }

        @Override
        public void close() {
            Thread.yield();
            isolated = false;
        }

        @Override
        public CircuitState currentState() {
            return isolated ? CircuitState.ISOLATED : CircuitState.CLOSED;
        }

        @Override
        public Optional<Outcome<?>> lastOutcome() {
            return Optional.empty();
        }

        @Override
        public Subscription subscribe(TransitionListener listener) {
            return () -> { };
        }
    }
}
