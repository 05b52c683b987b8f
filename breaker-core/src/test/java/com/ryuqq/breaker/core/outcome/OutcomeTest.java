package com.ryuqq.breaker.core.outcome;

import com.ryuqq.breaker.core.protection.BrokenCircuitException;
import com.ryuqq.breaker.core.protection.IsolatedCircuitException;
import com.ryuqq.breaker.core.state.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome sealed interface 테스트.
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("Outcome 테스트")
class OutcomeTest {

    @Test
    @DisplayName("Ok는 값을 그대로 반환한다")
    void ok_값_반환() throws Exception {
        // given
        Outcome<String> outcome = Ok.of("payment-accepted");

        // when & then
        assertTrue(outcome.isOk());
        assertTrue(outcome.wasExecuted());
        assertFalse(outcome.isFail());
        assertEquals("payment-accepted", outcome.getOrThrow());
        assertTrue(outcome.failure().isEmpty());
    }

    @Test
    @DisplayName("Ok는 null 값을 허용한다")
    void ok_null_허용() throws Exception {
        Outcome<Void> outcome = Ok.of(null);

        assertTrue(outcome.isOk());
        assertNull(outcome.getOrThrow());
    }

    @Test
    @DisplayName("Fail은 원본 checked 예외를 그대로 다시 던진다")
    void fail_checked_예외_재전파() {
        // given
        IOException cause = new IOException("connection reset");
        Outcome<String> outcome = Fail.of(cause);

        // when
        IOException thrown = assertThrows(IOException.class, outcome::getOrThrow);

        // then
        assertSame(cause, thrown);
        assertTrue(outcome.isFail());
        assertTrue(outcome.wasExecuted());
        assertSame(cause, outcome.failure().orElseThrow());
    }

    @Test
    @DisplayName("Fail은 Error도 그대로 다시 던진다")
    void fail_Error_재전파() {
        AssertionError cause = new AssertionError("boom");
        Outcome<String> outcome = Fail.of(cause);

        AssertionError thrown = assertThrows(AssertionError.class, outcome::getOrThrow);
        assertSame(cause, thrown);
    }

    @Test
    @DisplayName("Fail은 null cause를 거부한다")
    void fail_null_거부() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(null));
    }

    @Test
    @DisplayName("Rejected는 실행되지 않았고 차단 예외를 던진다")
    void rejected_차단_예외() {
        // given
        BrokenCircuitException rejection =
            new BrokenCircuitException("open", CircuitState.OPEN, Duration.ofMillis(300));
        Outcome<String> outcome = new Rejected<>(rejection);

        // when & then
        assertTrue(outcome.isRejected());
        assertFalse(outcome.wasExecuted());
        BrokenCircuitException thrown = assertThrows(BrokenCircuitException.class, outcome::getOrThrow);
        assertSame(rejection, thrown);
        assertEquals(Duration.ofMillis(300), thrown.getRetryAfter().orElseThrow());
    }

    @Test
    @DisplayName("격리 예외는 재시도 힌트가 없고 ISOLATED 상태를 가진다")
    void isolated_예외_상태() {
        IsolatedCircuitException rejection = new IsolatedCircuitException("isolated");

        Outcome<String> outcome = new Rejected<>(rejection);

        assertEquals(CircuitState.ISOLATED, rejection.getCircuitState());
        assertSame(rejection, outcome.failure().orElseThrow());
    }

    @Test
    @DisplayName("음수 retryAfter는 거부한다")
    void 음수_retryAfter_거부() {
        assertThrows(IllegalArgumentException.class,
            () -> new BrokenCircuitException("open", CircuitState.OPEN, Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("패턴 매칭으로 세 가지 결과를 구분한다")
    void 패턴_매칭_구분() {
        Outcome<Integer> outcome = Fail.of(new IllegalStateException("x"));

        String description;
        if (outcome instanceof Ok<Integer> ok) {
            description = "ok:" + ok.value();
        } else if (outcome instanceof Fail<Integer> fail) {
            description = "fail:" + fail.cause().getMessage();
        } else {
            description = "rejected";
        }

        assertEquals("fail:x", description);
    }
}
