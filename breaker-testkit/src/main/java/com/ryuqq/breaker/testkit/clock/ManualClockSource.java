package com.ryuqq.breaker.testkit.clock;

import com.ryuqq.breaker.core.clock.ClockSource;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 수동 시계.
 *
 * <p>{@link #advance(Duration)}를 호출해야만 시간이 흐릅니다. 단조 시각과 벽시계 시각이 함께 전진하며,
 * 여러 스레드에서 동시에 읽어도 안전합니다.</p>
 *
 * <pre>{@code
 * ManualClockSource clock = new ManualClockSource();
 * CircuitBreaker breaker = ExecutionGate.create(options.withClock(clock));
 * clock.advance(Duration.ofSeconds(1));
 * }</pre>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
public final class ManualClockSource implements ClockSource {

    private static final Instant DEFAULT_ORIGIN = Instant.parse("2024-01-01T00:00:00Z");

    private final Instant origin;
    private final AtomicLong elapsedNanos = new AtomicLong();

    /**
     * 기본 기준 시각(2024-01-01T00:00:00Z)으로 생성.
     */
    public ManualClockSource() {
        this(DEFAULT_ORIGIN);
    }

    /**
     * 기준 시각을 지정해 생성.
     *
     * @param origin 경과 0일 때의 벽시계 시각
     * @throws IllegalArgumentException origin이 null인 경우
     */
    public ManualClockSource(Instant origin) {
        if (origin == null) {
            throw new IllegalArgumentException("origin cannot be null");
        }
        this.origin = origin;
    }

    /**
     * 시간 전진.
     *
     * @param amount 전진할 시간 (0 이상)
     * @throws IllegalArgumentException amount가 null이거나 음수인 경우
     */
    public void advance(Duration amount) {
        if (amount == null || amount.isNegative()) {
            throw new IllegalArgumentException("amount must be non-negative (current: " + amount + ")");
        }
        elapsedNanos.addAndGet(amount.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * 생성 이후 경과 시간.
     *
     * @return 경과 시간
     */
    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos.get());
    }

    @Override
    public long nanoTime() {
        return elapsedNanos.get();
    }

    @Override
    public Instant instant() {
        return origin.plusNanos(elapsedNanos.get());
    }
}
