package com.ryuqq.breaker.engine.window;

import com.ryuqq.breaker.core.model.WindowSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SlidingWindowCounter 테스트.
 *
 * <p>샘플링 2초, 버킷 10개(버킷 폭 200ms) 기준입니다.</p>
 *
 * @author Breaker Team
 * @since 1.0.0
 */
@DisplayName("SlidingWindowCounter 테스트")
class SlidingWindowCounterTest {

    private static final long MILLIS = 1_000_000L;

    private SlidingWindowCounter counter;

    @BeforeEach
    void setUp() {
        counter = new SlidingWindowCounter(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("성공과 실패를 집계한다")
    void 성공_실패_집계() {
        // given
        counter.record(true, 0);
        counter.record(false, 10 * MILLIS);
        counter.record(false, 450 * MILLIS);

        // when
        WindowSnapshot snapshot = counter.snapshot(500 * MILLIS);

        // then
        assertThat(snapshot.total()).isEqualTo(3);
        assertThat(snapshot.failures()).isEqualTo(2);
    }

    @Test
    @DisplayName("샘플링 구간 안의 샘플은 유지된다")
    void 구간_안_샘플_유지() {
        counter.record(false, 0);

        assertThat(counter.snapshot(1_999 * MILLIS).total()).isEqualTo(1);
    }

    @Test
    @DisplayName("샘플링 구간이 지나면 샘플이 제거된다")
    void 구간_경과_샘플_제거() {
        // given
        counter.record(false, 0);
        counter.record(true, 1_000 * MILLIS);

        // when
        WindowSnapshot afterFirstExpired = counter.snapshot(2_000 * MILLIS);
        WindowSnapshot afterAllExpired = counter.snapshot(3_000 * MILLIS);

        // then
        assertThat(afterFirstExpired).isEqualTo(new WindowSnapshot(1, 0));
        assertThat(afterAllExpired).isEqualTo(WindowSnapshot.EMPTY);
    }

    @Test
    @DisplayName("오래 사용하지 않은 뒤 같은 슬롯을 재사용해도 이전 값이 섞이지 않는다")
    void 슬롯_재사용() {
        // given
        counter.record(false, 100 * MILLIS);

        // when: 정확히 한 바퀴(2초) 뒤 같은 슬롯에 기록
        counter.record(true, 2_100 * MILLIS);

        // then
        assertThat(counter.snapshot(2_100 * MILLIS)).isEqualTo(new WindowSnapshot(1, 0));
    }

    @Test
    @DisplayName("호출량이 많아도 버킷 수는 고정이다")
    void 버킷_수_고정() {
        for (int i = 0; i < 10_000; i++) {
            counter.record(i % 4 != 0, i * MILLIS / 10);
        }

        WindowSnapshot snapshot = counter.snapshot(1_000 * MILLIS);

        assertThat(counter.bucketCount()).isEqualTo(10);
        assertThat(snapshot.total()).isEqualTo(10_000);
        assertThat(snapshot.failures()).isEqualTo(2_500);
    }

    @Test
    @DisplayName("reset은 모든 버킷을 비운다")
    void reset_전체_초기화() {
        counter.record(false, 0);
        counter.record(false, 300 * MILLIS);

        counter.reset();

        assertThat(counter.snapshot(400 * MILLIS)).isEqualTo(WindowSnapshot.EMPTY);
    }

    @Test
    @DisplayName("음수 단조 시각에서도 동작한다")
    void 음수_시각() {
        counter.record(false, -150 * MILLIS);
        counter.record(true, 10 * MILLIS);

        assertThat(counter.snapshot(20 * MILLIS)).isEqualTo(new WindowSnapshot(2, 1));
    }

    @Test
    @DisplayName("샘플링 구간보다 많은 버킷은 나노초 단위로 줄어든다")
    void 버킷_수_상한() {
        SlidingWindowCounter tiny = new SlidingWindowCounter(Duration.ofNanos(3), 10);

        assertThat(tiny.bucketCount()).isEqualTo(3);
        assertThat(tiny.samplingDuration()).isEqualTo(Duration.ofNanos(3));
    }

    @Test
    @DisplayName("잘못된 설정은 거부한다")
    void 잘못된_설정_거부() {
        assertThatThrownBy(() -> new SlidingWindowCounter(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("samplingDuration must be positive");
        assertThatThrownBy(() -> new SlidingWindowCounter(Duration.ofSeconds(1), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bucketCount must be positive");
    }
}
