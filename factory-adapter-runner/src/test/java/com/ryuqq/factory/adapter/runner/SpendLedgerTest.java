package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.testkit.clock.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * SpendLedger 테스트.
 *
 * @author Factory Team
 * @since 1.0.0
 */
class SpendLedgerTest {

    private MutableClock clock;
    private SpendLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-30T23:00:00Z"));
        ledger = new SpendLedger(clock);
    }

    @Test
    void record_같은_달에는_누적() {
        // when
        ledger.record(1.25);
        double total = ledger.record(0.75);

        // then
        assertThat(total).isCloseTo(2.0, within(1e-9));
        assertThat(ledger.monthlySpend()).isCloseTo(2.0, within(1e-9));
        assertThat(ledger.currentPeriod()).isEqualTo(YearMonth.of(2026, 3));
    }

    @Test
    void monthlySpend_달이_바뀌면_0으로_초기화() {
        // given
        ledger.record(3.0);

        // when
        clock.setInstant(Instant.parse("2026-04-01T00:00:01Z"));

        // then
        assertThat(ledger.monthlySpend()).isZero();
        assertThat(ledger.currentPeriod()).isEqualTo(YearMonth.of(2026, 4));
    }

    @Test
    void isCapReached_상한_이상이면_true() {
        // given
        ledger.record(5.0);

        // when & then
        assertThat(ledger.isCapReached(5.0)).isTrue();
        assertThat(ledger.isCapReached(5.01)).isFalse();
    }

    @Test
    void record_음수면_예외() {
        assertThatThrownBy(() -> ledger.record(-0.01))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("negative");
    }
}
