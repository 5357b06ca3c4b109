package com.ryuqq.factory.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.YearMonth;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 월간 지출 원장.
 *
 * <p>Run 완료 시점에만 기록되며, 모든 읽기/쓰기는 하나의 락으로 직렬화됩니다.
 * 컨트롤러 Clock 기준으로 달이 바뀌면 누적액이 0으로 초기화됩니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class SpendLedger {

    private static final Logger log = LoggerFactory.getLogger(SpendLedger.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private YearMonth period;
    private double monthlySpendUsd;

    public SpendLedger(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.period = YearMonth.now(clock);
    }

    /**
     * 완료된 Run의 비용 기록.
     *
     * @param usd 지출액 (0 이상)
     * @return 기록 후 이번 달 누적액
     */
    public double record(double usd) {
        if (usd < 0) {
            throw new IllegalArgumentException("usd cannot be negative (current: " + usd + ")");
        }
        lock.lock();
        try {
            rollOverIfNeeded();
            monthlySpendUsd += usd;
            return monthlySpendUsd;
        } finally {
            lock.unlock();
        }
    }

    public double monthlySpend() {
        lock.lock();
        try {
            rollOverIfNeeded();
            return monthlySpendUsd;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCapReached(double capUsd) {
        return monthlySpend() >= capUsd;
    }

    public YearMonth currentPeriod() {
        lock.lock();
        try {
            rollOverIfNeeded();
            return period;
        } finally {
            lock.unlock();
        }
    }

    private void rollOverIfNeeded() {
        YearMonth now = YearMonth.now(clock);
        if (!now.equals(period)) {
            log.info("Spend period rolled over {} -> {} (closing spend ${})", period, now, monthlySpendUsd);
            period = now;
            monthlySpendUsd = 0.0;
        }
    }
}
