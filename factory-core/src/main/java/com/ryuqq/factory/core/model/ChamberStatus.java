package com.ryuqq.factory.core.model;

/**
 * Chamber 상태와 상태별 폴링 주기.
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum ChamberStatus {

    /** 적극 감독 중 (30초 폴링). */
    ACTIVE(30_000),

    /** 느슨한 관찰 (5분 폴링). */
    WATCHING(300_000),

    /** 폴링 중지. */
    PAUSED(0),

    /** 종료 표시 (삭제되지 않음). */
    COMPLETED(0);

    private final long pollIntervalMs;

    ChamberStatus(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * 이 상태의 폴링 주기.
     *
     * @return 밀리초, 폴링하지 않으면 0
     */
    public long pollIntervalMs() {
        return pollIntervalMs;
    }
}
