package com.ryuqq.factory.core.model;

/**
 * Event 우선순위.
 *
 * <p>우선순위는 Manifest 생성 시 승인 필요 여부 판단에만 영향을 주며,
 * 대기열 내 순서는 바꾸지 않습니다 (대기열은 항상 FIFO).</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public boolean isCritical() {
        return this == CRITICAL;
    }
}
