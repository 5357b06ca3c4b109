package com.ryuqq.factory.core.model;

/**
 * 헬스 이상 감지 시 복구 방식.
 *
 * <p>Controller는 이 값을 정책의 일부로 보관하고 보고만 하며, 복구 자체는 외부 협력자 책임입니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum HealthRemediationMode {
    RESTART_THEN_SCALE,
    ALERT_ONLY,
    AUTO_SCALE
}
