package com.ryuqq.factory.adapter.runner;

/**
 * 정체된 Run 처리 전략.
 *
 * <p>정체(STALLED) Run은 동시 실행 슬롯을 계속 점유합니다. 이 전략은 그 슬롯을
 * 언제까지 유지할지 결정합니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum StallStrategy {

    /**
     * 정체 표시만 하고 사람의 개입(resume/reject)을 기다립니다.
     *
     * <p>슬롯을 무기한 점유하므로 정체가 쌓이면 신규 수락이 막힙니다.</p>
     */
    MARK_STALLED,

    /**
     * 정체 표시 후 유예 시간이 지나면 FAILED로 종결하여 슬롯을 반납합니다.
     */
    EXPIRE
}
