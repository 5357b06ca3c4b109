package com.ryuqq.factory.core.model;

/**
 * Event를 발생시킨 상위 소스.
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum EventSource {

    /** Push, PR 머지, 브랜치, 태그. */
    GIT,

    /** 신규/변경된 스펙 문서. */
    SPEC,

    /** 티켓 생성/변경. */
    TICKET,

    /** 헬스 체크 실패, 리소스 임계값 초과. */
    TELEMETRY,

    /** 크론 등 주기 작업. */
    SCHEDULE,

    /** 사용자의 수동 요청. */
    USER,

    /** 빌드 완료. */
    BUILD,

    /** 배포, 스케일링, 해제. */
    DEPLOY,

    /** 자동화 엔진 트리거. */
    AUTOMATION;

    /**
     * 소문자 와이어 이름 (예: "git").
     *
     * @return 소문자 소스 이름
     */
    public String wireName() {
        return name().toLowerCase();
    }
}
