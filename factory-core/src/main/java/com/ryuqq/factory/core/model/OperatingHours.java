package com.ryuqq.factory.core.model;

import java.time.ZonedDateTime;

/**
 * Controller가 새 작업을 시작할 수 있는 운영 시간대.
 *
 * <p>운영 시간 밖에 들어온 Event는 거부되지 않고 대기열에 보관됩니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public enum OperatingHours {

    /** 항상 운영. */
    ALWAYS,

    /** 08:00 ~ 18:00 (Controller Clock의 시간대 기준). */
    BUSINESS,

    /** {@link CustomHours}에 지정된 시간대. */
    CUSTOM;

    static final int BUSINESS_START_HOUR = 8;
    static final int BUSINESS_END_HOUR = 18;

    /**
     * 주어진 시각이 운영 시간 내인지 확인.
     *
     * @param now 현재 시각
     * @param customHours CUSTOM일 때 사용할 시간대 (다른 경우 무시)
     * @return 운영 시간 내이면 true
     * @throws IllegalArgumentException CUSTOM인데 customHours가 null인 경우
     */
    public boolean isOpen(ZonedDateTime now, CustomHours customHours) {
        return switch (this) {
            case ALWAYS -> true;
            case BUSINESS -> now.getHour() >= BUSINESS_START_HOUR && now.getHour() < BUSINESS_END_HOUR;
            case CUSTOM -> {
                if (customHours == null) {
                    throw new IllegalArgumentException("customHours cannot be null for CUSTOM operating hours");
                }
                yield customHours.contains(now);
            }
        };
    }
}
