package com.ryuqq.factory.core.model;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 사용자 지정 운영 시간대.
 *
 * <p>start &gt; end 이면 자정을 넘기는 구간으로 해석합니다 (예: 22:00 ~ 06:00).
 * start == end 이면 하루 종일 운영입니다.</p>
 *
 * @param start 시작 시각 (포함)
 * @param end 종료 시각 (제외)
 * @param zone 판단 기준 시간대
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record CustomHours(LocalTime start, LocalTime end, ZoneId zone) {

    public CustomHours {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end cannot be null");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
    }

    /**
     * 주어진 시각이 구간 안인지 확인.
     *
     * @param now 현재 시각 (zone으로 변환 후 비교)
     * @return 구간 안이면 true
     */
    public boolean contains(ZonedDateTime now) {
        LocalTime local = now.withZoneSameInstant(zone).toLocalTime();
        if (start.equals(end)) {
            return true;
        }
        if (start.isBefore(end)) {
            return !local.isBefore(start) && local.isBefore(end);
        }
        // 자정 경유
        return !local.isBefore(start) || local.isBefore(end);
    }
}
