package com.ryuqq.factory.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Foster 단계 결과: 관련 컨텍스트와 요구사항 스냅샷.
 *
 * @param relatedPatterns 컨텍스트 조회로 얻은 관련 작업 패턴
 * @param relevance 조회 결과 관련도
 * @param requirements 요구사항 스냅샷 (scope, constraints, dependencies, risks, trigger)
 * @param completedAt 완료 시각
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record FosterResult(
    List<String> relatedPatterns,
    double relevance,
    Map<String, Object> requirements,
    Instant completedAt
) {

    public FosterResult {
        relatedPatterns = relatedPatterns == null ? List.of() : List.copyOf(relatedPatterns);
        requirements = requirements == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt cannot be null");
        }
    }
}
