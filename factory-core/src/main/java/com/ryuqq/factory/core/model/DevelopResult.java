package com.ryuqq.factory.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Develop 단계 결과.
 *
 * @param artifacts 생성된 산출물 (스텝 순서)
 * @param buildLog 웨이브별 실행 로그
 * @param wavesCompleted 완료된 웨이브 수
 * @param wavesTotal 전체 웨이브 수
 * @param attempt 몇 번째 Develop 시도인지 (0 = 최초, 이후 재시도 횟수)
 * @param completedAt 완료 시각
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record DevelopResult(
    List<Artifact> artifacts,
    List<String> buildLog,
    int wavesCompleted,
    int wavesTotal,
    int attempt,
    Instant completedAt
) {

    public DevelopResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        buildLog = buildLog == null ? List.of() : List.copyOf(buildLog);
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt cannot be null");
        }
    }

    public long countOf(ArtifactType type) {
        return artifacts.stream().filter(a -> a.type() == type).count();
    }
}
