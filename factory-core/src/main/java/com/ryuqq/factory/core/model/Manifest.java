package com.ryuqq.factory.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Event 하나와 생성 시점의 Policy 스냅샷으로 만든 불변 실행 계획.
 *
 * <p>수락된 Event마다 정확히 하나 생성되며, 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>승인 레인:</strong></p>
 * <ul>
 *   <li>approvalRequired = false: "Deploy It" (무인 실행)</li>
 *   <li>approvalRequired = true: "Guide Me" (사람 승인 후 실행)</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record Manifest(
    String id,
    String triggerEventId,
    EventSource triggerSource,
    ChamberId chamberId,
    String ownerId,
    String scope,
    List<String> constraints,
    List<String> dependencies,
    List<String> risks,
    ExecutionPlan plan,
    CostEstimate costEstimate,
    boolean approvalRequired,
    Priority priority,
    Instant createdAt
) {

    public Manifest {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (triggerEventId == null || triggerSource == null) {
            throw new IllegalArgumentException("trigger event id and source cannot be null");
        }
        if (chamberId == null) {
            throw new IllegalArgumentException("chamberId cannot be null");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId cannot be null or blank");
        }
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope cannot be null or blank");
        }
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (costEstimate == null) {
            throw new IllegalArgumentException("costEstimate cannot be null");
        }
        if (priority == null || createdAt == null) {
            throw new IllegalArgumentException("priority and createdAt cannot be null");
        }
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        risks = risks == null ? List.of() : List.copyOf(risks);
    }
}
