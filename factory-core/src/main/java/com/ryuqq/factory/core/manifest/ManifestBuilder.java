package com.ryuqq.factory.core.manifest;

import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.CostEstimate;
import com.ryuqq.factory.core.model.Event;
import com.ryuqq.factory.core.model.EventSource;
import com.ryuqq.factory.core.model.ExecutionPlan;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Phase;
import com.ryuqq.factory.core.model.PhasePlan;
import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.spi.CostEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Event + Policy 스냅샷으로 Manifest 생성.
 *
 * <p><strong>유도 규칙:</strong></p>
 * <ul>
 *   <li>scope: payload의 scope → message → description → title → "{source}:{type} event"</li>
 *   <li>constraints: 월 예산 상한, 동시 실행 상한, CRITICAL이면 긴급 처리 표시</li>
 *   <li>dependencies/risks: payload 값 (없으면 빈 목록) + 우선순위/출처 기반 위험 표시</li>
 *   <li>plan: Foster/Hone 스텝은 고정, Develop 스텝은 이벤트 출처별 테이블</li>
 *   <li>토큰 배분: Foster 15% / Develop 65% / Hone 20%</li>
 * </ul>
 *
 * <p><strong>승인 필요 조건 (OR):</strong></p>
 * <ul>
 *   <li>추정 비용 &gt; autoApproveThresholdUsd</li>
 *   <li>priority == CRITICAL</li>
 *   <li>payload.newIntegrations == true</li>
 *   <li>payload.environment == "production" 또는 payload.productionImpact == true</li>
 * </ul>
 *
 * <p>Manifest를 반환하는 것 외에 부수효과가 없습니다 (Run을 만들지 않음).</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class ManifestBuilder {

    private static final Logger log = LoggerFactory.getLogger(ManifestBuilder.class);

    static final String DEFAULT_OWNER = "system";

    static final List<String> FOSTER_STEPS = List.of(
        "Ingest event payload",
        "Query knowledge base for related context",
        "Analyze requirements and constraints",
        "Generate cost estimate"
    );

    static final List<String> HONE_STEPS = List.of(
        "Run 8-gate verification",
        "Execute security scan",
        "Performance audit",
        "Brand compliance check",
        "Cost reconciliation",
        "Seal receipt"
    );

    private static final List<String> FOSTER_EXECUTORS = List.of("intake", "context-retriever", "requirements-analyst");
    private static final List<String> DEVELOP_EXECUTORS = List.of("step-executor");
    private static final List<String> HONE_EXECUTORS = List.of("verification-gate", "receipt-sealer");

    private final CostEstimator costEstimator;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param costEstimator 비용 추정기
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ManifestBuilder(CostEstimator costEstimator, Clock clock) {
        if (costEstimator == null) {
            throw new IllegalArgumentException("costEstimator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.costEstimator = costEstimator;
        this.clock = clock;
    }

    /**
     * Manifest 생성.
     *
     * @param event 수락된 이벤트
     * @param policy 생성 시점의 정책 스냅샷
     * @return 불변 Manifest
     * @throws IllegalArgumentException event 또는 policy가 null인 경우
     * @throws IllegalStateException 비용 추정기가 null을 반환한 경우
     */
    public Manifest buildManifest(Event event, Policy policy) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        String scope = extractScope(event);
        CostEstimate estimate = costEstimator.estimate(scope);
        if (estimate == null) {
            throw new IllegalStateException("CostEstimator returned null estimate for scope: " + scope);
        }

        boolean approvalRequired = estimate.totalUsd() > policy.autoApproveThresholdUsd()
            || event.priority().isCritical()
            || hasNewIntegrations(event)
            || isProductionImpact(event);

        long tokens = estimate.totalTokens();
        ExecutionPlan plan = new ExecutionPlan(
            new PhasePlan(FOSTER_STEPS, allocate(tokens, Phase.FOSTER), FOSTER_EXECUTORS),
            new PhasePlan(developSteps(event.source()), allocate(tokens, Phase.DEVELOP), DEVELOP_EXECUTORS),
            new PhasePlan(HONE_STEPS, allocate(tokens, Phase.HONE), HONE_EXECUTORS)
        );

        Manifest manifest = new Manifest(
            "manifest-" + UUID.randomUUID(),
            event.id(),
            event.source(),
            event.chamberId() != null ? event.chamberId() : ChamberId.generate(),
            isBlank(event.ownerId()) ? DEFAULT_OWNER : event.ownerId(),
            scope,
            extractConstraints(event, policy),
            extractDependencies(event),
            extractRisks(event),
            plan,
            estimate,
            approvalRequired,
            event.priority(),
            clock.instant()
        );

        log.info("Manifest {} built for event {} (scope: {}, estimatedUsd: {}, approvalRequired: {})",
            manifest.id(), event.id(), scope, estimate.totalUsd(), approvalRequired);
        return manifest;
    }

    /**
     * 단계별 토큰 배분 (반올림).
     */
    public static long allocate(long totalTokens, Phase phase) {
        return Math.round(totalTokens * phase.tokenWeight());
    }

    static String extractScope(Event event) {
        Map<String, Object> payload = event.payload();
        for (String key : List.of("scope", "message", "description", "title")) {
            Object value = payload.get(key);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        return event.source().wireName() + ":" + event.type() + " event";
    }

    static List<String> extractConstraints(Event event, Policy policy) {
        List<String> constraints = new ArrayList<>();
        constraints.add("Budget: $" + plain(policy.monthlyBudgetCapUsd()) + "/month cap");
        constraints.add("Max concurrent: " + policy.maxConcurrentRuns() + " runs");
        if (event.priority().isCritical()) {
            constraints.add("Priority: CRITICAL - expedite");
        }
        return constraints;
    }

    static List<String> extractDependencies(Event event) {
        return stringList(event.payload().get("dependencies"));
    }

    static List<String> extractRisks(Event event) {
        List<String> risks = new ArrayList<>(stringList(event.payload().get("risks")));
        if (event.priority().isCritical()) {
            risks.add("Critical priority - failure impacts production");
        }
        if (event.source() == EventSource.TELEMETRY) {
            risks.add("Triggered by telemetry - may indicate degradation");
        }
        return risks;
    }

    static List<String> developSteps(EventSource source) {
        return switch (source) {
            case GIT -> List.of("Analyze commit diff", "Generate required code changes", "Update configurations");
            case SPEC -> List.of("Parse spec requirements", "Generate implementation plan",
                "Build components", "Wire integrations");
            case TICKET -> List.of("Analyze ticket requirements", "Implement solution", "Write tests");
            case TELEMETRY -> List.of("Diagnose issue from telemetry", "Apply remediation", "Verify fix");
            case USER -> List.of("Parse user request", "Generate solution plan", "Build artifacts", "Deploy result");
            default -> List.of("Analyze event", "Generate response", "Validate output");
        };
    }

    private static boolean hasNewIntegrations(Event event) {
        return Boolean.TRUE.equals(event.payload().get("newIntegrations"));
    }

    private static boolean isProductionImpact(Event event) {
        Map<String, Object> payload = event.payload();
        return "production".equals(payload.get("environment"))
            || Boolean.TRUE.equals(payload.get("productionImpact"));
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : items) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static String plain(double amount) {
        return BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
