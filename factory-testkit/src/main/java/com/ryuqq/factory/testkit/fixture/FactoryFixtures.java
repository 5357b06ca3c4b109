package com.ryuqq.factory.testkit.fixture;

import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.gate.GateResult;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.CostActual;
import com.ryuqq.factory.core.model.CostEstimate;
import com.ryuqq.factory.core.model.Event;
import com.ryuqq.factory.core.model.EventSource;
import com.ryuqq.factory.core.model.ExecutionPlan;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.PhasePlan;
import com.ryuqq.factory.core.model.Priority;
import com.ryuqq.factory.core.model.Receipt;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.statemachine.RunStatus;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Shared test data for adapter and runner tests.
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class FactoryFixtures {

    public static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    /** Token price the fixture estimates are consistent with ($ per 1K tokens). */
    public static final double USD_PER_1K_TOKENS = 0.003;

    private FactoryFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Event event(String id, EventSource source, Map<String, Object> payload) {
        return new Event(id, source, "created", payload, null, null, T0, Priority.NORMAL);
    }

    public static Event ticket(String id, String scope) {
        return event(id, EventSource.TICKET, Map.of("scope", scope));
    }

    /**
     * 1000 planned tokens (150 / 650 / 200) estimated at {@link #USD_PER_1K_TOKENS}.
     */
    public static Manifest manifest(String id, ChamberId chamberId) {
        return manifest(id, chamberId, 1000 / 1000.0 * USD_PER_1K_TOKENS);
    }

    /**
     * Same plan as {@link #manifest(String, ChamberId)} with an arbitrary USD estimate.
     */
    public static Manifest manifest(String id, ChamberId chamberId, double estimatedUsd) {
        ExecutionPlan plan = new ExecutionPlan(
            new PhasePlan(List.of("Ingest event payload"), 150, List.of("intake")),
            new PhasePlan(List.of("Implement solution", "Write tests"), 650, List.of("step-executor")),
            new PhasePlan(List.of("Run 8-gate verification"), 200, List.of("verification-gate"))
        );
        return new Manifest(id, "evt-" + id, EventSource.TICKET, chamberId, "owner-1", "scope of " + id,
            List.of(), List.of(), List.of(), plan, new CostEstimate(1000, estimatedUsd, 0.0), false, Priority.NORMAL, T0);
    }

    public static List<GateResult> gateResults(GateKind... failing) {
        List<GateKind> failed = Arrays.asList(failing);
        return Arrays.stream(GateKind.values())
            .map(g -> new GateResult(g, !failed.contains(g), null, g.wireName(), null))
            .toList();
    }

    public static Receipt receipt(String id, RunId runId) {
        return new Receipt(id, runId, gateResults(), List.of(), new CostActual(1000, USD_PER_1K_TOKENS), "+0.0%", T0,
            "factory-controller");
    }

    /**
     * Run driven straight to COMPLETED (no phase results).
     */
    public static Run completedRun(String id) {
        Run run = new Run(RunId.of(id), manifest("manifest-" + id, ChamberId.of("chamber-1")), 3, T0);
        run.transitionTo(RunStatus.APPROVED, T0);
        for (RunStatus next : List.of(RunStatus.FOSTERING, RunStatus.FOSTER_COMPLETE, RunStatus.DEVELOPING,
            RunStatus.DEVELOP_COMPLETE, RunStatus.HONING, RunStatus.HONE_COMPLETE, RunStatus.COMPLETED)) {
            run.transitionTo(next, T0);
        }
        return run;
    }

    public static Run failedRun(String id, String error) {
        Run run = new Run(RunId.of(id), manifest("manifest-" + id, ChamberId.of("chamber-1")), 3, T0);
        run.fail(error, T0);
        return run;
    }
}
