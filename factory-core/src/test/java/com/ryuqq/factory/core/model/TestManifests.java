package com.ryuqq.factory.core.model;

import com.ryuqq.factory.core.gate.GateKind;
import com.ryuqq.factory.core.gate.GateResult;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * core 테스트용 Manifest/Receipt 픽스처.
 */
public final class TestManifests {

    public static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private TestManifests() {
    }

    public static Manifest manifest(long tokens, double usd) {
        ExecutionPlan plan = new ExecutionPlan(
            new PhasePlan(List.of("Ingest event payload"), Math.round(tokens * 0.15), List.of("intake")),
            new PhasePlan(List.of("Implement solution", "Write tests"), Math.round(tokens * 0.65), List.of("step-executor")),
            new PhasePlan(List.of("Run 8-gate verification"), Math.round(tokens * 0.20), List.of("verification-gate"))
        );
        return new Manifest("manifest-1", "evt-1", EventSource.TICKET, ChamberId.of("chamber-1"), "owner-1",
            "Fix login bug", List.of(), List.of(), List.of(), plan,
            new CostEstimate(tokens, usd, 0.0), false, Priority.NORMAL, T0);
    }

    public static List<GateResult> gates(GateKind... failing) {
        List<GateKind> failed = Arrays.asList(failing);
        return Arrays.stream(GateKind.values())
            .map(g -> new GateResult(g, !failed.contains(g), null, "evidence", null))
            .toList();
    }

    public static Receipt receipt(RunId runId) {
        return new Receipt("receipt-1", runId, gates(), List.of(), new CostActual(100, 1.0),
            "+0.0%", T0, "factory-controller");
    }

    public static HoneResult passedHone(RunId runId) {
        List<GateResult> results = gates();
        return new HoneResult(results, results.size(), true, receipt(runId), T0);
    }

    public static HoneResult failedHone(GateKind... failing) {
        List<GateResult> results = gates(failing);
        int score = (int) results.stream().filter(GateResult::passed).count();
        return new HoneResult(results, score, false, null, T0);
    }
}
