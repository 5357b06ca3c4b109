package com.ryuqq.factory.core.manifest;

import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.CostEstimate;
import com.ryuqq.factory.core.model.Event;
import com.ryuqq.factory.core.model.EventSource;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.model.Priority;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ManifestBuilder 테스트.
 *
 * @author Factory Team
 * @since 1.0.0
 */
class ManifestBuilderTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final Policy policy = Policy.defaults();

    private ManifestBuilder builderCosting(double usd) {
        return new ManifestBuilder(scope -> new CostEstimate(10_000, usd, 0.0), clock);
    }

    private Event event(EventSource source, Map<String, Object> payload) {
        return Event.of(source, "created", payload, clock);
    }

    // ========== scope ==========

    @Test
    void scope_PrefersExplicitScopeOverMessage() {
        Manifest manifest = builderCosting(1.0).buildManifest(
            event(EventSource.TICKET, Map.of("scope", "Fix login", "message", "ignored")), policy);

        assertEquals("Fix login", manifest.scope());
    }

    @Test
    void scope_SkipsBlankValuesAndFallsBackToTitle() {
        Manifest manifest = builderCosting(1.0).buildManifest(
            event(EventSource.TICKET, Map.of("scope", " ", "title", "Checkout page")), policy);

        assertEquals("Checkout page", manifest.scope());
    }

    @Test
    void scope_GenericFallbackWhenPayloadEmpty() {
        Manifest manifest = builderCosting(1.0).buildManifest(event(EventSource.GIT, Map.of()), policy);

        assertEquals("git:created event", manifest.scope());
    }

    // ========== constraints / risks ==========

    @Test
    void constraints_FromPolicyAndCriticalPriority() {
        // Given
        Event critical = event(EventSource.TICKET, Map.of("scope", "Outage")).withPriority(Priority.CRITICAL);

        // When
        Manifest manifest = builderCosting(0.01).buildManifest(critical, policy);

        // Then
        assertEquals(List.of("Budget: $500/month cap", "Max concurrent: 3 runs", "Priority: CRITICAL - expedite"),
            manifest.constraints());
        assertTrue(manifest.risks().contains("Critical priority - failure impacts production"));
    }

    @Test
    void risksAndDependencies_FromPayload() {
        Manifest manifest = builderCosting(1.0).buildManifest(event(EventSource.TELEMETRY, Map.of(
            "dependencies", List.of("auth-service"),
            "risks", List.of("schema migration"))), policy);

        assertEquals(List.of("auth-service"), manifest.dependencies());
        assertEquals(List.of("schema migration", "Triggered by telemetry - may indicate degradation"),
            manifest.risks());
    }

    // ========== plan ==========

    @Test
    void plan_SplitsTokensAcrossPhases() {
        Manifest manifest = builderCosting(1.0).buildManifest(event(EventSource.SPEC, Map.of()), policy);

        assertEquals(1500, manifest.plan().foster().estimatedTokens());
        assertEquals(6500, manifest.plan().develop().estimatedTokens());
        assertEquals(2000, manifest.plan().hone().estimatedTokens());
        assertEquals(List.of("Parse spec requirements", "Generate implementation plan",
            "Build components", "Wire integrations"), manifest.plan().develop().steps());
    }

    @Test
    void plan_UnlistedSourceUsesDefaultSteps() {
        Manifest manifest = builderCosting(1.0).buildManifest(event(EventSource.SCHEDULE, Map.of()), policy);

        assertEquals(List.of("Analyze event", "Generate response", "Validate output"),
            manifest.plan().develop().steps());
    }

    // ========== approval lane ==========

    @Test
    void approval_NotRequiredUnderThreshold() {
        Manifest manifest = builderCosting(1.0).buildManifest(event(EventSource.TICKET, Map.of()), policy);
        assertFalse(manifest.approvalRequired());
    }

    @Test
    void approval_RequiredOverThreshold() {
        Manifest manifest = builderCosting(5.01).buildManifest(event(EventSource.TICKET, Map.of()), policy);
        assertTrue(manifest.approvalRequired());
    }

    @Test
    void approval_RequiredForCriticalEvenWhenCheap() {
        Event critical = event(EventSource.TICKET, Map.of()).withPriority(Priority.CRITICAL);
        Manifest manifest = builderCosting(0.01).buildManifest(critical, policy);
        assertTrue(manifest.approvalRequired());
    }

    @Test
    void approval_RequiredForNewIntegrationsOrProduction() {
        ManifestBuilder builder = builderCosting(0.01);

        assertTrue(builder.buildManifest(event(EventSource.GIT, Map.of("newIntegrations", true)), policy)
            .approvalRequired());
        assertTrue(builder.buildManifest(event(EventSource.GIT, Map.of("environment", "production")), policy)
            .approvalRequired());
        assertTrue(builder.buildManifest(event(EventSource.GIT, Map.of("productionImpact", true)), policy)
            .approvalRequired());
        assertFalse(builder.buildManifest(event(EventSource.GIT, Map.of("environment", "staging")), policy)
            .approvalRequired());
    }

    // ========== identity ==========

    @Test
    void chamberAndOwner_DefaultWhenAbsent() {
        Manifest manifest = builderCosting(1.0).buildManifest(event(EventSource.GIT, Map.of()), policy);

        assertNotNull(manifest.chamberId());
        assertEquals("system", manifest.ownerId());
        assertEquals(NOW, manifest.createdAt());
    }

    @Test
    void chamberAndOwner_TakenFromEvent() {
        Event event = event(EventSource.USER, Map.of()).withChamber(ChamberId.of("chamber-a"), "alice");
        Manifest manifest = builderCosting(1.0).buildManifest(event, policy);

        assertEquals(ChamberId.of("chamber-a"), manifest.chamberId());
        assertEquals("alice", manifest.ownerId());
        assertEquals(EventSource.USER, manifest.triggerSource());
        assertEquals(event.id(), manifest.triggerEventId());
    }

    @Test
    void estimatorReturningNull_ThrowsException() {
        ManifestBuilder builder = new ManifestBuilder(scope -> null, clock);
        assertThrows(IllegalStateException.class,
            () -> builder.buildManifest(event(EventSource.GIT, Map.of()), policy));
    }
}
