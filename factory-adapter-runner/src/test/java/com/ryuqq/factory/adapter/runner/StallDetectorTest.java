package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.application.pipeline.PipelineEngine;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.statemachine.RunStatus;
import com.ryuqq.factory.testkit.fixture.FactoryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;

import static com.ryuqq.factory.testkit.fixture.FactoryFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * StallDetector 유닛 테스트.
 *
 * <ul>
 *   <li>MARK_STALLED 전략: 정체 Run을 STALLED로 표시</li>
 *   <li>EXPIRE 전략: 유예 시간이 지난 STALLED Run을 실패 처리</li>
 *   <li>예외 발생 시에도 계속 진행</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StallDetectorTest {

    @Mock
    private PipelineEngine engine;

    private Clock clock;
    private Policy policy;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(T0.plus(Duration.ofMinutes(16)), ZoneOffset.UTC);
        policy = Policy.defaults();
    }

    private Run approvedRun(String id) {
        Run run = new Run(RunId.of(id), FactoryFixtures.manifest("manifest-" + id, ChamberId.of("chamber-1")), 3, T0);
        run.transitionTo(RunStatus.APPROVED, T0);
        return run;
    }

    private Run stalledRun(String id) {
        Run run = approvedRun(id);
        run.markStalled(T0);
        return run;
    }

    // ============================================================
    // 1. MARK_STALLED 전략
    // ============================================================

    @Test
    void scan_타임아웃을_넘긴_진행중_Run을_STALLED로_표시() {
        // given
        StallDetector detector = new StallDetector(engine, clock, new StallDetectorConfig());
        Run run = approvedRun("run-1");
        when(engine.activeRuns()).thenReturn(List.of(run));

        // when
        StallScanResult result = detector.scan(policy);

        // then
        verify(engine).markStalled(run.getId());
        assertThat(result.stalled()).containsExactly(run.getId());
        assertThat(result.expired()).isEmpty();
    }

    @Test
    void scan_타임아웃_이내면_아무것도_하지_않음() {
        // given
        StallDetector detector = new StallDetector(engine, clock, new StallDetectorConfig());
        Run run = approvedRun("run-1");
        when(engine.activeRuns()).thenReturn(List.of(run));

        // when
        StallScanResult result = detector.scan(policy.withStallTimeoutMinutes(30));

        // then
        verify(engine, never()).markStalled(any());
        assertThat(result.stalled()).isEmpty();
    }

    @Test
    void scan_승인_대기_Run은_정체로_보지_않음() {
        // given
        StallDetector detector = new StallDetector(engine, clock, new StallDetectorConfig());
        Run waiting = new Run(RunId.of("run-w"), FactoryFixtures.manifest("manifest-w", ChamberId.of("chamber-1")),
            3, T0);
        waiting.transitionTo(RunStatus.AWAITING_APPROVAL, T0);
        when(engine.activeRuns()).thenReturn(List.of(waiting));

        // when
        detector.scan(policy);

        // then
        verify(engine, never()).markStalled(any());
    }

    @Test
    void scan_MARK_STALLED_전략이면_STALLED_Run은_그대로_둠() {
        // given
        StallDetector detector = new StallDetector(engine, clock, new StallDetectorConfig().withExpiryGraceMs(60_000));
        when(engine.activeRuns()).thenReturn(List.of(stalledRun("run-s")));

        // when
        StallScanResult result = detector.scan(policy);

        // then
        verify(engine, never()).failRun(any(), anyString());
        assertThat(result.expired()).isEmpty();
    }

    // ============================================================
    // 2. EXPIRE 전략
    // ============================================================

    @Test
    void scan_EXPIRE_전략이면_유예_시간이_지난_STALLED_Run을_실패_처리() {
        // given
        StallDetectorConfig config = new StallDetectorConfig()
            .withStrategy(StallStrategy.EXPIRE)
            .withExpiryGraceMs(600_000);
        StallDetector detector = new StallDetector(engine, clock, config);
        Run run = stalledRun("run-s");
        when(engine.activeRuns()).thenReturn(List.of(run));

        // when
        StallScanResult result = detector.scan(policy);

        // then
        verify(engine).failRun(eq(run.getId()), eq("Stalled run expired after 16 minutes without progress"));
        assertThat(result.expired()).containsExactly(run.getId());
    }

    @Test
    void scan_EXPIRE_전략에서도_결정_대기_Run은_정체나_만료로_보지_않음() {
        // given
        StallDetectorConfig config = new StallDetectorConfig()
            .withStrategy(StallStrategy.EXPIRE)
            .withExpiryGraceMs(60_000);
        StallDetector detector = new StallDetector(engine, clock, config);
        Run pending = new Run(RunId.of("run-p"), FactoryFixtures.manifest("manifest-p", ChamberId.of("chamber-1")),
            3, T0);
        Run waiting = new Run(RunId.of("run-w"), FactoryFixtures.manifest("manifest-w", ChamberId.of("chamber-1")),
            3, T0);
        waiting.transitionTo(RunStatus.AWAITING_APPROVAL, T0);
        when(engine.activeRuns()).thenReturn(List.of(pending, waiting));

        // when
        StallScanResult result = detector.scan(policy.withStallTimeoutMinutes(1));

        // then
        verify(engine, never()).markStalled(any());
        verify(engine, never()).failRun(any(), any());
        assertThat(result.stalled()).isEmpty();
        assertThat(result.expired()).isEmpty();
    }

    @Test
    void scan_EXPIRE_전략이라도_유예_시간_이내면_유지() {
        // given
        StallDetectorConfig config = new StallDetectorConfig().withStrategy(StallStrategy.EXPIRE);
        StallDetector detector = new StallDetector(engine, clock, config);
        when(engine.activeRuns()).thenReturn(List.of(stalledRun("run-s")));

        // when
        StallScanResult result = detector.scan(policy);

        // then
        verify(engine, never()).failRun(any(), anyString());
        assertThat(result.expired()).isEmpty();
    }

    // ============================================================
    // 3. 예외 처리
    // ============================================================

    @Test
    void scan_한_Run_처리_중_예외가_나도_나머지는_계속_처리() {
        // given
        StallDetector detector = new StallDetector(engine, clock, new StallDetectorConfig());
        Run broken = approvedRun("run-1");
        Run healthy = approvedRun("run-2");
        when(engine.activeRuns()).thenReturn(List.of(broken, healthy));
        when(engine.markStalled(broken.getId())).thenThrow(new IllegalStateException("store unavailable"));

        // when
        StallScanResult result = detector.scan(policy);

        // then
        verify(engine).markStalled(healthy.getId());
        assertThat(result.stalled()).containsExactly(healthy.getId());
    }

    @Test
    void scan_policy가_null이면_예외() {
        StallDetector detector = new StallDetector(engine, clock, new StallDetectorConfig());

        assertThatThrownBy(() -> detector.scan(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_null_의존성이면_예외() {
        assertThatThrownBy(() -> new StallDetector(null, clock, new StallDetectorConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StallDetector(engine, clock, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
