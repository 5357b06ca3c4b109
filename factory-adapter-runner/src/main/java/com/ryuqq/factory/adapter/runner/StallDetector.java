package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.application.pipeline.PipelineEngine;
import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;
import com.ryuqq.factory.core.statemachine.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 정체 감지기.
 *
 * <p>진행 중인 Run 중 마지막 갱신 이후 Policy의 stallTimeout을 넘긴 Run을 STALLED로 표시합니다.</p>
 *
 * <p><strong>스캔 흐름:</strong></p>
 * <pre>
 * 1. activeRuns() 조회
 * 2. 진행 중(in-flight) Run: now - updatedAt &gt; stallTimeout 이면 markStalled
 * 3. EXPIRE 전략이면 STALLED Run: now - updatedAt &gt; expiryGraceMs 이면 failRun
 * 4. 결과 로깅
 * </pre>
 *
 * <p>승인 대기와 일시정지 Run은 사람의 결정을 기다리는 중이므로 정체 판정에서 제외합니다.
 * 개별 Run 처리 중 예외가 나도 나머지 Run 처리는 계속합니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class StallDetector {

    private static final Logger log = LoggerFactory.getLogger(StallDetector.class);

    private final PipelineEngine engine;
    private final Clock clock;
    private final StallDetectorConfig config;

    /**
     * 생성자.
     *
     * @param engine 파이프라인 엔진
     * @param clock 시각 소스
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StallDetector(PipelineEngine engine, Clock clock, StallDetectorConfig config) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.engine = engine;
        this.clock = clock;
        this.config = config;
    }

    /**
     * 정체 Run 스캔.
     *
     * <p>폴링 주기마다 호출됩니다.</p>
     *
     * @param policy 현재 Policy (stallTimeoutMinutes 사용)
     * @return 이번 스캔에서 처리된 Run
     */
    public StallScanResult scan(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        Instant now = clock.instant();
        long timeoutMs = policy.stallTimeoutMs();

        List<RunId> stalled = new ArrayList<>();
        List<RunId> expired = new ArrayList<>();
        for (Run run : engine.activeRuns()) {
            RunStatus status = run.getStatus();
            long idleMs = Duration.between(run.getUpdatedAt(), now).toMillis();

            if (status.isInFlight() && idleMs > timeoutMs) {
                if (tryMarkStalled(run, idleMs)) {
                    stalled.add(run.getId());
                }
            } else if (status == RunStatus.STALLED
                && config.strategy() == StallStrategy.EXPIRE
                && idleMs > config.expiryGraceMs()) {
                if (tryExpire(run, idleMs)) {
                    expired.add(run.getId());
                }
            }
        }

        if (!stalled.isEmpty() || !expired.isEmpty()) {
            log.warn("Stall scan: {} marked stalled, {} expired", stalled.size(), expired.size());
        } else {
            log.debug("Stall scan completed with no stalled runs");
        }
        return new StallScanResult(stalled, expired);
    }

    private boolean tryMarkStalled(Run run, long idleMs) {
        try {
            engine.markStalled(run.getId());
            log.warn("Run {} idle for {}ms in {}, marked STALLED", run.getId(), idleMs, run.getCurrentPhase());
            return true;
        } catch (Exception e) {
            log.error("Failed to mark {} as stalled", run.getId(), e);
            return false;
        }
    }

    private boolean tryExpire(Run run, long idleMs) {
        try {
            engine.failRun(run.getId(),
                "Stalled run expired after " + Duration.ofMillis(idleMs).toMinutes() + " minutes without progress");
            return true;
        } catch (Exception e) {
            log.error("Failed to expire stalled run {}", run.getId(), e);
            return false;
        }
    }
}
