package com.ryuqq.factory.application.controller;

import com.ryuqq.factory.core.model.Chamber;
import com.ryuqq.factory.core.model.ChamberId;
import com.ryuqq.factory.core.model.ChamberStatus;
import com.ryuqq.factory.core.model.Event;
import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.model.PolicyPatch;
import com.ryuqq.factory.core.model.Receipt;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;

import java.util.List;
import java.util.Optional;

/**
 * 상시 가동 오케스트레이션 Controller.
 *
 * <p>Event를 받아 정책을 적용하고, Manifest를 만들어 자동 실행하거나 승인 대기로 돌립니다.</p>
 *
 * <p><strong>ingestEvent 정책 검사 순서 (첫 실패에서 중단):</strong></p>
 * <ol>
 *   <li>policy.enabled == false → REJECTED (paused)</li>
 *   <li>허용되지 않은 소스 → REJECTED (source_not_allowed)</li>
 *   <li>운영 시간 밖 → QUEUED</li>
 *   <li>monthlySpend &gt;= monthlyBudgetCapUsd → REJECTED (budget_exceeded)</li>
 *   <li>활성 Run 수 &gt;= maxConcurrentRuns → QUEUED</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * IngestResult result = controller.ingestEvent(event);
 * if (result.isAwaitingApproval()) {
 *     controller.approveRun(result.getRunIdOrNull());   // 단계 실행까지 수행
 * }
 * </pre>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public interface FactoryController {

    /**
     * Event 수집 (유일한 진입점).
     *
     * @param event 수집할 Event
     * @return 처분 결과
     * @throws IllegalArgumentException event가 null인 경우
     */
    IngestResult ingestEvent(Event event);

    /**
     * 승인 후 Foster → Develop → Hone 실행 (자동 실행 경로와 동일).
     *
     * @throws IllegalStateException 승인 대기 상태가 아닌 경우
     */
    Run approveRun(RunId runId);

    /**
     * @throws IllegalStateException PENDING, AWAITING_APPROVAL, STALLED가 아닌 경우
     */
    Run rejectRun(RunId runId, String reason);

    StatusReport getStatus();

    /**
     * @throws IllegalStateException 알 수 없는 RunId인 경우
     */
    Run getRun(RunId runId);

    List<Run> activeRuns();

    Run pauseRun(RunId runId);

    /**
     * 보류 해제 후 남은 단계를 이어서 실행.
     */
    Run resumeRun(RunId runId);

    /**
     * 완료된 Run의 Receipt에 배포 승인 표시.
     *
     * @throws IllegalStateException Receipt가 없거나 이미 승인된 경우
     */
    Receipt approveDeploy(RunId runId);

    /**
     * Controller 일시정지 (policy.enabled = false, 폴링 중지).
     */
    void pause();

    /**
     * Controller 재개 (policy.enabled = true, 폴링 시작).
     */
    void resume();

    Policy getPolicy();

    Policy replacePolicy(Policy policy);

    Policy updatePolicy(PolicyPatch patch);

    Optional<Chamber> getChamber(ChamberId chamberId);

    List<Chamber> listChambers();

    /**
     * @throws IllegalStateException 알 수 없는 Chamber인 경우
     */
    Chamber setChamberStatus(ChamberId chamberId, ChamberStatus status);
}
