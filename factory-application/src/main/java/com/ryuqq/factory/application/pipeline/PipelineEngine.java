package com.ryuqq.factory.application.pipeline;

import com.ryuqq.factory.core.model.DevelopResult;
import com.ryuqq.factory.core.model.FosterResult;
import com.ryuqq.factory.core.model.HoneResult;
import com.ryuqq.factory.core.model.Manifest;
import com.ryuqq.factory.core.model.Run;
import com.ryuqq.factory.core.model.RunId;

import java.util.List;

/**
 * Run 생명주기 소유자.
 *
 * <p>승인된 Manifest를 Foster → Develop → Hone 순서로 실행합니다. 각 단계 메서드는 한 단계만
 * 실행하며 다음 단계를 자동으로 호출하지 않습니다 (단계 순서는 호출자가 결정).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Run run = engine.startRun(manifest);          // APPROVED 또는 AWAITING_APPROVAL
 * engine.executeFoster(run.getId());            // FOSTER_COMPLETE
 * engine.executeDevelop(run.getId());           // DEVELOP_COMPLETE
 * HoneResult hone = engine.executeHone(run.getId());
 * if (hone.allPassed()) {
 *     engine.completeRun(run.getId());          // COMPLETED + Receipt
 * }
 * // 아니면 DEVELOPING (cycle-back) 또는 FAILED
 * </pre>
 *
 * <p><strong>예외:</strong></p>
 * <ul>
 *   <li>알 수 없는 RunId, 허용되지 않는 상태에서의 호출: IllegalStateException</li>
 *   <li>외부 협력자 실패: Run을 FAILED로 전이한 뒤
 *       {@link com.ryuqq.factory.core.exception.PhaseExecutionException}</li>
 * </ul>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public interface PipelineEngine {

    /** 게이트 실패 시 최대 재시도 횟수. */
    int MAX_RETRIES = 3;

    /**
     * Run 생성.
     *
     * <p>PENDING으로 생성 후, 승인이 필요하면 AWAITING_APPROVAL, 아니면 APPROVED로 전이합니다.</p>
     *
     * @param manifest 실행할 Manifest
     * @return 생성된 Run
     */
    Run startRun(Manifest manifest);

    /**
     * Foster 단계 실행: 컨텍스트 조회, 요구사항 스냅샷, Foster 비용 누적.
     */
    FosterResult executeFoster(RunId runId);

    /**
     * Develop 단계 실행: 3스텝 단위 웨이브로 산출물 생성, Develop 비용 누적.
     */
    DevelopResult executeDevelop(RunId runId);

    /**
     * Hone 단계 실행: 8개 게이트 평가.
     *
     * <p>전체 통과 시 Receipt 봉인 후 HONE_COMPLETE. 실패 시 재시도 여유가 있으면
     * DEVELOPING으로 되돌아가고, 없으면 FAILED.</p>
     */
    HoneResult executeHone(RunId runId);

    /**
     * Run 완료 처리 (COMPLETED, Receipt 부착, 완료 이력 추가).
     */
    Run completeRun(RunId runId);

    /**
     * 승인 (PENDING/AWAITING_APPROVAL → APPROVED).
     *
     * @throws IllegalStateException 승인 대기 상태가 아닌 경우
     */
    Run approveRun(RunId runId);

    Run pauseRun(RunId runId);

    /**
     * 보류 해제 후 단계에 맞는 상태로 복귀.
     *
     * @throws IllegalStateException PAUSED/STALLED가 아닌 경우
     */
    Run resumeRun(RunId runId);

    /**
     * 정체 표시 (진행 중 상태 → STALLED).
     */
    Run markStalled(RunId runId);

    /**
     * 사람의 거부로 FAILED 처리 (사유 그대로 기록).
     *
     * @throws IllegalStateException PENDING, AWAITING_APPROVAL, STALLED가 아닌 경우
     */
    Run rejectRun(RunId runId, String reason);

    /**
     * 시스템 사유로 FAILED 처리.
     */
    Run failRun(RunId runId, String message);

    /**
     * @throws IllegalStateException 알 수 없는 RunId인 경우
     */
    Run getRun(RunId runId);

    /**
     * 종료되지 않은 모든 Run (동시 실행 슬롯 점유 중).
     */
    List<Run> activeRuns();

    List<Run> pendingApprovals();

    /**
     * 최근 완료된 Run (오래된 것부터).
     *
     * @param limit 최대 개수
     */
    List<Run> recentCompletions(int limit);

    /**
     * 최근 실패한 Run (오래된 것부터). 완료 이력과 별도로 보관됩니다.
     *
     * @param limit 최대 개수
     */
    List<Run> recentFailures(int limit);
}
