package com.ryuqq.workflow.application.coordinator;

import com.ryuqq.workflow.core.exception.InvalidWorkflowArgumentException;
import com.ryuqq.workflow.core.exception.TemplateNotFoundException;
import com.ryuqq.workflow.core.exception.TemplateParseException;
import com.ryuqq.workflow.core.exception.WorkflowNotFoundException;
import com.ryuqq.workflow.core.exception.WorkflowStateException;
import com.ryuqq.workflow.core.model.TemplateSummary;
import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.model.WorkflowSnapshot;

import java.util.List;

/**
 * 워크플로우 생명주기 조정자.
 *
 * <p>생성부터 종료 상태까지 워크플로우 전체 생명주기를 소유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowSummary summary = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));
 *
 * if (summary.status() == WorkflowStatus.PAUSED) {
 *     coordinator.resume(summary.workflowId());
 *     summary = coordinator.continueWorkflow(summary.workflowId());
 * }
 *
 * WorkflowSnapshot snapshot = coordinator.getStatus(summary.workflowId());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowCoordinator {

    /**
     * 워크플로우 생성 후 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>workflowType 검증</li>
     *   <li>템플릿 해석 (구체 키 → 일반 키)</li>
     *   <li>WorkflowId 발급 및 WorkflowState 생성 (status=Running)</li>
     *   <li>레지스트리 등록 (즉시 동시 조회에 노출)</li>
     *   <li>모든 Phase 완료 또는 pause까지 Phase 순차 실행</li>
     *   <li>종료 상태 결정 후 요약 반환</li>
     * </ol>
     *
     * <p>템플릿 해석이 실패하면 어떤 워크플로우도 등록되지 않습니다.</p>
     *
     * @param command 시작 명령
     * @return 실행 요약
     * @throws InvalidWorkflowArgumentException command가 유효하지 않은 경우
     * @throws TemplateNotFoundException 템플릿이 없는 경우
     * @throws TemplateParseException 템플릿 구조가 잘못된 경우
     */
    WorkflowSummary createAndRun(StartWorkflowCommand command);

    /**
     * resume된 워크플로우의 남은 Phase 실행.
     *
     * <p>일시 정지된 커서 위치(다음 미실행 Task)부터 이어서 실행합니다.</p>
     *
     * @param workflowId 워크플로우 ID
     * @return 이번 구동의 실행 요약
     * @throws WorkflowNotFoundException 존재하지 않는 ID
     * @throws WorkflowStateException 일시 정지, 완료, 또는 이미 구동 중인 경우
     */
    WorkflowSummary continueWorkflow(WorkflowId workflowId);

    /**
     * 단일 워크플로우 상태 조회.
     *
     * @param workflowId 워크플로우 ID
     * @return 스냅샷
     * @throws WorkflowNotFoundException 존재하지 않는 ID
     */
    WorkflowSnapshot getStatus(WorkflowId workflowId);

    /**
     * 전체 워크플로우 간략 조회.
     *
     * @return 개요 목록 (시작 시각 순)
     */
    List<WorkflowOverview> listWorkflows();

    /**
     * 일시 정지 (협력적, 경계에서만 관찰).
     *
     * @param workflowId 워크플로우 ID
     * @return 변경 후 스냅샷
     * @throws WorkflowNotFoundException 존재하지 않는 ID
     * @throws WorkflowStateException 완료된 워크플로우인 경우
     */
    WorkflowSnapshot pause(WorkflowId workflowId);

    /**
     * 재개 (상태만 변경, 실행은 {@link #continueWorkflow(WorkflowId)}).
     *
     * @param workflowId 워크플로우 ID
     * @return 변경 후 스냅샷
     * @throws WorkflowNotFoundException 존재하지 않는 ID
     * @throws WorkflowStateException 완료된 워크플로우인 경우
     */
    WorkflowSnapshot resume(WorkflowId workflowId);

    /**
     * 사용 가능한 템플릿 목록.
     *
     * @return 템플릿 요약 목록
     */
    List<TemplateSummary> listTemplates();
}
