package com.ryuqq.workflow.application.coordinator;

import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.model.WorkflowSnapshot;
import com.ryuqq.workflow.core.statemachine.WorkflowStatus;

import java.time.Duration;

/**
 * 전체 워크플로우 목록의 한 행 (경량 필드만).
 *
 * @param workflowId 워크플로우 ID
 * @param workflowType 워크플로우 종류
 * @param status 상태
 * @param currentPhase 현재 Phase
 * @param tasksCompleted 성공 Task 수
 * @param runtime 경과 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowOverview(
    WorkflowId workflowId,
    String workflowType,
    WorkflowStatus status,
    String currentPhase,
    int tasksCompleted,
    Duration runtime
) {

    public static WorkflowOverview from(WorkflowSnapshot snapshot) {
        return new WorkflowOverview(
            snapshot.workflowId(),
            snapshot.workflowType(),
            snapshot.status(),
            snapshot.currentPhase(),
            snapshot.completedTasks().size(),
            snapshot.runtime()
        );
    }
}
