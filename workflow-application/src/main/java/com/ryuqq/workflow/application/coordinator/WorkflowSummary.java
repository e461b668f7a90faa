package com.ryuqq.workflow.application.coordinator;

import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.statemachine.WorkflowStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 워크플로우 구동 1회의 실행 요약.
 *
 * <p>phases는 이번 구동에서 실행된 Phase만 실행 순서대로 담습니다.
 * 카운트는 워크플로우 전체 누적값입니다.</p>
 *
 * @param workflowId 워크플로우 ID
 * @param workflowType 워크플로우 종류
 * @param status 구동 종료 시점 상태
 * @param phases Phase 이름 → 집계 (실행 순서)
 * @param tasksCompleted 누적 성공 Task 수
 * @param tasksFailed 누적 실패 Task 수
 * @param decisionsMade 누적 결정 수
 * @param executionTime 워크플로우 생성 후 경과 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowSummary(
    WorkflowId workflowId,
    String workflowType,
    WorkflowStatus status,
    Map<String, PhaseSummary> phases,
    int tasksCompleted,
    int tasksFailed,
    int decisionsMade,
    Duration executionTime
) {

    public WorkflowSummary {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        phases = phases == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(phases));
    }
}
