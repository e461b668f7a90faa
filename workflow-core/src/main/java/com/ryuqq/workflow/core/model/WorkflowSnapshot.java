package com.ryuqq.workflow.core.model;

import com.ryuqq.workflow.core.statemachine.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * status 조회 결과 (특정 시점의 불변 복사본).
 *
 * @param workflowId 워크플로우 ID
 * @param workflowType 워크플로우 종류
 * @param projectType 프로젝트 종류
 * @param buildingCode 건축 법규
 * @param startTime 생성 시각
 * @param currentPhase 현재 Phase (아직 없으면 null)
 * @param status 상태
 * @param paused 일시 정지 여부
 * @param completedTasks 완료 Task 설명 (실행 순서)
 * @param failedTasks 실패 Task 설명과 오류 (실행 순서)
 * @param decisions 결정 기록 (기록 순서)
 * @param context carry-forward 값
 * @param runtime 생성 후 경과 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowSnapshot(
    WorkflowId workflowId,
    String workflowType,
    String projectType,
    String buildingCode,
    Instant startTime,
    String currentPhase,
    WorkflowStatus status,
    boolean paused,
    List<String> completedTasks,
    List<String> failedTasks,
    List<WorkflowDecision> decisions,
    Map<String, Object> context,
    Duration runtime
) {

    public WorkflowSnapshot {
        completedTasks = List.copyOf(completedTasks);
        failedTasks = List.copyOf(failedTasks);
        decisions = List.copyOf(decisions);
        // context 값은 null일 수 있으므로 Map.copyOf 대신 복사 후 감쌈
        context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
