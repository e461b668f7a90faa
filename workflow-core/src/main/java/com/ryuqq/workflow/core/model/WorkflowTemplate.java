package com.ryuqq.workflow.core.model;

import java.util.List;

/**
 * 선언적 워크플로우 계획 (읽기 전용).
 *
 * <p>{@code (workflowType, projectType)}으로 조회되며, 실행 동안 변경되지 않습니다.
 * 워크플로우 생성 시마다 새로 로드됩니다.</p>
 *
 * @param workflowType 워크플로우 종류 (예: CD_Set)
 * @param name 표시 이름 (null 가능)
 * @param description 설명 (null 가능)
 * @param projectTypes 지원 프로젝트 종류
 * @param estimatedTime 예상 소요 시간 (자유 형식, null 가능)
 * @param phases 선언 순서의 Phase 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowTemplate(
    String workflowType,
    String name,
    String description,
    List<String> projectTypes,
    String estimatedTime,
    List<PhaseDefinition> phases
) {

    public WorkflowTemplate {
        projectTypes = projectTypes == null ? List.of() : List.copyOf(projectTypes);
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    /**
     * 전체 Task 수.
     *
     * @return 모든 Phase의 Task 수 합계
     */
    public int taskCount() {
        return phases.stream().mapToInt(phase -> phase.tasks().size()).sum();
    }

    /**
     * 목록 조회용 요약 생성.
     *
     * @return TemplateSummary
     */
    public TemplateSummary summarize() {
        return new TemplateSummary(workflowType, name, description, projectTypes, phases.size(), estimatedTime);
    }
}
