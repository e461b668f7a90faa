package com.ryuqq.workflow.core.model;

import java.util.List;

/**
 * 템플릿 목록 조회 결과 한 건.
 *
 * @param workflowType 워크플로우 종류
 * @param name 표시 이름
 * @param description 설명
 * @param projectTypes 지원 프로젝트 종류
 * @param phaseCount Phase 수
 * @param estimatedTime 예상 소요 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TemplateSummary(
    String workflowType,
    String name,
    String description,
    List<String> projectTypes,
    int phaseCount,
    String estimatedTime
) {

    public TemplateSummary {
        projectTypes = projectTypes == null ? List.of() : List.copyOf(projectTypes);
    }
}
