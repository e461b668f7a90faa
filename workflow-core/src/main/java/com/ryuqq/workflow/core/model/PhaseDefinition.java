package com.ryuqq.workflow.core.model;

import java.util.List;

/**
 * 이름이 있는 Task 묶음. pause 단위입니다.
 *
 * <p>Task가 0개인 Phase도 유효하며 completed/failed 카운트에 0을 기여합니다.</p>
 *
 * @param name Phase 이름
 * @param tasks 선언 순서의 Task 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PhaseDefinition(
    String name,
    List<TaskDefinition> tasks
) {

    public PhaseDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("phase name cannot be null or blank");
        }
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
