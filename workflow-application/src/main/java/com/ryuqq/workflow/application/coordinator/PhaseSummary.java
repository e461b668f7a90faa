package com.ryuqq.workflow.application.coordinator;

/**
 * Phase 1회 실행의 집계.
 *
 * @param tasksCompleted 이번 실행에서 성공한 Task 수
 * @param tasksFailed 이번 실행에서 실패한 Task 수
 * @param decisionsCount Phase 종료 시점의 워크플로우 전체 결정 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PhaseSummary(
    int tasksCompleted,
    int tasksFailed,
    int decisionsCount
) {

    public PhaseSummary {
        if (tasksCompleted < 0 || tasksFailed < 0 || decisionsCount < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
    }

    /**
     * 실행된 Task 수.
     *
     * @return completed + failed
     */
    public int tasksAttempted() {
        return tasksCompleted + tasksFailed;
    }
}
