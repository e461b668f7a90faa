package com.ryuqq.workflow.core.statemachine;

import com.ryuqq.workflow.core.exception.WorkflowStateException;

/**
 * 워크플로우 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>RUNNING → PAUSED, COMPLETED_SUCCESSFULLY, COMPLETED_WITH_ERRORS</li>
 *   <li>PAUSED → RUNNING</li>
 *   <li>RUNNING → RUNNING, PAUSED → PAUSED (멱등, 변화 없음)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>PAUSED에서 바로 완료로 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws WorkflowStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkflowStatus from, WorkflowStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new WorkflowStateException(
                String.format("Cannot transition from terminal status: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case RUNNING -> true;
            case PAUSED -> to == WorkflowStatus.PAUSED || to == WorkflowStatus.RUNNING;
            case COMPLETED_SUCCESSFULLY, COMPLETED_WITH_ERRORS -> false;
        };

        if (!valid) {
            throw new WorkflowStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws WorkflowStateException 유효하지 않은 전이인 경우
     */
    public static WorkflowStatus transition(WorkflowStatus current, WorkflowStatus next) {
        validate(current, next);
        return next;
    }
}
