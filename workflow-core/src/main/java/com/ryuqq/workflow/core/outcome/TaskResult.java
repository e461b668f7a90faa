package com.ryuqq.workflow.core.outcome;

import com.ryuqq.workflow.core.model.WorkflowDecision;

/**
 * Task 1회 실행의 결과 (영속되지 않음).
 *
 * <p>정확히 두 가지 중 하나로 귀결됩니다. "skip"은 없습니다.</p>
 * <ul>
 *   <li>성공: decision은 선택 (null 가능), error는 null</li>
 *   <li>실패: decision은 null, error는 필수</li>
 * </ul>
 *
 * @param success 성공 여부
 * @param decision 기록할 결정 (null 가능)
 * @param error 오류 메시지 (성공 시 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskResult(
    boolean success,
    WorkflowDecision decision,
    String error
) {

    public TaskResult {
        if (success && error != null) {
            throw new IllegalArgumentException("successful TaskResult cannot carry an error");
        }
        if (!success) {
            if (decision != null) {
                throw new IllegalArgumentException("failed TaskResult cannot carry a decision");
            }
            if (error == null || error.isBlank()) {
                throw new IllegalArgumentException("failed TaskResult requires an error");
            }
        }
    }

    public static TaskResult succeeded(WorkflowDecision decisionOrNull) {
        return new TaskResult(true, decisionOrNull, null);
    }

    public static TaskResult failed(String error) {
        return new TaskResult(false, null, error);
    }
}
