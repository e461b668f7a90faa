package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.model.WorkflowId;

/**
 * Operation 호출 시 전달되는 컨텍스트.
 *
 * @param workflowId 호출한 워크플로우 ID
 * @param workflowType 워크플로우 종류
 * @param taskId 호출한 Task ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationContext(
    WorkflowId workflowId,
    String workflowType,
    String taskId
) {

    public OperationContext {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
    }
}
