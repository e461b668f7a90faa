package com.ryuqq.workflow.core.exception;

/**
 * 존재하지 않는 워크플로우 ID (WF-404).
 *
 * <p>status / pause / resume / continue 요청에서 발생하며, 레지스트리 상태는 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkflowNotFoundException extends WorkflowException {

    public static final String ERROR_CODE = "WF-404";

    public WorkflowNotFoundException(String workflowId) {
        super(ERROR_CODE, "Workflow not found: " + workflowId);
    }
}
