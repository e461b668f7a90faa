package com.ryuqq.workflow.core.exception;

/**
 * 워크플로우 요청 인자가 유효하지 않음 (WF-400).
 *
 * <p>workflowType 누락, 잘못된 WorkflowId, 경로 문자가 포함된 템플릿 키 등.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidWorkflowArgumentException extends WorkflowException {

    public static final String ERROR_CODE = "WF-400";

    public InvalidWorkflowArgumentException(String message) {
        super(ERROR_CODE, message);
    }
}
