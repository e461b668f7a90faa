package com.ryuqq.workflow.core.exception;

/**
 * 템플릿 문서의 구조가 잘못됨 (WF-422-TEMPLATE).
 *
 * <p>Coordinator는 이 예외를 {@link TemplateNotFoundException}과 동일하게 취급합니다:
 * 워크플로우를 시작할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TemplateParseException extends WorkflowException {

    public static final String ERROR_CODE = "WF-422-TEMPLATE";

    public TemplateParseException(String message) {
        super(ERROR_CODE, message);
    }

    public TemplateParseException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
