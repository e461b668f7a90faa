package com.ryuqq.workflow.core.exception;

/**
 * 현재 워크플로우 상태에서 허용되지 않는 요청 (WF-409).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>완료된 워크플로우를 pause / resume</li>
 *   <li>일시 정지 상태에서 resume 없이 continue</li>
 *   <li>이미 실행 중인 워크플로우를 다른 스레드에서 다시 구동</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkflowStateException extends WorkflowException {

    public static final String ERROR_CODE = "WF-409";

    public WorkflowStateException(String message) {
        super(ERROR_CODE, message);
    }
}
