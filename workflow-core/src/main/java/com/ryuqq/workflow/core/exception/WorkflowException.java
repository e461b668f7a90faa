package com.ryuqq.workflow.core.exception;

/**
 * 워크플로우 엔진의 도메인 예외 최상위 타입.
 *
 * <p>모든 하위 예외는 오류 코드를 가지며, 제어 표면(control surface)은
 * 이 코드를 그대로 실패 응답에 담아 호출자에게 전달합니다.</p>
 *
 * <p><strong>오류 코드 체계:</strong></p>
 * <ul>
 *   <li>WF-400: 잘못된 입력 ({@link InvalidWorkflowArgumentException})</li>
 *   <li>WF-404: 존재하지 않는 워크플로우 ({@link WorkflowNotFoundException})</li>
 *   <li>WF-404-TEMPLATE: 템플릿 없음 ({@link TemplateNotFoundException})</li>
 *   <li>WF-409: 허용되지 않는 상태 ({@link WorkflowStateException})</li>
 *   <li>WF-422-TEMPLATE: 템플릿 구조 오류 ({@link TemplateParseException})</li>
 * </ul>
 *
 * <p>Task 단위 실패는 예외가 아니라 값({@code OperationResult}, {@code TaskResult})으로
 * 표현되므로 이 계층에 속하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class WorkflowException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드 (예: WF-404)
     * @param message 오류 메시지
     */
    protected WorkflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * 원인 예외를 포함하는 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 예외
     */
    protected WorkflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }
}
