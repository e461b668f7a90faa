package com.ryuqq.workflow.application.control;

/**
 * 제어 표면의 구조화된 응답.
 *
 * <p><strong>두 가지 가능한 형태:</strong></p>
 * <ul>
 *   <li>성공: success=true, body 포함, errorCode/error는 null</li>
 *   <li>실패: success=false, body는 null, errorCode/error 포함</li>
 * </ul>
 *
 * @param success 성공 여부
 * @param body 응답 본문 (실패 시 null)
 * @param errorCode 오류 코드 (성공 시 null)
 * @param error 오류 메시지 (성공 시 null)
 * @param <T> 본문 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ControlResponse<T>(
    boolean success,
    T body,
    String errorCode,
    String error
) {

    public ControlResponse {
        if (!success && (errorCode == null || errorCode.isBlank())) {
            throw new IllegalArgumentException("failure response requires an errorCode");
        }
    }

    public static <T> ControlResponse<T> ok(T body) {
        return new ControlResponse<>(true, body, null, null);
    }

    public static <T> ControlResponse<T> fail(String errorCode, String error) {
        return new ControlResponse<>(false, null, errorCode, error);
    }
}
