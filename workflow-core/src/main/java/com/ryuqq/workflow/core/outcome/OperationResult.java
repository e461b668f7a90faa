package com.ryuqq.workflow.core.outcome;

import java.util.Map;

/**
 * Operation 호출 결과.
 *
 * <p>OperationResult는 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link OperationSuccess}: 성공, 0개 이상의 출력 필드 포함</li>
 *   <li>{@link OperationFailure}: 실패, 오류 메시지 포함</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 Task Executor가 예외 전파 대신
 * 결과 값으로 분기합니다. 실패는 해당 Task에만 국한됩니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (result instanceof OperationSuccess success) {
 *     Object sheetId = success.data().get("sheetId");
 * } else if (result instanceof OperationFailure failure) {
 *     log.warn("failed: {}", failure.error());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface OperationResult permits OperationSuccess, OperationFailure {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof OperationSuccess;
    }

    /**
     * 결과 데이터 (출력 필드).
     *
     * @return 읽기 전용 Map (비어 있을 수 있음)
     */
    Map<String, Object> data();

    /**
     * 출력 필드 없는 성공.
     *
     * @return OperationSuccess
     */
    static OperationResult success() {
        return OperationSuccess.empty();
    }

    /**
     * 출력 필드를 포함한 성공.
     *
     * @param data 출력 필드
     * @return OperationSuccess
     */
    static OperationResult success(Map<String, Object> data) {
        return new OperationSuccess(data);
    }

    /**
     * 실패.
     *
     * @param error 오류 메시지
     * @return OperationFailure
     */
    static OperationResult failure(String error) {
        return OperationFailure.of(error);
    }

    /**
     * 느슨한 결과 Map을 OperationResult로 변환.
     *
     * <p>결과를 {@code {success, error, ...fields}} 형태의 Map으로 돌려주는 호스트를 위한 어댑터입니다.</p>
     * <ul>
     *   <li>{@code success}가 {@code true}(Boolean 또는 "true")이면 성공, 나머지 필드는 data</li>
     *   <li>{@code success} 누락 또는 false → 실패</li>
     *   <li>실패 시 {@code error} 누락 → "Unknown error"</li>
     * </ul>
     *
     * @param raw 결과 Map (null이면 실패)
     * @return OperationResult
     */
    static OperationResult fromMap(Map<String, Object> raw) {
        if (raw == null) {
            return OperationFailure.of(OperationFailure.UNKNOWN_ERROR);
        }
        Object flag = raw.get("success");
        boolean success = flag instanceof Boolean b ? b : flag != null && Boolean.parseBoolean(flag.toString());
        if (success) {
            return new OperationSuccess(raw);
        }
        Object error = raw.get("error");
        return new OperationFailure(error == null ? OperationFailure.UNKNOWN_ERROR : error.toString(), raw);
    }
}
