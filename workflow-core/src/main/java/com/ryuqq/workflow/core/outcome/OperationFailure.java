package com.ryuqq.workflow.core.outcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 실패 결과.
 *
 * <p>Task 실패로 기록되며 Phase와 워크플로우는 계속 진행됩니다.</p>
 *
 * @param error 오류 메시지
 * @param data 실패와 함께 반환된 필드 (context로 전달되지 않음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationFailure(
    String error,
    Map<String, Object> data
) implements OperationResult {

    public static final String UNKNOWN_ERROR = "Unknown error";

    public OperationFailure {
        if (error == null || error.isBlank()) {
            error = UNKNOWN_ERROR;
        }
        data = data == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * 데이터 없는 실패 생성.
     *
     * @param error 오류 메시지
     * @return OperationFailure
     */
    public static OperationFailure of(String error) {
        return new OperationFailure(error, null);
    }
}
