package com.ryuqq.workflow.core.outcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 성공 결과.
 *
 * <p>data에는 0개 이상의 출력 필드가 담기며, 그중 잘 알려진 필드
 * (예: scheduleId, sheetId, viewId)는 이후 Task를 위해 워크플로우 context로 전달됩니다.</p>
 *
 * @param data 출력 필드 (null 값 허용, 읽기 전용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationSuccess(
    Map<String, Object> data
) implements OperationResult {

    private static final OperationSuccess EMPTY = new OperationSuccess(Map.of());

    public OperationSuccess {
        data = data == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * 출력 필드 없는 성공.
     *
     * @return OperationSuccess
     */
    public static OperationSuccess empty() {
        return EMPTY;
    }

    /**
     * 단일 출력 필드를 가진 성공.
     *
     * @param field 필드 이름
     * @param value 값
     * @return OperationSuccess
     */
    public static OperationSuccess of(String field, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(field, value);
        return new OperationSuccess(data);
    }
}
