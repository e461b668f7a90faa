package com.ryuqq.workflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 템플릿에 선언된 단일 Task.
 *
 * <p>method가 비어 있거나 {@code "custom"}이면 Operation을 호출하지 않는
 * 자리표시자(placeholder) Task입니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>id 누락 → {@code "unknown"}</li>
 *   <li>description 누락 → id</li>
 *   <li>parameters 누락 → 빈 Map</li>
 * </ul>
 *
 * <p>parameters는 선언 순서를 유지하는 읽기 전용 Map이며 null 값을 허용합니다.</p>
 *
 * @param id Task ID
 * @param description 사람이 읽는 설명 (completed/failed 목록에 기록됨)
 * @param method Operation 이름 또는 "custom" (null 가능)
 * @param parameters Operation 파라미터
 * @param autonomousDecision 자율 결정 힌트 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskDefinition(
    String id,
    String description,
    String method,
    Map<String, Object> parameters,
    String autonomousDecision
) {

    public static final String CUSTOM_METHOD = "custom";
    public static final String UNKNOWN_ID = "unknown";

    public TaskDefinition {
        if (id == null || id.isBlank()) {
            id = UNKNOWN_ID;
        }
        if (description == null || description.isBlank()) {
            description = id;
        }
        parameters = parameters == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Operation 호출 없이 성공 처리되는 자리표시자 Task인지 확인.
     *
     * @return method가 비어 있거나 "custom"이면 true
     */
    public boolean isCustom() {
        return method == null || method.isBlank() || CUSTOM_METHOD.equals(method);
    }

    /**
     * 자율 결정 힌트가 있는지 확인.
     *
     * @return 힌트가 비어 있지 않으면 true
     */
    public boolean hasDecisionHint() {
        return autonomousDecision != null && !autonomousDecision.isEmpty();
    }
}
