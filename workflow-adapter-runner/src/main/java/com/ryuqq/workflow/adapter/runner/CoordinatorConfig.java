package com.ryuqq.workflow.adapter.runner;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * InlineWorkflowCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>contextPropagation: Task 간 자동 전달 필드 (기본 scheduleId, sheetId, viewId)</li>
 *   <li>customTaskDefaultReason: 힌트 없는 custom Task의 결정 사유 (기본 "No specific logic defined yet")</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong></p>
 * <ul>
 *   <li>{@value #CONTEXT_FIELDS_KEY}: 쉼표 구분 필드 목록 (빈 값이면 전달 비활성화)</li>
 *   <li>{@value #CUSTOM_TASK_REASON_KEY}: 기본 결정 사유</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param contextPropagation Task 간 전달 필드 설정
 * @param customTaskDefaultReason custom Task 기본 사유 (공백 불가)
 */
public record CoordinatorConfig(
    ContextPropagation contextPropagation,
    String customTaskDefaultReason
) {

    public static final String CONTEXT_FIELDS_KEY = "workflow.context.fields";
    public static final String CUSTOM_TASK_REASON_KEY = "workflow.custom-task.default-reason";
    public static final String DEFAULT_CUSTOM_TASK_REASON = "No specific logic defined yet";

    /**
     * 기본 설정 생성자.
     */
    public CoordinatorConfig() {
        this(new ContextPropagation(), DEFAULT_CUSTOM_TASK_REASON);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (contextPropagation == null) {
            throw new IllegalArgumentException("contextPropagation cannot be null");
        }
        if (customTaskDefaultReason == null || customTaskDefaultReason.isBlank()) {
            throw new IllegalArgumentException("customTaskDefaultReason cannot be null or blank");
        }
    }

    /**
     * Properties에서 설정 로드. 누락된 키는 기본값을 사용합니다.
     *
     * @param properties 설정 원본
     * @return CoordinatorConfig
     */
    public static CoordinatorConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        CoordinatorConfig config = new CoordinatorConfig();

        String fields = properties.getProperty(CONTEXT_FIELDS_KEY);
        if (fields != null) {
            List<String> parsed = Arrays.stream(fields.split(","))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .collect(Collectors.toList());
            config = config.withContextPropagation(new ContextPropagation(parsed));
        }

        String reason = properties.getProperty(CUSTOM_TASK_REASON_KEY);
        if (reason != null && !reason.isBlank()) {
            config = config.withCustomTaskDefaultReason(reason.trim());
        }
        return config;
    }

    /**
     * contextPropagation만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withContextPropagation(ContextPropagation contextPropagation) {
        return new CoordinatorConfig(contextPropagation, customTaskDefaultReason);
    }

    /**
     * customTaskDefaultReason만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withCustomTaskDefaultReason(String customTaskDefaultReason) {
        return new CoordinatorConfig(contextPropagation, customTaskDefaultReason);
    }
}
