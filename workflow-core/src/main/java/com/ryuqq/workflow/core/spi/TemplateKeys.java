package com.ryuqq.workflow.core.spi;

import java.util.ArrayList;
import java.util.List;

/**
 * 템플릿 조회 키 규칙.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateKeys {

    private TemplateKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 조회할 키 목록 (우선순위 순).
     *
     * @param workflowType 워크플로우 종류
     * @param projectType 프로젝트 종류 (null 또는 빈 문자열이면 구체 키 생략)
     * @return [workflowType_projectType, workflowType] 또는 [workflowType]
     */
    public static List<String> candidates(String workflowType, String projectType) {
        if (workflowType == null || workflowType.isBlank()) {
            throw new IllegalArgumentException("workflowType cannot be null or blank");
        }
        List<String> keys = new ArrayList<>(2);
        if (projectType != null && !projectType.isBlank()) {
            keys.add(workflowType + "_" + projectType);
        }
        keys.add(workflowType);
        return List.copyOf(keys);
    }
}
