package com.ryuqq.workflow.application.coordinator;

import com.ryuqq.workflow.core.exception.InvalidWorkflowArgumentException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 워크플로우 시작 명령.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>projectType: {@value #DEFAULT_PROJECT_TYPE}</li>
 *   <li>buildingCode: {@value #DEFAULT_BUILDING_CODE}</li>
 *   <li>customParameters: 빈 Map</li>
 * </ul>
 *
 * @param workflowType 워크플로우 종류 (필수, 예: DD_Package, CD_Set)
 * @param projectType 프로젝트 종류
 * @param buildingCode 적용 건축 법규
 * @param customParameters 호출자 지정 파라미터
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StartWorkflowCommand(
    String workflowType,
    String projectType,
    String buildingCode,
    Map<String, Object> customParameters
) {

    public static final String DEFAULT_PROJECT_TYPE = "General";
    public static final String DEFAULT_BUILDING_CODE = "IBC_2021";

    /**
     * Compact Constructor.
     *
     * @throws InvalidWorkflowArgumentException workflowType이 null이거나 빈 문자열인 경우
     */
    public StartWorkflowCommand {
        if (workflowType == null || workflowType.isBlank()) {
            throw new InvalidWorkflowArgumentException("workflowType is required (e.g., 'DD_Package', 'CD_Set')");
        }
        if (projectType == null || projectType.isBlank()) {
            projectType = DEFAULT_PROJECT_TYPE;
        }
        if (buildingCode == null || buildingCode.isBlank()) {
            buildingCode = DEFAULT_BUILDING_CODE;
        }
        customParameters = customParameters == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customParameters));
    }

    /**
     * 기본값으로 명령 생성.
     *
     * @param workflowType 워크플로우 종류
     * @return StartWorkflowCommand
     */
    public static StartWorkflowCommand of(String workflowType) {
        return new StartWorkflowCommand(workflowType, null, null, null);
    }

    /**
     * 프로젝트 종류 지정 명령 생성.
     *
     * @param workflowType 워크플로우 종류
     * @param projectType 프로젝트 종류
     * @return StartWorkflowCommand
     */
    public static StartWorkflowCommand of(String workflowType, String projectType) {
        return new StartWorkflowCommand(workflowType, projectType, null, null);
    }
}
