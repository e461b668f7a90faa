package com.ryuqq.workflow.core.exception;

/**
 * 구체 키와 일반 키 모두 템플릿을 찾지 못함 (WF-404-TEMPLATE).
 *
 * <p>재시도해도 결과가 같은 종료 조건입니다. 워크플로우는 시작되지 않으며
 * 레지스트리에도 등록되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TemplateNotFoundException extends WorkflowException {

    public static final String ERROR_CODE = "WF-404-TEMPLATE";

    private final String workflowType;
    private final String projectType;

    public TemplateNotFoundException(String workflowType, String projectType) {
        super(ERROR_CODE, "Workflow template not found: " + workflowType);
        this.workflowType = workflowType;
        this.projectType = projectType;
    }

    public String getWorkflowType() {
        return workflowType;
    }

    public String getProjectType() {
        return projectType;
    }
}
