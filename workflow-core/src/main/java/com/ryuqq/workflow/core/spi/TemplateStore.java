package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.exception.TemplateNotFoundException;
import com.ryuqq.workflow.core.exception.TemplateParseException;
import com.ryuqq.workflow.core.model.TemplateSummary;
import com.ryuqq.workflow.core.model.WorkflowTemplate;

import java.util.List;

/**
 * 워크플로우 템플릿 저장소 SPI.
 *
 * <p><strong>조회 순서</strong> ({@link TemplateKeys#candidates(String, String)}):</p>
 * <ol>
 *   <li>{@code workflowType + "_" + projectType}</li>
 *   <li>{@code workflowType}</li>
 * </ol>
 *
 * <p>구조 파싱 외의 의미 검증은 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TemplateStore {

    /**
     * 템플릿 로드.
     *
     * @param workflowType 워크플로우 종류
     * @param projectType 프로젝트 종류 (null이면 일반 키만 조회)
     * @return 템플릿
     * @throws TemplateNotFoundException 두 키 모두 없는 경우
     * @throws TemplateParseException 문서 구조가 잘못된 경우
     */
    WorkflowTemplate load(String workflowType, String projectType);

    /**
     * 사용 가능한 템플릿 목록.
     *
     * @return 템플릿 요약 목록 (비어 있을 수 있음)
     */
    List<TemplateSummary> list();
}
