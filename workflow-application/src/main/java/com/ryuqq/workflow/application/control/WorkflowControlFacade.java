package com.ryuqq.workflow.application.control;

import com.ryuqq.workflow.application.coordinator.StartWorkflowCommand;
import com.ryuqq.workflow.application.coordinator.WorkflowCoordinator;
import com.ryuqq.workflow.application.coordinator.WorkflowOverview;
import com.ryuqq.workflow.application.coordinator.WorkflowSummary;
import com.ryuqq.workflow.core.exception.InvalidWorkflowArgumentException;
import com.ryuqq.workflow.core.exception.WorkflowException;
import com.ryuqq.workflow.core.exception.WorkflowNotFoundException;
import com.ryuqq.workflow.core.model.TemplateSummary;
import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.model.WorkflowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 불투명 문자열 ID 기반 요청/응답 제어 표면.
 *
 * <p>모든 호출은 {@link ControlResponse}를 반환하며 예외를 호출자에게 던지지 않습니다.</p>
 *
 * <p><strong>오류 변환:</strong></p>
 * <ul>
 *   <li>{@link WorkflowException} → 해당 오류 코드의 실패 응답</li>
 *   <li>그 외 RuntimeException → {@value #INTERNAL_ERROR_CODE} 실패 응답 (ERROR 로그)</li>
 *   <li>status / pause / resume / continue의 null, 빈 값, 형식에 맞지 않는 ID → WF-404</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowControlFacade {

    public static final String INTERNAL_ERROR_CODE = "WF-500";

    private static final Logger log = LoggerFactory.getLogger(WorkflowControlFacade.class);

    private final WorkflowCoordinator coordinator;

    /**
     * 생성자.
     *
     * @param coordinator 워크플로우 조정자
     * @throws IllegalArgumentException coordinator가 null인 경우
     */
    public WorkflowControlFacade(WorkflowCoordinator coordinator) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        this.coordinator = coordinator;
    }

    /**
     * 워크플로우 생성 후 실행.
     *
     * @param workflowType 워크플로우 종류
     * @param projectType 프로젝트 종류 (null이면 기본값)
     * @param buildingCode 건축 법규 (null이면 기본값)
     * @param customParameters 호출자 지정 파라미터 (null 가능)
     * @return 실행 요약 응답
     */
    public ControlResponse<WorkflowSummary> execute(String workflowType, String projectType,
                                                    String buildingCode, Map<String, Object> customParameters) {
        return handle("execute", () -> coordinator.createAndRun(
            new StartWorkflowCommand(workflowType, projectType, buildingCode, customParameters)));
    }

    /**
     * 단일 워크플로우 상태 조회.
     *
     * @param workflowId 워크플로우 ID
     * @return 스냅샷 응답
     */
    public ControlResponse<WorkflowSnapshot> status(String workflowId) {
        return handle("status", () -> coordinator.getStatus(requireId(workflowId)));
    }

    /**
     * 등록된 전체 워크플로우 개요.
     *
     * @return 개요 목록 응답
     */
    public ControlResponse<List<WorkflowOverview>> listStatus() {
        return handle("listStatus", coordinator::listWorkflows);
    }

    /**
     * 일시 정지.
     *
     * @param workflowId 워크플로우 ID
     * @return 변경 후 스냅샷 응답
     */
    public ControlResponse<WorkflowSnapshot> pause(String workflowId) {
        return handle("pause", () -> coordinator.pause(requireId(workflowId)));
    }

    /**
     * 재개.
     *
     * @param workflowId 워크플로우 ID
     * @return 변경 후 스냅샷 응답
     */
    public ControlResponse<WorkflowSnapshot> resume(String workflowId) {
        return handle("resume", () -> coordinator.resume(requireId(workflowId)));
    }

    /**
     * 남은 Phase 실행.
     *
     * @param workflowId 워크플로우 ID
     * @return 실행 요약 응답
     */
    public ControlResponse<WorkflowSummary> continueWorkflow(String workflowId) {
        return handle("continue", () -> coordinator.continueWorkflow(requireId(workflowId)));
    }

    /**
     * 템플릿 목록.
     *
     * @return 템플릿 요약 목록 응답
     */
    public ControlResponse<List<TemplateSummary>> listTemplates() {
        return handle("listTemplates", coordinator::listTemplates);
    }

    private static WorkflowId requireId(String workflowId) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new WorkflowNotFoundException(String.valueOf(workflowId));
        }
        try {
            return WorkflowId.of(workflowId);
        } catch (InvalidWorkflowArgumentException e) {
            throw new WorkflowNotFoundException(workflowId);
        }
    }

    private <T> ControlResponse<T> handle(String action, Supplier<? extends T> call) {
        try {
            return ControlResponse.ok(call.get());
        } catch (WorkflowException e) {
            log.warn("Workflow {} rejected: {} {}", action, e.getErrorCode(), e.getMessage());
            return ControlResponse.fail(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Workflow {} failed unexpectedly", action, e);
            return ControlResponse.fail(INTERNAL_ERROR_CODE, e.getMessage());
        }
    }
}
