package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.application.coordinator.PhaseSummary;
import com.ryuqq.workflow.application.coordinator.StartWorkflowCommand;
import com.ryuqq.workflow.application.coordinator.WorkflowCoordinator;
import com.ryuqq.workflow.application.coordinator.WorkflowOverview;
import com.ryuqq.workflow.application.coordinator.WorkflowSummary;
import com.ryuqq.workflow.core.exception.WorkflowNotFoundException;
import com.ryuqq.workflow.core.model.PhaseDefinition;
import com.ryuqq.workflow.core.model.TemplateSummary;
import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.model.WorkflowSnapshot;
import com.ryuqq.workflow.core.model.WorkflowState;
import com.ryuqq.workflow.core.model.WorkflowTemplate;
import com.ryuqq.workflow.core.spi.OperationRegistry;
import com.ryuqq.workflow.core.spi.TemplateStore;
import com.ryuqq.workflow.core.spi.WorkflowRepository;
import com.ryuqq.workflow.core.statemachine.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 호출 스레드에서 Phase를 순차 실행하는 {@link WorkflowCoordinator} 구현체.
 *
 * <p><strong>createAndRun 동작 방식:</strong></p>
 * <ol>
 *   <li>템플릿 해석 (실패 시 워크플로우를 등록하지 않고 예외 전파)</li>
 *   <li>WorkflowState 생성 및 Registry 등록</li>
 *   <li>Phase 순차 실행. 각 Task 후와 각 Phase 후에 일시 정지 여부 확인</li>
 *   <li>최종 상태 결정: 일시 정지면 Paused, 실패가 있으면 Completed with errors,
 *       아니면 Completed successfully</li>
 *   <li>요약 반환</li>
 * </ol>
 *
 * <p><strong>일시 정지와 재개:</strong></p>
 * <ul>
 *   <li>pause는 진행 중인 Task를 중단하지 않습니다 (협조적 정지).</li>
 *   <li>resume은 상태만 되돌립니다. 남은 Phase는 {@link #continueWorkflow(WorkflowId)}로 실행합니다.</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 서로 다른 워크플로우는 독립적으로 실행/조회할 수 있으며,
 * 하나의 워크플로우는 한 번에 하나의 스레드만 구동합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InlineWorkflowCoordinator implements WorkflowCoordinator {

    private static final Logger log = LoggerFactory.getLogger(InlineWorkflowCoordinator.class);

    private final TemplateStore templateStore;
    private final WorkflowRepository repository;
    private final PhaseExecutor phaseExecutor;
    private final Clock clock;

    /**
     * 생성자 (기본 설정, UTC 시스템 시계).
     *
     * @param templateStore 템플릿 저장소
     * @param operationRegistry Operation Registry
     * @param repository 워크플로우 Registry
     */
    public InlineWorkflowCoordinator(TemplateStore templateStore, OperationRegistry operationRegistry,
                                     WorkflowRepository repository) {
        this(templateStore, operationRegistry, repository, new CoordinatorConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param templateStore 템플릿 저장소
     * @param operationRegistry Operation Registry
     * @param repository 워크플로우 Registry
     * @param config 설정
     * @param clock 시각 기준
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InlineWorkflowCoordinator(TemplateStore templateStore, OperationRegistry operationRegistry,
                                     WorkflowRepository repository, CoordinatorConfig config, Clock clock) {
        if (templateStore == null) {
            throw new IllegalArgumentException("templateStore cannot be null");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.templateStore = templateStore;
        this.repository = repository;
        this.clock = clock;
        this.phaseExecutor = new PhaseExecutor(new TaskExecutor(operationRegistry, config, clock));
    }

    @Override
    public WorkflowSummary createAndRun(StartWorkflowCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }

        WorkflowTemplate template = templateStore.load(command.workflowType(), command.projectType());

        WorkflowState state = new WorkflowState(
            WorkflowId.generate(),
            template,
            command.workflowType(),
            command.projectType(),
            command.buildingCode(),
            command.customParameters(),
            clock.instant()
        );
        repository.register(state);
        log.info("[WORKFLOW] Started {} ({}): type={}, project={}, phases={}",
            state.getId(), template.name(), command.workflowType(), command.projectType(),
            template.phases().size());

        return drive(state);
    }

    @Override
    public WorkflowSummary continueWorkflow(WorkflowId workflowId) {
        WorkflowState state = require(workflowId);
        log.info("[WORKFLOW] Continuing {} from phase index {}", workflowId, state.getPhaseIndex());
        return drive(state);
    }

    @Override
    public WorkflowSnapshot getStatus(WorkflowId workflowId) {
        return require(workflowId).snapshot(clock.instant());
    }

    @Override
    public List<WorkflowOverview> listWorkflows() {
        Instant now = clock.instant();
        return repository.findAll().stream()
            .map(state -> WorkflowOverview.from(state.snapshot(now)))
            .collect(Collectors.toList());
    }

    @Override
    public WorkflowSnapshot pause(WorkflowId workflowId) {
        WorkflowState state = require(workflowId);
        state.pause();
        log.info("[WORKFLOW] Paused {}", workflowId);
        return state.snapshot(clock.instant());
    }

    @Override
    public WorkflowSnapshot resume(WorkflowId workflowId) {
        WorkflowState state = require(workflowId);
        state.resume();
        log.info("[WORKFLOW] Resumed {}", workflowId);
        return state.snapshot(clock.instant());
    }

    @Override
    public List<TemplateSummary> listTemplates() {
        return templateStore.list();
    }

    private WorkflowState require(WorkflowId workflowId) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        return repository.find(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId.getValue()));
    }

    /**
     * 커서 위치부터 Phase를 실행합니다.
     */
    private WorkflowSummary drive(WorkflowState state) {
        state.beginExecution();
        Instant runStart = clock.instant();
        Map<String, PhaseSummary> phaseSummaries = new LinkedHashMap<>();
        WorkflowStatus status;
        try {
            List<PhaseDefinition> phases = state.getTemplate().phases();
            while (!state.isExhausted()) {
                PhaseDefinition phase = phases.get(state.getPhaseIndex());
                phaseSummaries.put(phase.name(), phaseExecutor.execute(state, phase));

                if (state.getTaskIndex() >= phase.tasks().size()) {
                    state.advancePhase();
                }
                if (state.isPaused()) {
                    log.info("[WORKFLOW] {} paused at phase {}", state.getId(), phase.name());
                    break;
                }
            }
            status = state.settle();
        } finally {
            state.endExecution();
        }

        Duration executionTime = Duration.between(runStart, clock.instant());
        log.info("[WORKFLOW] {} {}: completed={}, failed={}, decisions={}, elapsed={}ms",
            state.getId(), status, state.getCompletedCount(), state.getFailedCount(),
            state.getDecisionCount(), executionTime.toMillis());

        return new WorkflowSummary(
            state.getId(),
            state.getWorkflowType(),
            status,
            phaseSummaries,
            state.getCompletedCount(),
            state.getFailedCount(),
            state.getDecisionCount(),
            executionTime
        );
    }
}
