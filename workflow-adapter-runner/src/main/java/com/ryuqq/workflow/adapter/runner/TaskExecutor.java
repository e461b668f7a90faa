package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.core.model.TaskDefinition;
import com.ryuqq.workflow.core.model.WorkflowDecision;
import com.ryuqq.workflow.core.model.WorkflowState;
import com.ryuqq.workflow.core.outcome.OperationFailure;
import com.ryuqq.workflow.core.outcome.OperationResult;
import com.ryuqq.workflow.core.outcome.OperationSuccess;
import com.ryuqq.workflow.core.outcome.TaskResult;
import com.ryuqq.workflow.core.spi.Operation;
import com.ryuqq.workflow.core.spi.OperationContext;
import com.ryuqq.workflow.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Task 하나를 실행하고 결과를 {@link TaskResult}로 변환합니다.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>custom Task (method 비어 있음 또는 "custom"): 호출 없이 성공, 결정 기록</li>
 *   <li>context 주입: Task 파라미터 사본에 없는 전달 필드를 context의 {@code last*} 값으로 채움</li>
 *   <li>Registry 조회 (대소문자 무시), 미등록이면 실패</li>
 *   <li>Operation 호출. 예외와 null 결과는 실패로 변환</li>
 *   <li>성공 시 전달 필드를 context에 기록하고, 힌트가 있으면 결정 생성</li>
 * </ol>
 *
 * <p>어떤 경우에도 예외를 던지지 않으며, Task 결과는 항상 성공 또는 실패 중 하나입니다.
 * completedTasks / failedTasks 기록은 {@link PhaseExecutor}가 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    public static final String CUSTOM_TASK_DECISION = "Custom task - marked for future implementation";

    private final OperationRegistry operationRegistry;
    private final CoordinatorConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param operationRegistry Operation Registry
     * @param config 설정
     * @param clock 결정 시각 기준 Clock
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TaskExecutor(OperationRegistry operationRegistry, CoordinatorConfig config, Clock clock) {
        if (operationRegistry == null) {
            throw new IllegalArgumentException("operationRegistry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.operationRegistry = operationRegistry;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Task 실행.
     *
     * @param state 워크플로우 상태 (context 조회 및 기록)
     * @param task 실행할 Task
     * @return TaskResult (성공 또는 실패)
     */
    public TaskResult execute(WorkflowState state, TaskDefinition task) {
        log.info("[TASK] Executing {}: {}", task.id(), task.description());

        if (task.isCustom()) {
            String reason = task.hasDecisionHint() ? task.autonomousDecision() : config.customTaskDefaultReason();
            WorkflowDecision decision = decide(task, CUSTOM_TASK_DECISION, reason);
            log.info("[DECISION] {} - {}", decision.decision(), decision.reason());
            return TaskResult.succeeded(decision);
        }

        OperationResult result;
        try {
            Map<String, Object> parameters = injectContext(state, task.parameters());

            Optional<Operation> operation = operationRegistry.lookup(task.method());
            if (operation.isEmpty()) {
                return fail(task, "Method '" + task.method() + "' not implemented in workflow routing");
            }

            result = operation.get().invoke(
                new OperationContext(state.getId(), state.getWorkflowType(), task.id()), parameters);
        } catch (RuntimeException e) {
            log.error("[TASK] Dispatch of {} threw for task {}", task.method(), task.id(), e);
            String message = e.getMessage();
            return fail(task, message == null || message.isBlank() ? e.getClass().getName() : message);
        }

        if (result == null) {
            return fail(task, "Operation '" + task.method() + "' returned no result");
        }
        if (result instanceof OperationFailure failure) {
            return fail(task, failure.error());
        }

        propagate(state, (OperationSuccess) result);

        WorkflowDecision decision = null;
        if (task.hasDecisionHint()) {
            decision = decide(task, "Executed " + task.method() + " successfully", task.autonomousDecision());
            log.info("[DECISION] {} - {}", decision.decision(), decision.reason());
        }
        return TaskResult.succeeded(decision);
    }

    private Map<String, Object> injectContext(WorkflowState state, Map<String, Object> taskParameters) {
        Map<String, Object> parameters = new LinkedHashMap<>(taskParameters);
        for (String field : config.contextPropagation().fields()) {
            String contextKey = ContextPropagation.contextKeyFor(field);
            if (!parameters.containsKey(field) && state.hasContextValue(contextKey)) {
                parameters.put(field, state.getContextValue(contextKey));
            }
        }
        return parameters;
    }

    private void propagate(WorkflowState state, OperationSuccess success) {
        for (String field : config.contextPropagation().fields()) {
            Object value = success.data().get(field);
            if (value != null) {
                state.putContext(ContextPropagation.contextKeyFor(field), value);
            }
        }
    }

    private WorkflowDecision decide(TaskDefinition task, String decision, String reason) {
        return new WorkflowDecision(task.id(), decision, reason, clock.instant());
    }

    private static TaskResult fail(TaskDefinition task, String error) {
        log.warn("[TASK] {} failed: {}", task.id(), error);
        return TaskResult.failed(error);
    }
}
