package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.application.coordinator.PhaseSummary;
import com.ryuqq.workflow.core.model.PhaseDefinition;
import com.ryuqq.workflow.core.model.TaskDefinition;
import com.ryuqq.workflow.core.model.WorkflowState;
import com.ryuqq.workflow.core.outcome.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Phase 하나의 Task들을 선언 순서대로 실행합니다.
 *
 * <p>실행은 상태의 Task 커서에서 시작하므로, Phase 중간에 일시 정지된 워크플로우는
 * 다음 미실행 Task부터 이어서 실행됩니다. 각 Task 후 일시 정지 여부를 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseExecutor {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final TaskExecutor taskExecutor;

    public PhaseExecutor(TaskExecutor taskExecutor) {
        if (taskExecutor == null) {
            throw new IllegalArgumentException("taskExecutor cannot be null");
        }
        this.taskExecutor = taskExecutor;
    }

    /**
     * Phase 실행.
     *
     * @param state 워크플로우 상태
     * @param phase 실행할 Phase
     * @return 이번 실행에서의 Phase 요약 (decisionsCount는 워크플로우 누적값)
     */
    public PhaseSummary execute(WorkflowState state, PhaseDefinition phase) {
        state.enterPhase(phase.name());
        log.info("[PHASE] Starting: {} ({} tasks)", phase.name(), phase.tasks().size());

        int completed = 0;
        int failed = 0;
        List<TaskDefinition> tasks = phase.tasks();
        for (int i = state.getTaskIndex(); i < tasks.size(); i++) {
            TaskDefinition task = tasks.get(i);
            TaskResult result = taskExecutor.execute(state, task);
            if (result.success()) {
                state.recordSuccess(task.description(), result.decision());
                completed++;
            } else {
                state.recordFailure(task.description(), result.error());
                failed++;
            }

            if (state.isPaused()) {
                log.info("[PHASE] {} paused after task {}", phase.name(), task.id());
                break;
            }
        }

        return new PhaseSummary(completed, failed, state.getDecisionCount());
    }
}
