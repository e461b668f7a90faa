package com.ryuqq.workflow.core.model;

import com.ryuqq.workflow.core.exception.WorkflowStateException;
import com.ryuqq.workflow.core.statemachine.StatusTransition;
import com.ryuqq.workflow.core.statemachine.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 실행 중이거나 완료된 워크플로우 하나의 상태.
 *
 * <p><strong>불변 필드:</strong> id, workflowType, projectType, buildingCode, startTime, template</p>
 *
 * <p><strong>가변 필드 (append-only 또는 전진 전용):</strong></p>
 * <ul>
 *   <li>completedTasks / failedTasks / decisions: 실행 순서대로 추가만 가능</li>
 *   <li>context: last-write-wins, 삭제 없음</li>
 *   <li>실행 커서 (phaseIndex, taskIndex): 전진만 가능</li>
 *   <li>status: {@link StatusTransition} 규칙을 따름</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 모든 변경은 synchronized 메서드 한 번으로 적용됩니다.
 * 예를 들어 Task 성공 기록은 completedTasks 추가, decision 추가, 커서 전진을
 * 한 단계로 수행하므로 동시 status 조회가 중간 상태를 보지 못합니다.
 * Operation 호출 동안에는 락을 잡지 않습니다.</p>
 *
 * <p><strong>실행 래치:</strong> 하나의 워크플로우는 한 번에 하나의 스레드만 구동할 수 있습니다
 * ({@link #beginExecution()} / {@link #endExecution()}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowState {

    private final WorkflowId id;
    private final WorkflowTemplate template;
    private final String workflowType;
    private final String projectType;
    private final String buildingCode;
    private final Instant startTime;

    private final List<String> completedTasks = new ArrayList<>();
    private final List<String> failedTasks = new ArrayList<>();
    private final List<WorkflowDecision> decisions = new ArrayList<>();
    private final Map<String, Object> context = new LinkedHashMap<>();

    private String currentPhase;
    private int phaseIndex;
    private int taskIndex;
    private boolean paused;
    private boolean executing;
    private WorkflowStatus status = WorkflowStatus.RUNNING;

    /**
     * 생성자.
     *
     * <p>context는 projectType, buildingCode, customParameters로 초기화됩니다.</p>
     *
     * @param id 워크플로우 ID
     * @param template 해석이 끝난 템플릿
     * @param workflowType 워크플로우 종류
     * @param projectType 프로젝트 종류
     * @param buildingCode 적용 건축 법규
     * @param customParameters 호출자 지정 파라미터
     * @param startTime 생성 시각
     * @throws IllegalArgumentException 필수 인자가 null인 경우
     */
    public WorkflowState(WorkflowId id, WorkflowTemplate template, String workflowType, String projectType,
                         String buildingCode, Map<String, Object> customParameters, Instant startTime) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        if (workflowType == null || workflowType.isBlank()) {
            throw new IllegalArgumentException("workflowType cannot be null or blank");
        }
        if (startTime == null) {
            throw new IllegalArgumentException("startTime cannot be null");
        }
        this.id = id;
        this.template = template;
        this.workflowType = workflowType;
        this.projectType = projectType;
        this.buildingCode = buildingCode;
        this.startTime = startTime;

        context.put("projectType", projectType);
        context.put("buildingCode", buildingCode);
        context.put("customParameters", customParameters == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customParameters)));
    }

    public WorkflowId getId() {
        return id;
    }

    public WorkflowTemplate getTemplate() {
        return template;
    }

    public String getWorkflowType() {
        return workflowType;
    }

    public String getProjectType() {
        return projectType;
    }

    public String getBuildingCode() {
        return buildingCode;
    }

    public Instant getStartTime() {
        return startTime;
    }

    // ========== 실행 래치 ==========

    /**
     * 구동 시작 (현재 스레드가 이 워크플로우의 유일한 실행자가 됨).
     *
     * @throws WorkflowStateException 이미 구동 중이거나, 일시 정지 또는 완료 상태인 경우
     */
    public synchronized void beginExecution() {
        if (executing) {
            throw new WorkflowStateException("Workflow " + id + " is already executing");
        }
        if (status.isTerminal()) {
            throw new WorkflowStateException("Workflow " + id + " has already completed: " + status);
        }
        if (paused) {
            throw new WorkflowStateException("Workflow " + id + " is paused; resume it before continuing");
        }
        executing = true;
    }

    /**
     * 구동 종료.
     */
    public synchronized void endExecution() {
        executing = false;
    }

    public synchronized boolean isExecuting() {
        return executing;
    }

    // ========== 실행 커서 ==========

    /**
     * Phase 진입 기록.
     *
     * @param phaseName Phase 이름
     */
    public synchronized void enterPhase(String phaseName) {
        this.currentPhase = phaseName;
    }

    /**
     * 다음 Phase로 커서 이동 (Task 커서는 0으로 초기화).
     */
    public synchronized void advancePhase() {
        phaseIndex++;
        taskIndex = 0;
    }

    public synchronized int getPhaseIndex() {
        return phaseIndex;
    }

    public synchronized int getTaskIndex() {
        return taskIndex;
    }

    /**
     * 모든 Phase가 실행되었는지 확인.
     *
     * @return 커서가 마지막 Phase를 지났으면 true
     */
    public synchronized boolean isExhausted() {
        return phaseIndex >= template.phases().size();
    }

    // ========== Task 결과 기록 ==========

    /**
     * Task 성공 기록 (completedTasks 추가, decision 추가, Task 커서 전진).
     *
     * @param description Task 설명
     * @param decisionOrNull 기록할 결정 (없으면 null)
     */
    public synchronized void recordSuccess(String description, WorkflowDecision decisionOrNull) {
        completedTasks.add(description);
        if (decisionOrNull != null) {
            decisions.add(decisionOrNull);
        }
        taskIndex++;
    }

    /**
     * Task 실패 기록 (failedTasks 추가, Task 커서 전진).
     *
     * <p>기록 형식: {@code "<description> - <error>"}</p>
     *
     * @param description Task 설명
     * @param error 오류 메시지
     */
    public synchronized void recordFailure(String description, String error) {
        failedTasks.add(error == null ? description : description + " - " + error);
        taskIndex++;
    }

    public synchronized int getCompletedCount() {
        return completedTasks.size();
    }

    public synchronized int getFailedCount() {
        return failedTasks.size();
    }

    public synchronized int getDecisionCount() {
        return decisions.size();
    }

    // ========== Context ==========

    /**
     * context 값 기록 (last-write-wins).
     *
     * @param key 키 (예: lastSheetId)
     * @param value 값
     */
    public synchronized void putContext(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("context key cannot be null");
        }
        context.put(key, value);
    }

    /**
     * context 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 null)
     */
    public synchronized Object getContextValue(String key) {
        return context.get(key);
    }

    public synchronized boolean hasContextValue(String key) {
        return context.containsKey(key);
    }

    // ========== 상태 ==========

    /**
     * 일시 정지 (멱등).
     *
     * <p>진행 중인 Task를 중단하지 않으며, 구동 스레드가 다음 Task/Phase 경계에서 관찰합니다.</p>
     *
     * @throws WorkflowStateException 완료 상태인 경우
     */
    public synchronized void pause() {
        status = StatusTransition.transition(status, WorkflowStatus.PAUSED);
        paused = true;
    }

    /**
     * 재개 (멱등). 남은 Phase 실행은 별도의 구동 호출이 필요합니다.
     *
     * @throws WorkflowStateException 완료 상태인 경우
     */
    public synchronized void resume() {
        status = StatusTransition.transition(status, WorkflowStatus.RUNNING);
        paused = false;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public synchronized WorkflowStatus getStatus() {
        return status;
    }

    public synchronized String getCurrentPhase() {
        return currentPhase;
    }

    /**
     * 구동 종료 시 최종 상태 결정.
     *
     * <p>일시 정지되었거나 남은 Phase가 있으면 상태를 유지하고,
     * 모든 Phase를 마쳤으면 실패 여부에 따라 완료 상태로 전이합니다.</p>
     *
     * @return 결정된 상태
     */
    public synchronized WorkflowStatus settle() {
        if (!paused && isExhausted()) {
            status = StatusTransition.transition(status, WorkflowStatus.completed(!failedTasks.isEmpty()));
        }
        return status;
    }

    /**
     * 불변 스냅샷 생성.
     *
     * @param now 기준 시각 (runtime 계산용)
     * @return WorkflowSnapshot
     */
    public synchronized WorkflowSnapshot snapshot(Instant now) {
        return new WorkflowSnapshot(
            id,
            workflowType,
            projectType,
            buildingCode,
            startTime,
            currentPhase,
            status,
            paused,
            completedTasks,
            failedTasks,
            decisions,
            context,
            Duration.between(startTime, now)
        );
    }

    @Override
    public synchronized String toString() {
        return "WorkflowState{" + id + ", " + workflowType + ", " + status + ", phase=" + currentPhase + '}';
    }
}
