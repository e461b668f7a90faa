package com.ryuqq.workflow.core.statemachine;

/**
 * 워크플로우의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>RUNNING → PAUSED (pause 요청, 경계에서 관찰)</li>
 *   <li>PAUSED → RUNNING (resume 요청)</li>
 *   <li>RUNNING → COMPLETED_SUCCESSFULLY (실패 Task 없음)</li>
 *   <li>RUNNING → COMPLETED_WITH_ERRORS (실패 Task 1개 이상)</li>
 *   <li><strong>완료 상태에서는 어떤 전이도 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * RUNNING ◄──────► PAUSED
 *    │   (pause/resume)
 *    ├─► COMPLETED_SUCCESSFULLY
 *    │
 *    └─► COMPLETED_WITH_ERRORS
 *
 * 금지된 전이:
 * - COMPLETED_* → RUNNING ❌
 * - COMPLETED_* → PAUSED ❌
 * - PAUSED → COMPLETED_* ❌ (resume 후 남은 Phase를 끝내야 완료)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowStatus {

    /**
     * 실행 중 (또는 resume 후 재구동 대기).
     */
    RUNNING("Running"),

    /**
     * 일시 정지.
     */
    PAUSED("Paused"),

    /**
     * 모든 Phase 완료, 실패 Task 없음.
     */
    COMPLETED_SUCCESSFULLY("Completed successfully"),

    /**
     * 모든 Phase 완료, 실패 Task 1개 이상.
     */
    COMPLETED_WITH_ERRORS("Completed with errors");

    private final String displayName;

    WorkflowStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 외부에 노출되는 상태 문자열.
     *
     * @return 예: "Completed with errors"
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED_SUCCESSFULLY 또는 COMPLETED_WITH_ERRORS인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED_SUCCESSFULLY || this == COMPLETED_WITH_ERRORS;
    }

    /**
     * 실패 여부에 따른 종료 상태 선택.
     *
     * @param anyFailures 실패 Task 존재 여부
     * @return 종료 상태
     */
    public static WorkflowStatus completed(boolean anyFailures) {
        return anyFailures ? COMPLETED_WITH_ERRORS : COMPLETED_SUCCESSFULLY;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
