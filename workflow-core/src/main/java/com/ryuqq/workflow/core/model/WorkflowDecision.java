package com.ryuqq.workflow.core.model;

import java.time.Instant;

/**
 * 자율 결정 감사(audit) 기록.
 *
 * <p>Task 실행에 귀속되는 결정으로, Operation 자체가 결정을 내렸는지와는 무관합니다.</p>
 *
 * @param task Task ID
 * @param decision 결정 내용
 * @param reason 근거 (템플릿의 autonomous_decision 힌트)
 * @param timestamp 기록 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowDecision(
    String task,
    String decision,
    String reason,
    Instant timestamp
) {

    public WorkflowDecision {
        if (decision == null || decision.isBlank()) {
            throw new IllegalArgumentException("decision cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
