package com.ryuqq.workflow.adapter.inmemory.registry;

/**
 * 워크플로우 레지스트리 보존 정책.
 *
 * <p>등록 수가 {@code maxRetainedWorkflows}를 넘으면 완료된 워크플로우 중 가장 오래된 것부터 제거합니다.
 * 실행 중이거나 일시 정지된 워크플로우는 제거 대상이 아닙니다.</p>
 *
 * <p>0은 제한 없음을 의미합니다.</p>
 *
 * @param maxRetainedWorkflows 최대 보존 개수 (0 = 무제한)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetentionPolicy(
    int maxRetainedWorkflows
) {

    public static final int UNBOUNDED = 0;

    /**
     * Compact Constructor (유효성 검증).
     *
     * @throws IllegalArgumentException maxRetainedWorkflows가 음수인 경우
     */
    public RetentionPolicy {
        if (maxRetainedWorkflows < 0) {
            throw new IllegalArgumentException("maxRetainedWorkflows must be non-negative");
        }
    }

    /**
     * 기본 생성자 (제한 없음).
     */
    public RetentionPolicy() {
        this(UNBOUNDED);
    }

    public boolean isBounded() {
        return maxRetainedWorkflows != UNBOUNDED;
    }

    public RetentionPolicy withMaxRetainedWorkflows(int maxRetainedWorkflows) {
        return new RetentionPolicy(maxRetainedWorkflows);
    }
}
