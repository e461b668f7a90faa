package com.ryuqq.workflow.core.model;

import com.ryuqq.workflow.core.exception.InvalidWorkflowArgumentException;

import java.util.UUID;

/**
 * 워크플로우의 전역 고유 식별자.
 *
 * <p>호출자에게는 불투명한(opaque) 문자열로 노출되며,
 * status / pause / resume 요청의 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowId {

    private final String value;

    private WorkflowId(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidWorkflowArgumentException("WorkflowId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new InvalidWorkflowArgumentException("WorkflowId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * 외부 문자열로부터 WorkflowId 생성.
     *
     * @param value WorkflowId 값
     * @return WorkflowId 인스턴스
     * @throws InvalidWorkflowArgumentException 유효하지 않은 값인 경우
     */
    public static WorkflowId of(String value) {
        return new WorkflowId(value);
    }

    /**
     * 새로운 WorkflowId 발급 (UUID 기반).
     *
     * @return 새 WorkflowId
     */
    public static WorkflowId generate() {
        return new WorkflowId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowId that = (WorkflowId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
