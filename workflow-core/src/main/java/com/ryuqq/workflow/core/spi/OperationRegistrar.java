package com.ryuqq.workflow.core.spi;

/**
 * Operation 등록 창구.
 *
 * <p>{@link OperationProvider}가 자신의 Operation을 등록할 때 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OperationRegistrar {

    /**
     * Operation 등록.
     *
     * @param name 이름 (대소문자 무관)
     * @param operation Operation
     * @return this
     * @throws IllegalArgumentException name 또는 operation이 null인 경우
     * @throws IllegalStateException 같은 이름이 이미 등록된 경우
     */
    OperationRegistrar register(String name, Operation operation);

    /**
     * 기존 Operation에 별칭 부여.
     *
     * @param alias 별칭
     * @param target 이미 등록된 이름
     * @return this
     * @throws IllegalStateException target이 등록되지 않았거나 alias가 이미 사용 중인 경우
     */
    OperationRegistrar alias(String alias, String target);
}
