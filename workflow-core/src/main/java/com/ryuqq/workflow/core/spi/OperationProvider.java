package com.ryuqq.workflow.core.spi;

/**
 * Operation을 제공하는 모듈의 진입점.
 *
 * <p>각 모듈이 기동 시 자신을 등록합니다. {@link java.util.ServiceLoader}로 발견되려면
 * {@code META-INF/services/com.ryuqq.workflow.core.spi.OperationProvider}에 구현 클래스를 선언합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OperationProvider {

    /**
     * Operation 등록.
     *
     * @param registrar 등록 창구
     */
    void registerOperations(OperationRegistrar registrar);
}
