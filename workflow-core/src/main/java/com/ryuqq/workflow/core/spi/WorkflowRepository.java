package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.model.WorkflowState;

import java.util.Collection;
import java.util.Optional;

/**
 * 살아 있는 워크플로우 레지스트리 SPI.
 *
 * <p>생성/조회가 서로 경쟁할 수 있으므로 구현체는 반드시 thread-safe해야 합니다.
 * 프로세스 수명을 넘는 영속화는 요구하지 않습니다.</p>
 *
 * <p>정적 전역 테이블이 아니라 서비스 인스턴스가 소유하고 주입받는 저장소입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowRepository {

    /**
     * 워크플로우 등록. 등록 즉시 동시 조회에 보입니다.
     *
     * @param state 워크플로우 상태
     * @throws IllegalArgumentException state가 null인 경우
     * @throws IllegalStateException 같은 ID가 이미 등록된 경우
     */
    void register(WorkflowState state);

    /**
     * ID로 조회.
     *
     * @param workflowId 워크플로우 ID
     * @return 상태 (없으면 empty)
     */
    Optional<WorkflowState> find(WorkflowId workflowId);

    /**
     * 전체 조회 (시작 시각 순).
     *
     * @return 읽기 전용 컬렉션
     */
    Collection<WorkflowState> findAll();

    /**
     * 등록된 워크플로우 수.
     *
     * @return 개수
     */
    int size();
}
