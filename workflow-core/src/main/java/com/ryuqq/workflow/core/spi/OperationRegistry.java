package com.ryuqq.workflow.core.spi;

import java.util.Optional;
import java.util.Set;

/**
 * 이름 → Operation 조회 테이블.
 *
 * <p>호스트 애플리케이션이 기동 시 한 번 구성하며, 워크플로우 엔진은 조회만 합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>대소문자 구분 없는 조회</li>
 *   <li>Thread-safe: 여러 워크플로우가 동시에 조회 가능</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OperationRegistry {

    /**
     * Operation 조회.
     *
     * @param name Operation 이름 (대소문자 무관)
     * @return Operation (없으면 empty)
     */
    Optional<Operation> lookup(String name);

    /**
     * 등록된 이름 목록 (소문자, 별칭 포함).
     *
     * @return 읽기 전용 Set
     */
    Set<String> names();
}
