package com.ryuqq.workflow.core.spi;

import com.ryuqq.workflow.core.outcome.OperationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 이름으로 호출되는 외부 Operation.
 *
 * <p>문서 조회/변경 등 실제 도메인 작업을 수행하고 구조화된 결과를 반환합니다.
 * 워크플로우 엔진은 결과의 성공 여부, 오류, 잘 알려진 출력 필드만 해석합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>동기 호출이며 호출 스레드를 블로킹합니다.</li>
 *   <li>실패는 {@link OperationResult#failure(String)}로 반환하는 것을 권장합니다.
 *       RuntimeException을 던져도 Task 실패로 기록될 뿐 Phase는 중단되지 않습니다.</li>
 *   <li>parameters는 호출마다 새로 만든 Map이므로 구현체가 보관해도 안전합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation {

    /**
     * Operation 호출.
     *
     * @param context 호출 컨텍스트 (워크플로우 ID, Task ID)
     * @param parameters Task 파라미터 (context 주입 반영)
     * @return 호출 결과 (null 반환 시 실패로 처리됨)
     */
    OperationResult invoke(OperationContext context, Map<String, Object> parameters);

    /**
     * 고정 파라미터가 미리 채워진 Operation 생성.
     *
     * <p>고정 파라미터는 Task 파라미터보다 우선합니다.
     * 예: {@code tagAllByCategory.withParameters(Map.of("category", "Rooms"))} → tagAllRooms</p>
     *
     * @param fixed 고정 파라미터
     * @return 파생 Operation
     */
    default Operation withParameters(Map<String, Object> fixed) {
        if (fixed == null) {
            throw new IllegalArgumentException("fixed parameters cannot be null");
        }
        Map<String, Object> preset = new LinkedHashMap<>(fixed);
        return (context, parameters) -> {
            Map<String, Object> merged = new LinkedHashMap<>(parameters == null ? Map.of() : parameters);
            merged.putAll(preset);
            return invoke(context, merged);
        };
    }
}
