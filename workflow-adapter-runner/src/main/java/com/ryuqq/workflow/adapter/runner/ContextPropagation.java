package com.ryuqq.workflow.adapter.runner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Task 간 자동 전달되는 출력 필드 설정 (불변 record).
 *
 * <p>Operation 결과의 필드 {@code sheetId}는 context에 {@code lastSheetId}로 저장되고,
 * 이후 Task의 파라미터에 {@code sheetId}가 없으면 그 값이 주입됩니다.</p>
 *
 * <p>기본 필드: scheduleId, sheetId, viewId. 빈 목록은 전달 비활성화를 의미합니다.</p>
 *
 * @param fields 전달 대상 필드 이름 (순서 유지, 중복 제거)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ContextPropagation(
    List<String> fields
) {

    public static final List<String> DEFAULT_FIELDS = List.of("scheduleId", "sheetId", "viewId");

    private static final String CONTEXT_KEY_PREFIX = "last";

    /**
     * Compact Constructor (유효성 검증).
     *
     * @throws IllegalArgumentException fields가 null이거나 빈 이름을 포함하는 경우
     */
    public ContextPropagation {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        for (String field : fields) {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("field name cannot be null or blank");
            }
        }
        fields = List.copyOf(new LinkedHashSet<>(fields));
    }

    /**
     * 기본 설정 생성자 (scheduleId, sheetId, viewId).
     */
    public ContextPropagation() {
        this(DEFAULT_FIELDS);
    }

    public static ContextPropagation of(String... fields) {
        return new ContextPropagation(Arrays.asList(fields));
    }

    public static ContextPropagation none() {
        return new ContextPropagation(List.of());
    }

    /**
     * 필드 하나를 추가한 새 인스턴스 생성.
     */
    public ContextPropagation withField(String field) {
        List<String> extended = new ArrayList<>(fields);
        extended.add(field);
        return new ContextPropagation(extended);
    }

    /**
     * 필드에 대응하는 context 키 ({@code sheetId} → {@code lastSheetId}).
     *
     * @param field 필드 이름
     * @return context 키
     */
    public static String contextKeyFor(String field) {
        if (field == null || field.isEmpty()) {
            throw new IllegalArgumentException("field cannot be null or empty");
        }
        return CONTEXT_KEY_PREFIX + field.substring(0, 1).toUpperCase(Locale.ROOT) + field.substring(1);
    }
}
