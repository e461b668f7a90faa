package com.ryuqq.workflow.adapter.inmemory.operation;

import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.outcome.OperationResult;
import com.ryuqq.workflow.core.spi.Operation;
import com.ryuqq.workflow.core.spi.OperationContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MapOperationRegistry 유닛 테스트.
 *
 * <ul>
 *   <li>대소문자 무시 조회</li>
 *   <li>별칭</li>
 *   <li>중복 등록 거부</li>
 *   <li>ServiceLoader 탐색</li>
 * </ul>
 */
class MapOperationRegistryTest {

    private static final OperationContext CONTEXT = new OperationContext(WorkflowId.of("wf-1"), "CD_Set", "t1");

    @Test
    void lookup_대소문자_무시() {
        // given
        Operation getSheets = (context, parameters) -> OperationResult.success();
        MapOperationRegistry registry = MapOperationRegistry.builder()
            .register("getSheets", getSheets)
            .build();

        // when / then
        assertThat(registry.lookup("getsheets")).containsSame(getSheets);
        assertThat(registry.lookup("GETSHEETS")).containsSame(getSheets);
        assertThat(registry.lookup(" getSheets ")).containsSame(getSheets);
    }

    @Test
    void lookup_미등록_이름은_empty() {
        MapOperationRegistry registry = MapOperationRegistry.builder().build();

        assertThat(registry.lookup("doesNotExist")).isEmpty();
        assertThat(registry.lookup(null)).isEmpty();
        assertThat(registry.lookup("")).isEmpty();
    }

    @Test
    void alias_같은_Operation에_도달() {
        // given
        Operation getSheets = (context, parameters) -> OperationResult.success();

        // when
        MapOperationRegistry registry = MapOperationRegistry.builder()
            .register("getSheets", getSheets)
            .alias("getAllSheets", "getSheets")
            .build();

        // then
        assertThat(registry.lookup("getallsheets")).containsSame(getSheets);
        assertThat(registry.names()).containsExactly("getSheets", "getAllSheets");
    }

    @Test
    void 중복_등록은_대소문자가_달라도_실패() {
        MapOperationRegistry.Builder builder = MapOperationRegistry.builder()
            .register("getSheets", (context, parameters) -> OperationResult.success());

        assertThatThrownBy(() -> builder.register("GetSheets", (context, parameters) -> OperationResult.success()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("GetSheets");
    }

    @Test
    void 미등록_대상으로의_별칭은_실패() {
        assertThatThrownBy(() -> MapOperationRegistry.builder().alias("getAllViews", "getViews"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("getViews");
    }

    @Test
    void fromServiceLoader_Provider_등록() {
        // when
        MapOperationRegistry registry = MapOperationRegistry.fromServiceLoader();

        // then
        assertThat(registry.names()).contains("getSheets", "getAllSheets", "tagAllByCategory", "tagAllRooms");
        OperationResult tagged = registry.lookup("tagallrooms").orElseThrow()
            .invoke(CONTEXT, Map.of("category", "Doors"));
        assertThat(tagged.data()).containsEntry("tagged", "Rooms");
        assertThat(registry.lookup("getAllSheets").orElseThrow().invoke(CONTEXT, Map.of()).data())
            .containsEntry("sheetId", 7);
    }

    @Test
    void 빌드_후에는_변경_불가() {
        MapOperationRegistry registry = MapOperationRegistry.builder()
            .register("getSheets", (context, parameters) -> OperationResult.success())
            .build();

        assertThatThrownBy(() -> registry.names().add("other"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
