package com.ryuqq.workflow.adapter.runner;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CoordinatorConfig / ContextPropagation 테스트.
 */
class CoordinatorConfigTest {

    @Test
    void 기본값() {
        CoordinatorConfig config = new CoordinatorConfig();

        assertThat(config.contextPropagation().fields()).containsExactly("scheduleId", "sheetId", "viewId");
        assertThat(config.customTaskDefaultReason()).isEqualTo("No specific logic defined yet");
    }

    @Test
    void fromProperties_필드목록과_사유_로드() {
        // given
        Properties properties = new Properties();
        properties.setProperty("workflow.context.fields", " sheetId, levelId ,, sheetId ");
        properties.setProperty("workflow.custom-task.default-reason", "Awaiting implementation");

        // when
        CoordinatorConfig config = CoordinatorConfig.fromProperties(properties);

        // then
        assertThat(config.contextPropagation().fields()).containsExactly("sheetId", "levelId");
        assertThat(config.customTaskDefaultReason()).isEqualTo("Awaiting implementation");
    }

    @Test
    void fromProperties_빈_필드목록은_전달_비활성화() {
        Properties properties = new Properties();
        properties.setProperty("workflow.context.fields", "");

        CoordinatorConfig config = CoordinatorConfig.fromProperties(properties);

        assertThat(config.contextPropagation().fields()).isEmpty();
        assertThat(config.customTaskDefaultReason()).isEqualTo(CoordinatorConfig.DEFAULT_CUSTOM_TASK_REASON);
    }

    @Test
    void fromProperties_키가_없으면_기본값() {
        assertThat(CoordinatorConfig.fromProperties(new Properties())).isEqualTo(new CoordinatorConfig());
    }

    @Test
    void 잘못된_값은_거부() {
        assertThatThrownBy(() -> new CoordinatorConfig(null, "reason"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CoordinatorConfig().withCustomTaskDefaultReason(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContextPropagation.of("sheetId", ""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CoordinatorConfig.fromProperties(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void context_키_이름() {
        assertThat(ContextPropagation.contextKeyFor("sheetId")).isEqualTo("lastSheetId");
        assertThat(ContextPropagation.contextKeyFor("scheduleId")).isEqualTo("lastScheduleId");
        assertThat(new ContextPropagation().withField("levelId").fields())
            .containsExactly("scheduleId", "sheetId", "viewId", "levelId");
    }
}
