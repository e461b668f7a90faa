package com.ryuqq.workflow.adapter.runner;

import com.ryuqq.workflow.adapter.inmemory.operation.MapOperationRegistry;
import com.ryuqq.workflow.adapter.inmemory.registry.InMemoryWorkflowRepository;
import com.ryuqq.workflow.application.coordinator.PhaseSummary;
import com.ryuqq.workflow.application.coordinator.StartWorkflowCommand;
import com.ryuqq.workflow.application.coordinator.WorkflowOverview;
import com.ryuqq.workflow.application.coordinator.WorkflowSummary;
import com.ryuqq.workflow.core.exception.TemplateNotFoundException;
import com.ryuqq.workflow.core.exception.TemplateParseException;
import com.ryuqq.workflow.core.exception.WorkflowNotFoundException;
import com.ryuqq.workflow.core.exception.WorkflowStateException;
import com.ryuqq.workflow.core.model.WorkflowDecision;
import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.model.WorkflowSnapshot;
import com.ryuqq.workflow.core.outcome.OperationResult;
import com.ryuqq.workflow.core.spi.OperationRegistry;
import com.ryuqq.workflow.core.spi.TemplateStore;
import com.ryuqq.workflow.core.statemachine.WorkflowStatus;
import com.ryuqq.workflow.testkit.fixture.MapTemplateStore;
import com.ryuqq.workflow.testkit.fixture.RecordingOperation;
import com.ryuqq.workflow.testkit.fixture.TemplateBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * InlineWorkflowCoordinator 통합 테스트.
 *
 * <p>인메모리 Registry, Map 기반 Operation Registry, Map 기반 템플릿 저장소로 전체 흐름을 검증합니다:</p>
 * <ul>
 *   <li>예제 시나리오 (custom Task + getSheets)</li>
 *   <li>Task 순서, 미등록 메서드, 최종 상태</li>
 *   <li>context 전달</li>
 *   <li>Phase 경계 / Phase 중간 일시 정지와 재개</li>
 *   <li>미존재 ID, 템플릿 실패 시 미등록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InlineWorkflowCoordinatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");

    private MapTemplateStore templates;
    private InMemoryWorkflowRepository repository;
    private InlineWorkflowCoordinator coordinator;

    private RecordingOperation getSheets;
    private RecordingOperation createSheet;
    private RecordingOperation placeView;

    @BeforeEach
    void setUp() {
        templates = new MapTemplateStore();
        repository = new InMemoryWorkflowRepository();
        getSheets = RecordingOperation.returning(OperationResult.success(Map.of("sheetId", 7)));
        createSheet = RecordingOperation.returning(OperationResult.success(Map.of("sheetId", 42)));
        placeView = RecordingOperation.succeeding();
    }

    private void startCoordinator(RecordingOperation... extra) {
        MapOperationRegistry.Builder builder = MapOperationRegistry.builder()
            .register("getSheets", getSheets)
            .alias("getAllSheets", "getSheets")
            .register("createSheet", createSheet)
            .register("placeView", placeView);
        for (int i = 0; i < extra.length; i++) {
            builder.register("extra" + i, extra[i]);
        }
        coordinator = new InlineWorkflowCoordinator(templates, builder.build(), repository,
            new CoordinatorConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ============================================================
    // 1. 예제 시나리오
    // ============================================================

    @Test
    void 예제_시나리오_custom과_getSheets() {
        // given
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("P1")
                .customTask("t1", "pick default title block")
                .task("t2", "getSheets")
            .build());
        startCoordinator();

        // when
        WorkflowSummary summary = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        // then
        WorkflowSnapshot snapshot = coordinator.getStatus(summary.workflowId());
        assertThat(snapshot.completedTasks()).containsExactly("t1 description", "t2 description");
        assertThat(snapshot.failedTasks()).isEmpty();
        assertThat(snapshot.decisions()).hasSize(1);
        WorkflowDecision decision = snapshot.decisions().get(0);
        assertThat(decision.task()).isEqualTo("t1");
        assertThat(decision.decision()).isEqualTo("Custom task - marked for future implementation");
        assertThat(decision.reason()).isEqualTo("pick default title block");
        assertThat(snapshot.context()).containsEntry("lastSheetId", 7);
        assertThat(snapshot.status()).isEqualTo(WorkflowStatus.COMPLETED_SUCCESSFULLY);
        assertThat(snapshot.status().displayName()).isEqualTo("Completed successfully");

        assertThat(summary.status()).isEqualTo(WorkflowStatus.COMPLETED_SUCCESSFULLY);
        assertThat(summary.tasksCompleted()).isEqualTo(2);
        assertThat(summary.decisionsMade()).isEqualTo(1);
        assertThat(summary.phases()).containsEntry("P1", new PhaseSummary(2, 0, 1));
    }

    @Test
    void context는_요청_값으로_초기화() {
        templates.put(TemplateBuilder.template("DD_Package").phase("P1").build());
        startCoordinator();

        WorkflowSummary summary = coordinator.createAndRun(
            new StartWorkflowCommand("DD_Package", "Healthcare", "IBC_2018", Map.of("levels", 3)));

        WorkflowSnapshot snapshot = coordinator.getStatus(summary.workflowId());
        assertThat(snapshot.projectType()).isEqualTo("Healthcare");
        assertThat(snapshot.context())
            .containsEntry("projectType", "Healthcare")
            .containsEntry("buildingCode", "IBC_2018")
            .containsEntry("customParameters", Map.of("levels", 3));
        assertThat(snapshot.startTime()).isEqualTo(NOW);
    }

    // ============================================================
    // 2. 순서, 실패, 최종 상태
    // ============================================================

    @Test
    void Task는_Phase와_선언_순서대로_실행() {
        // given
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A").task("a1", "getSheets").task("a2", "placeView")
            .phase("B").task("b1", "getAllSheets").task("b2", "placeView")
            .build());
        startCoordinator();

        // when
        WorkflowSummary summary = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        // then
        assertThat(coordinator.getStatus(summary.workflowId()).completedTasks())
            .containsExactly("a1 description", "a2 description", "b1 description", "b2 description");
        assertThat(summary.phases().keySet()).containsExactly("A", "B");
        assertThat(getSheets.invocationCount()).isEqualTo(2);
    }

    @Test
    void 미등록_메서드는_실패로_기록되고_실행은_계속() {
        // given
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A").task("t1", "doesNotExist").task("t2", "getSheets")
            .phase("B").task("t3", "placeView")
            .build());
        startCoordinator();

        // when
        WorkflowSummary summary = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        // then
        WorkflowSnapshot snapshot = coordinator.getStatus(summary.workflowId());
        assertThat(snapshot.failedTasks()).hasSize(1);
        assertThat(snapshot.failedTasks().get(0))
            .contains("doesNotExist")
            .isEqualTo("t1 description - Method 'doesNotExist' not implemented in workflow routing");
        assertThat(snapshot.completedTasks()).containsExactly("t2 description", "t3 description");
        assertThat(summary.status()).isEqualTo(WorkflowStatus.COMPLETED_WITH_ERRORS);
        assertThat(summary.phases().get("A")).isEqualTo(new PhaseSummary(1, 1, 0));
    }

    @Test
    void Operation_조회_예외도_Task_실패로_기록되고_실행은_계속() {
        // given
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A").task("t1", "getSheets").customTask("t2", "hint")
            .build());
        OperationRegistry failingRegistry = mock(OperationRegistry.class);
        when(failingRegistry.lookup(any())).thenThrow(new IllegalStateException("registry down"));
        InlineWorkflowCoordinator failingCoordinator =
            new InlineWorkflowCoordinator(templates, failingRegistry, repository);

        // when
        WorkflowSummary summary = failingCoordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        // then
        assertThat(summary.status()).isEqualTo(WorkflowStatus.COMPLETED_WITH_ERRORS);
        WorkflowSnapshot snapshot = failingCoordinator.getStatus(summary.workflowId());
        assertThat(snapshot.failedTasks()).containsExactly("t1 description - registry down");
        assertThat(snapshot.completedTasks()).containsExactly("t2 description");
    }

    @Test
    void 실패가_하나라도_있으면_Completed_with_errors() {
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A").task("t1", "extra0").task("t2", "getSheets")
            .build());
        startCoordinator(RecordingOperation.throwing(new IllegalStateException("boom")));

        WorkflowSummary summary = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        assertThat(summary.status()).isEqualTo(WorkflowStatus.COMPLETED_WITH_ERRORS);
        assertThat(summary.status().toString()).isEqualTo("Completed with errors");
        assertThat(summary.tasksFailed()).isEqualTo(1);
        assertThat(coordinator.getStatus(summary.workflowId()).failedTasks())
            .containsExactly("t1 description - boom");
    }

    @Test
    void Task_없는_Phase와_빈_템플릿은_성공으로_완료() {
        templates.put(TemplateBuilder.template("Empty").phase("Nothing").build());
        templates.put(TemplateBuilder.template("NoPhases").build());
        startCoordinator();

        WorkflowSummary withEmptyPhase = coordinator.createAndRun(StartWorkflowCommand.of("Empty"));
        WorkflowSummary withoutPhases = coordinator.createAndRun(StartWorkflowCommand.of("NoPhases"));

        assertThat(withEmptyPhase.status()).isEqualTo(WorkflowStatus.COMPLETED_SUCCESSFULLY);
        assertThat(withEmptyPhase.phases()).containsEntry("Nothing", new PhaseSummary(0, 0, 0));
        assertThat(withoutPhases.status()).isEqualTo(WorkflowStatus.COMPLETED_SUCCESSFULLY);
        assertThat(withoutPhases.phases()).isEmpty();
    }

    @Test
    void Phase_요약의_결정_수는_누적값() {
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A").customTask("t1", "h1").customTask("t2", "h2")
            .phase("B").taskWithHint("t3", "getSheets", "h3")
            .build());
        startCoordinator();

        WorkflowSummary summary = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        assertThat(summary.phases().get("A").decisionsCount()).isEqualTo(2);
        assertThat(summary.phases().get("B").decisionsCount()).isEqualTo(3);
        assertThat(summary.decisionsMade()).isEqualTo(3);
    }

    // ============================================================
    // 3. context 전달
    // ============================================================

    @Test
    void 앞_Task의_sheetId가_다음_Task에_주입되고_명시값이_우선() {
        // given
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A")
                .task("t1", "createSheet")
                .task("t2", "placeView")
            .phase("B")
                .task("t3", "getSheets", Map.of("sheetId", 99))
            .build());
        startCoordinator();

        // when
        WorkflowSummary summary = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        // then
        assertThat(placeView.lastParameters()).containsEntry("sheetId", 42);
        assertThat(getSheets.lastParameters()).containsEntry("sheetId", 99);
        assertThat(coordinator.getStatus(summary.workflowId()).context()).containsEntry("lastSheetId", 7);
    }

    // ============================================================
    // 4. 일시 정지 / 재개
    // ============================================================

    @Test
    void Phase_경계_일시정지후_재개하면_남은_Phase_실행() {
        // given: A의 마지막 Task 실행 중 pause 요청
        RecordingOperation pauser = RecordingOperation.answering((context, parameters) -> {
            coordinator.pause(context.workflowId());
            return OperationResult.success();
        });
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A").task("a1", "getSheets").task("a2", "extra0")
            .phase("B").task("b1", "placeView").task("b2", "placeView")
            .build());
        startCoordinator(pauser);

        // when
        WorkflowSummary first = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        // then: B는 실행되지 않음
        assertThat(first.status()).isEqualTo(WorkflowStatus.PAUSED);
        assertThat(first.phases().keySet()).containsExactly("A");
        assertThat(placeView.invocationCount()).isZero();
        WorkflowSnapshot paused = coordinator.getStatus(first.workflowId());
        assertThat(paused.paused()).isTrue();
        assertThat(paused.status().displayName()).isEqualTo("Paused");

        // when: 재개 후 이어서 실행
        WorkflowSnapshot resumed = coordinator.resume(first.workflowId());
        WorkflowSummary second = coordinator.continueWorkflow(first.workflowId());

        // then
        assertThat(resumed.status()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(resumed.paused()).isFalse();
        assertThat(second.status()).isEqualTo(WorkflowStatus.COMPLETED_SUCCESSFULLY);
        assertThat(second.phases().keySet()).containsExactly("B");
        assertThat(second.tasksCompleted()).isEqualTo(4);
        assertThat(coordinator.getStatus(first.workflowId()).completedTasks())
            .containsExactly("a1 description", "a2 description", "b1 description", "b2 description");
        assertThat(pauser.invocationCount()).isEqualTo(1);
    }

    @Test
    void Phase_중간_일시정지는_다음_미실행_Task부터_재개() {
        // given: A의 첫 Task 실행 중 pause 요청
        RecordingOperation pauser = RecordingOperation.answering((context, parameters) -> {
            coordinator.pause(context.workflowId());
            return OperationResult.success();
        });
        templates.put(TemplateBuilder.template("CD_Set")
            .phase("A").task("a1", "extra0").task("a2", "getSheets")
            .phase("B").task("b1", "placeView")
            .build());
        startCoordinator(pauser);

        // when
        WorkflowSummary first = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        // then
        assertThat(first.status()).isEqualTo(WorkflowStatus.PAUSED);
        assertThat(first.phases().get("A")).isEqualTo(new PhaseSummary(1, 0, 0));
        assertThat(getSheets.invocationCount()).isZero();
        assertThat(coordinator.getStatus(first.workflowId()).currentPhase()).isEqualTo("A");

        // when
        coordinator.resume(first.workflowId());
        WorkflowSummary second = coordinator.continueWorkflow(first.workflowId());

        // then
        assertThat(second.status()).isEqualTo(WorkflowStatus.COMPLETED_SUCCESSFULLY);
        assertThat(second.phases().get("A")).isEqualTo(new PhaseSummary(1, 0, 0));
        assertThat(coordinator.getStatus(first.workflowId()).completedTasks())
            .containsExactly("a1 description", "a2 description", "b1 description");
        assertThat(pauser.invocationCount()).isEqualTo(1);
    }

    @Test
    void pause와_resume은_멱등() {
        RecordingOperation pauser = RecordingOperation.answering((context, parameters) -> {
            coordinator.pause(context.workflowId());
            coordinator.pause(context.workflowId());
            return OperationResult.success();
        });
        templates.put(TemplateBuilder.template("CD_Set").phase("A").task("a1", "extra0").build());
        startCoordinator(pauser);

        WorkflowId id = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set")).workflowId();
        coordinator.resume(id);
        WorkflowSnapshot snapshot = coordinator.resume(id);

        assertThat(snapshot.status()).isEqualTo(WorkflowStatus.RUNNING);
    }

    @Test
    void 일시정지_상태_또는_완료된_워크플로우는_이어서_실행할_수_없음() {
        RecordingOperation pauser = RecordingOperation.answering((context, parameters) -> {
            coordinator.pause(context.workflowId());
            return OperationResult.success();
        });
        templates.put(TemplateBuilder.template("Pausing").phase("A").task("a1", "extra0").build());
        templates.put(TemplateBuilder.template("Simple").phase("A").task("a1", "getSheets").build());
        startCoordinator(pauser);

        WorkflowId pausedId = coordinator.createAndRun(StartWorkflowCommand.of("Pausing")).workflowId();
        WorkflowId completedId = coordinator.createAndRun(StartWorkflowCommand.of("Simple")).workflowId();

        assertThatThrownBy(() -> coordinator.continueWorkflow(pausedId))
            .isInstanceOf(WorkflowStateException.class)
            .hasMessageContaining("paused");
        assertThatThrownBy(() -> coordinator.continueWorkflow(completedId))
            .isInstanceOf(WorkflowStateException.class);
        assertThatThrownBy(() -> coordinator.pause(completedId))
            .isInstanceOf(WorkflowStateException.class);
        assertThatThrownBy(() -> coordinator.resume(completedId))
            .isInstanceOf(WorkflowStateException.class);
    }

    // ============================================================
    // 5. 조회 / 오류
    // ============================================================

    @Test
    void 미존재_ID는_NotFound이고_Registry에_추가되지_않음() {
        startCoordinator();
        WorkflowId unknown = WorkflowId.of("never-created");

        assertThatThrownBy(() -> coordinator.getStatus(unknown)).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> coordinator.pause(unknown)).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> coordinator.resume(unknown)).isInstanceOf(WorkflowNotFoundException.class);
        assertThatThrownBy(() -> coordinator.continueWorkflow(unknown)).isInstanceOf(WorkflowNotFoundException.class);
        assertThat(repository.size()).isZero();
        assertThat(coordinator.listWorkflows()).isEmpty();
    }

    @Test
    void 템플릿이_없으면_워크플로우를_등록하지_않음() {
        startCoordinator();

        assertThatThrownBy(() -> coordinator.createAndRun(StartWorkflowCommand.of("Unknown")))
            .isInstanceOf(TemplateNotFoundException.class);
        assertThat(repository.size()).isZero();
    }

    @Test
    void 템플릿_파싱_실패도_워크플로우를_등록하지_않음() {
        TemplateStore broken = mock(TemplateStore.class);
        when(broken.load(any(), any())).thenThrow(new TemplateParseException("phases must be an array"));
        InlineWorkflowCoordinator brokenCoordinator = new InlineWorkflowCoordinator(
            broken, MapOperationRegistry.builder().build(), repository);

        assertThatThrownBy(() -> brokenCoordinator.createAndRun(StartWorkflowCommand.of("CD_Set")))
            .isInstanceOf(TemplateParseException.class);
        assertThat(repository.size()).isZero();
    }

    @Test
    void 프로젝트_전용_템플릿을_공통_템플릿보다_우선() {
        templates.put(TemplateBuilder.template("CD_Set").phase("Generic").build());
        templates.put("CD_Set_Residential", TemplateBuilder.template("CD_Set").phase("Residential").build());
        startCoordinator();

        WorkflowSummary residential = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set", "Residential"));
        WorkflowSummary general = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set"));

        assertThat(residential.phases().keySet()).containsExactly("Residential");
        assertThat(general.phases().keySet()).containsExactly("Generic");
    }

    @Test
    void listWorkflows는_시작순_요약() {
        templates.put(TemplateBuilder.template("CD_Set").phase("A").task("t1", "getSheets").build());
        startCoordinator();
        WorkflowId first = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set")).workflowId();
        WorkflowId second = coordinator.createAndRun(StartWorkflowCommand.of("CD_Set")).workflowId();

        List<WorkflowOverview> overviews = coordinator.listWorkflows();

        assertThat(overviews).extracting(WorkflowOverview::workflowId).containsExactlyInAnyOrder(first, second);
        assertThat(overviews).allSatisfy(overview -> {
            assertThat(overview.workflowType()).isEqualTo("CD_Set");
            assertThat(overview.status()).isEqualTo(WorkflowStatus.COMPLETED_SUCCESSFULLY);
            assertThat(overview.currentPhase()).isEqualTo("A");
            assertThat(overview.tasksCompleted()).isEqualTo(1);
        });
    }

    @Test
    void listTemplates는_저장소에_위임() {
        templates.put(TemplateBuilder.template("CD_Set").name("Construction Documents")
            .projectTypes("General").estimatedTime("45 minutes")
            .phase("A").phase("B").build());
        startCoordinator();

        assertThat(coordinator.listTemplates()).singleElement().satisfies(summary -> {
            assertThat(summary.name()).isEqualTo("Construction Documents");
            assertThat(summary.phaseCount()).isEqualTo(2);
            assertThat(summary.estimatedTime()).isEqualTo("45 minutes");
        });
    }
}
