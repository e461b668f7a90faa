package com.ryuqq.workflow.testkit.fixture;

import com.ryuqq.workflow.core.model.PhaseDefinition;
import com.ryuqq.workflow.core.model.TaskDefinition;
import com.ryuqq.workflow.core.model.WorkflowTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for {@link WorkflowTemplate} fixtures.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * WorkflowTemplate template = TemplateBuilder.template("CD_Set")
 *     .phase("A")
 *         .task("t1", "getSheets")
 *         .customTask("t2", "pick default title block")
 *     .phase("B")
 *         .task("t3", "createSheet", Map.of("sheetNumber", "A101"))
 *     .build();
 * </pre>
 *
 * <p>Task descriptions default to {@code "<id> description"}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateBuilder {

    private final String workflowType;
    private String name;
    private String description;
    private List<String> projectTypes = List.of();
    private String estimatedTime;
    private final List<PhaseDefinition> phases = new ArrayList<>();

    private String openPhase;
    private List<TaskDefinition> openTasks;

    private TemplateBuilder(String workflowType) {
        this.workflowType = workflowType;
        this.name = workflowType;
    }

    /**
     * Starts a template of the given workflow type.
     *
     * @param workflowType the workflow type (e.g., "CD_Set")
     * @return a new builder
     */
    public static TemplateBuilder template(String workflowType) {
        return new TemplateBuilder(workflowType);
    }

    public TemplateBuilder name(String name) {
        this.name = name;
        return this;
    }

    public TemplateBuilder description(String description) {
        this.description = description;
        return this;
    }

    public TemplateBuilder projectTypes(String... projectTypes) {
        this.projectTypes = List.of(projectTypes);
        return this;
    }

    public TemplateBuilder estimatedTime(String estimatedTime) {
        this.estimatedTime = estimatedTime;
        return this;
    }

    /**
     * Closes the current phase (if any) and opens a new one.
     *
     * @param phaseName the phase name
     * @return this builder
     */
    public TemplateBuilder phase(String phaseName) {
        closePhase();
        this.openPhase = phaseName;
        this.openTasks = new ArrayList<>();
        return this;
    }

    public TemplateBuilder task(String id, String method) {
        return task(new TaskDefinition(id, id + " description", method, Map.of(), null));
    }

    public TemplateBuilder task(String id, String method, Map<String, Object> parameters) {
        return task(new TaskDefinition(id, id + " description", method, parameters, null));
    }

    public TemplateBuilder taskWithHint(String id, String method, String hint) {
        return task(new TaskDefinition(id, id + " description", method, Map.of(), hint));
    }

    public TemplateBuilder customTask(String id, String hint) {
        return task(new TaskDefinition(id, id + " description", TaskDefinition.CUSTOM_METHOD, Map.of(), hint));
    }

    /**
     * Adds a fully specified task to the current phase.
     *
     * @param task the task definition
     * @return this builder
     * @throws IllegalStateException if no phase has been opened
     */
    public TemplateBuilder task(TaskDefinition task) {
        if (openTasks == null) {
            throw new IllegalStateException("phase(...) must be called before adding tasks");
        }
        openTasks.add(task);
        return this;
    }

    public WorkflowTemplate build() {
        closePhase();
        return new WorkflowTemplate(workflowType, name, description, projectTypes, estimatedTime, phases);
    }

    private void closePhase() {
        if (openPhase != null) {
            phases.add(new PhaseDefinition(openPhase, openTasks));
            openPhase = null;
            openTasks = null;
        }
    }

    /**
     * Convenience for parameter maps that contain null values.
     *
     * @param keyValues alternating keys and values
     * @return an ordered mutable map
     */
    public static Map<String, Object> params(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
