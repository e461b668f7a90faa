package com.ryuqq.workflow.testkit.fixture;

import com.ryuqq.workflow.core.exception.TemplateNotFoundException;
import com.ryuqq.workflow.core.model.TemplateSummary;
import com.ryuqq.workflow.core.model.WorkflowTemplate;
import com.ryuqq.workflow.core.spi.TemplateKeys;
import com.ryuqq.workflow.core.spi.TemplateStore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * {@link TemplateStore} backed by an in-memory map of template keys.
 *
 * <p>Keys follow {@link TemplateKeys}: {@code "CD_Set_Residential"} is tried before {@code "CD_Set"}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MapTemplateStore implements TemplateStore {

    private final Map<String, WorkflowTemplate> templates = new ConcurrentSkipListMap<>();

    /**
     * Registers a template under its own workflow type.
     */
    public MapTemplateStore put(WorkflowTemplate template) {
        return put(template.workflowType(), template);
    }

    /**
     * Registers a template under an explicit key.
     */
    public MapTemplateStore put(String key, WorkflowTemplate template) {
        if (key == null || template == null) {
            throw new IllegalArgumentException("key and template cannot be null");
        }
        templates.put(key, template);
        return this;
    }

    @Override
    public WorkflowTemplate load(String workflowType, String projectType) {
        for (String key : TemplateKeys.candidates(workflowType, projectType)) {
            WorkflowTemplate template = templates.get(key);
            if (template != null) {
                return template;
            }
        }
        throw new TemplateNotFoundException(workflowType, projectType);
    }

    @Override
    public List<TemplateSummary> list() {
        return templates.values().stream()
            .map(WorkflowTemplate::summarize)
            .collect(Collectors.toList());
    }
}
