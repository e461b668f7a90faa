package com.ryuqq.workflow.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.workflow.core.exception.TemplateParseException;
import com.ryuqq.workflow.core.model.PhaseDefinition;
import com.ryuqq.workflow.core.model.TaskDefinition;
import com.ryuqq.workflow.core.model.WorkflowTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 워크플로우 템플릿 파서 (Jackson).
 *
 * <p><strong>문서 형식:</strong></p>
 * <pre>
 * { "workflowType": "CD_Set", "name": "...", "description": "...",
 *   "projectTypes": ["Residential"], "estimatedTime": "2 hours",
 *   "phases": [ { "name": "Setup",
 *                 "tasks": [ { "id": "t1", "description": "...", "method": "getSheets",
 *                              "parameters": { ... }, "autonomous_decision": "..." } ] } ] }
 * </pre>
 *
 * <p><strong>구조 검증:</strong></p>
 * <ul>
 *   <li>루트는 객체, phases는 배열, 각 phase와 task는 객체여야 합니다.</li>
 *   <li>tasks 누락 시 Task 없는 Phase로 취급합니다.</li>
 *   <li>parameters는 존재할 경우 객체여야 하며, JSON null 값은 그대로 null로 보존됩니다.</li>
 * </ul>
 *
 * <p>의미 검증(메서드 존재 여부 등)은 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonTemplateParser {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMETER_MAP =
        new TypeReference<LinkedHashMap<String, Object>>() { };

    private final ObjectMapper objectMapper;

    /**
     * 기본 ObjectMapper로 생성.
     */
    public JsonTemplateParser() {
        this(new ObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param objectMapper 사용할 ObjectMapper
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public JsonTemplateParser(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 템플릿 문서 파싱.
     *
     * @param json 문서 내용
     * @param fallbackWorkflowType 문서에 workflowType이 없을 때 사용할 값 (보통 템플릿 키)
     * @return WorkflowTemplate
     * @throws TemplateParseException 문서 구조가 잘못된 경우
     */
    public WorkflowTemplate parse(String json, String fallbackWorkflowType) {
        if (json == null) {
            throw new TemplateParseException("Template document cannot be null");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TemplateParseException("Template is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TemplateParseException("Template root must be a JSON object");
        }

        String workflowType = text(root, "workflowType", "template");
        if (workflowType == null || workflowType.isBlank()) {
            workflowType = fallbackWorkflowType;
        }

        JsonNode phasesNode = root.get("phases");
        if (phasesNode == null || !phasesNode.isArray()) {
            throw new TemplateParseException("Template 'phases' must be an array");
        }
        List<PhaseDefinition> phases = new ArrayList<>();
        for (int i = 0; i < phasesNode.size(); i++) {
            phases.add(parsePhase(phasesNode.get(i), i));
        }

        return new WorkflowTemplate(
            workflowType,
            text(root, "name", "template"),
            text(root, "description", "template"),
            stringList(root.get("projectTypes")),
            text(root, "estimatedTime", "template"),
            phases
        );
    }

    private PhaseDefinition parsePhase(JsonNode node, int index) {
        String where = "phases[" + index + "]";
        if (!node.isObject()) {
            throw new TemplateParseException(where + " must be an object");
        }
        String name = text(node, "name", where);
        if (name == null || name.isBlank()) {
            throw new TemplateParseException(where + " requires a name");
        }

        List<TaskDefinition> tasks = new ArrayList<>();
        JsonNode tasksNode = node.get("tasks");
        if (tasksNode != null && !tasksNode.isNull()) {
            if (!tasksNode.isArray()) {
                throw new TemplateParseException(where + ".tasks must be an array");
            }
            for (int i = 0; i < tasksNode.size(); i++) {
                tasks.add(parseTask(tasksNode.get(i), where + ".tasks[" + i + "]"));
            }
        }
        return new PhaseDefinition(name, tasks);
    }

    private TaskDefinition parseTask(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new TemplateParseException(where + " must be an object");
        }
        return new TaskDefinition(
            text(node, "id", where),
            text(node, "description", where),
            text(node, "method", where),
            parameters(node.get("parameters"), where),
            text(node, "autonomous_decision", where)
        );
    }

    private Map<String, Object> parameters(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new TemplateParseException(where + ".parameters must be an object");
        }
        return objectMapper.convertValue(node, PARAMETER_MAP);
    }

    private static String text(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new TemplateParseException(where + "." + field + " must be a scalar value");
        }
        return value.asText();
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new TemplateParseException("template.projectTypes must be an array");
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }
}
