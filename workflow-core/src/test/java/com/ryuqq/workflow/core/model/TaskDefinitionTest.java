package com.ryuqq.workflow.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskDefinitionTest {

    @Test
    void isCustom_EmptyOrLiteralCustom_ReturnsTrue() {
        assertTrue(new TaskDefinition("t1", "d", null, null, null).isCustom());
        assertTrue(new TaskDefinition("t1", "d", "", null, null).isCustom());
        assertTrue(new TaskDefinition("t1", "d", "custom", null, null).isCustom());
        assertFalse(new TaskDefinition("t1", "d", "getSheets", null, null).isCustom());
    }

    @Test
    void constructor_MissingIdAndDescription_FallsBack() {
        // When
        TaskDefinition noId = new TaskDefinition(null, null, "getSheets", null, null);
        TaskDefinition noDescription = new TaskDefinition("t7", " ", "getSheets", null, null);

        // Then
        assertEquals("unknown", noId.id());
        assertEquals("unknown", noId.description());
        assertEquals("t7", noDescription.description());
        assertTrue(noId.parameters().isEmpty());
    }

    @Test
    void parameters_AreCopiedAndReadOnly_AllowingNullValues() {
        // Given
        Map<String, Object> source = new HashMap<>();
        source.put("sheetId", null);
        source.put("title", "A101");

        // When
        TaskDefinition task = new TaskDefinition("t1", "d", "createSheet", source, null);
        source.put("title", "changed");

        // Then
        assertEquals("A101", task.parameters().get("title"));
        assertTrue(task.parameters().containsKey("sheetId"));
        assertThrows(UnsupportedOperationException.class, () -> task.parameters().put("x", 1));
    }

    @Test
    void hasDecisionHint_EmptyHint_ReturnsFalse() {
        assertFalse(new TaskDefinition("t1", "d", "m", null, "").hasDecisionHint());
        assertFalse(new TaskDefinition("t1", "d", "m", null, null).hasDecisionHint());
        assertTrue(new TaskDefinition("t1", "d", "m", null, "prefer 24x36").hasDecisionHint());
    }
}
