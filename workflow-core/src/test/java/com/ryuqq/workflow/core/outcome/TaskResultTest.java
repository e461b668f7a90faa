package com.ryuqq.workflow.core.outcome;

import com.ryuqq.workflow.core.model.WorkflowDecision;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskResultTest {

    @Test
    void succeeded_WithOrWithoutDecision() {
        WorkflowDecision decision = new WorkflowDecision("t1", "d", "r", Instant.now());

        assertTrue(TaskResult.succeeded(decision).success());
        assertSame(decision, TaskResult.succeeded(decision).decision());
        assertNull(TaskResult.succeeded(null).decision());
    }

    @Test
    void failed_RequiresError() {
        assertEquals("boom", TaskResult.failed("boom").error());
        assertThrows(IllegalArgumentException.class, () -> TaskResult.failed(null));
    }

    @Test
    void constructor_InconsistentCombination_Throws() {
        WorkflowDecision decision = new WorkflowDecision("t1", "d", "r", Instant.now());

        assertThrows(IllegalArgumentException.class, () -> new TaskResult(true, null, "error"));
        assertThrows(IllegalArgumentException.class, () -> new TaskResult(false, decision, "error"));
    }
}
