/**
 * Workflow status state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.statemachine.WorkflowStatus} - Workflow lifecycle statuses (enum)</li>
 *   <li>{@link com.ryuqq.workflow.core.statemachine.StatusTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * RUNNING → PAUSED (pause observed)
 * PAUSED → RUNNING (resume)
 * RUNNING → COMPLETED_SUCCESSFULLY | COMPLETED_WITH_ERRORS
 *
 * Forbidden:
 * - COMPLETED_* → * (terminal status)
 * - PAUSED → COMPLETED_* (remaining phases must run first)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workflow.core.statemachine;
