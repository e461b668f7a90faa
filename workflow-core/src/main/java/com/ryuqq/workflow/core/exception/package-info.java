/**
 * Workflow domain exceptions.
 *
 * <p>Every exception in this package extends
 * {@link com.ryuqq.workflow.core.exception.WorkflowException} and carries an error code
 * that the control surface copies into its failure responses.</p>
 *
 * <h2>Scope</h2>
 * <ul>
 *   <li><strong>Fatal-to-start:</strong> invalid arguments, missing or malformed templates</li>
 *   <li><strong>Control lookups:</strong> unknown workflow ids</li>
 *   <li><strong>Lifecycle:</strong> transitions the status state machine rejects</li>
 * </ul>
 *
 * <p>Per-task failures are never exceptions; they are returned as values.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workflow.core.exception;
