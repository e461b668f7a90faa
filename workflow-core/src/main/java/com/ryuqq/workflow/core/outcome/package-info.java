/**
 * Operation and task outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.outcome.OperationResult} - Sealed interface (permits OperationSuccess, OperationFailure)</li>
 * </ul>
 *
 * <h2>Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.outcome.OperationSuccess} - Completed, with zero or more output fields</li>
 *   <li>{@link com.ryuqq.workflow.core.outcome.OperationFailure} - Failed, with an error message</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.workflow.core.outcome.TaskResult} is the executor-side fold of one task:
 * recorded success (optionally with a decision) or recorded failure.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workflow.core.outcome;
