/**
 * Inline workflow runner.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.InlineWorkflowCoordinator}: lifecycle and phase loop</li>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.PhaseExecutor}: ordered task execution within a phase</li>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.TaskExecutor}: dispatch, context injection and result interpretation</li>
 *   <li>{@link com.ryuqq.workflow.adapter.runner.CoordinatorConfig} /
 *       {@link com.ryuqq.workflow.adapter.runner.ContextPropagation}: configuration</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.runner;
