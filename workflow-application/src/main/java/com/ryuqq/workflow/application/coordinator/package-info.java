/**
 * Application Layer - Workflow Coordinator contract.
 *
 * <p>This package defines the public lifecycle contract of the workflow engine
 * and the value types that flow across it.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.application.coordinator.WorkflowCoordinator} - Create-and-run, continue, status, pause, resume</li>
 *   <li>{@link com.ryuqq.workflow.application.coordinator.StartWorkflowCommand} - Start request with defaults</li>
 *   <li>{@link com.ryuqq.workflow.application.coordinator.WorkflowSummary} - Result of one drive of a workflow</li>
 *   <li>{@link com.ryuqq.workflow.application.coordinator.PhaseSummary} - Per-phase counts</li>
 *   <li>{@link com.ryuqq.workflow.application.coordinator.WorkflowOverview} - Lightweight listing row</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * application (WorkflowCoordinator)
 *   ↑ implements
 * adapter-runner (InlineWorkflowCoordinator)
 *   ↓ depends on
 * core (WorkflowState, TemplateStore, OperationRegistry, WorkflowRepository)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workflow.application.coordinator;
