/**
 * Workflow domain model package.
 *
 * <h2>Template (immutable)</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.model.WorkflowTemplate} - Ordered phases of a declarative plan</li>
 *   <li>{@link com.ryuqq.workflow.core.model.PhaseDefinition} - Named, ordered group of tasks</li>
 *   <li>{@link com.ryuqq.workflow.core.model.TaskDefinition} - One dispatched or custom unit of work</li>
 *   <li>{@link com.ryuqq.workflow.core.model.TemplateSummary} - Listing view of a template</li>
 * </ul>
 *
 * <h2>Runtime</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.model.WorkflowId} - Opaque workflow identifier</li>
 *   <li>{@link com.ryuqq.workflow.core.model.WorkflowState} - Mutable, synchronized per-workflow record</li>
 *   <li>{@link com.ryuqq.workflow.core.model.WorkflowSnapshot} - Immutable copy for status queries</li>
 *   <li>{@link com.ryuqq.workflow.core.model.WorkflowDecision} - Audit record of an autonomous choice</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workflow.core.model;
