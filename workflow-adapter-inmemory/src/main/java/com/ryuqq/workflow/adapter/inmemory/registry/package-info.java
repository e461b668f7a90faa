/**
 * In-memory Workflow Registry adapter.
 *
 * <p>{@link com.ryuqq.workflow.adapter.inmemory.registry.InMemoryWorkflowRepository} keeps live
 * {@link com.ryuqq.workflow.core.model.WorkflowState}s in a concurrent map with an optional
 * {@link com.ryuqq.workflow.adapter.inmemory.registry.RetentionPolicy}.</p>
 *
 * @see com.ryuqq.workflow.core.spi.WorkflowRepository
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.inmemory.registry;
