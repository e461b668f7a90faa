/**
 * Service Provider Interfaces consumed by the workflow engine.
 *
 * <h2>Operation dispatch</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.spi.Operation} - Name-addressable callable returning an OperationResult</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.OperationRegistry} - Case-insensitive lookup table</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.OperationProvider} / {@link com.ryuqq.workflow.core.spi.OperationRegistrar} -
 *       Registration-time table building, one provider per operation module</li>
 * </ul>
 *
 * <h2>Templates</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.spi.TemplateStore} - Resolve (workflowType, projectType) with fallback</li>
 *   <li>{@link com.ryuqq.workflow.core.spi.TemplateKeys} - Lookup key order</li>
 * </ul>
 *
 * <h2>Workflow Registry</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.spi.WorkflowRepository} - Concurrency-safe table of live workflows</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workflow.core.spi;
