/**
 * Name-keyed Operation Registry.
 *
 * @see com.ryuqq.workflow.core.spi.OperationRegistry
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.adapter.inmemory.operation;
