/**
 * Request/response control surface.
 *
 * <p>{@link com.ryuqq.workflow.application.control.WorkflowControlFacade} wraps a
 * {@link com.ryuqq.workflow.application.coordinator.WorkflowCoordinator} behind opaque string ids and
 * converts every outcome into a {@link com.ryuqq.workflow.application.control.ControlResponse}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.workflow.application.control;
