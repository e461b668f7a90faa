/**
 * Reusable test fixtures: template builder, recording operation and map-backed template store.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.testkit.fixture;
