/**
 * Contract tests that every SPI implementation must pass.
 *
 * <p>Adapters extend the abstract classes in this package and supply the implementation under test.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.workflow.testkit.contract;
