/**
 * Contract test infrastructure for the shop storage layer.
 *
 * <p>{@link com.ryuqq.shopstore.testkit.contract.AbstractContractTest} wires a manager over
 * in-memory backends and a {@link com.ryuqq.shopstore.testkit.contract.MutableClock};
 * the contract tests in this module extend it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.testkit.contract;
