/**
 * Reusable contract tests for Backend implementations and the StateStore running on them.
 *
 * <p>Adapter modules depend on this module in test scope and extend
 * {@link com.ryuqq.stageledger.testkit.contract.AbstractStateStoreContractTest}.</p>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.testkit.contract;
