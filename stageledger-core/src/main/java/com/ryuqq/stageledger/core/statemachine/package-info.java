/**
 * Stage state machine package.
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * UNSET → STARTED
 * UNSET → COMPLETED
 * STARTED → COMPLETED
 *
 * No-op:
 * - STARTED → STARTED
 * - COMPLETED → * (terminal state, request ignored)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StageResult result = StageTransition.resolve(StageState.COMPLETED, StageStatus.STARTED);
 * // result.state() == COMPLETED, result.changed() == false
 * </pre>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.core.statemachine;
