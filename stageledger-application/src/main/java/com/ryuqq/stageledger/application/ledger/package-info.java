/**
 * Workflow-facing API: {@link com.ryuqq.stageledger.application.ledger.StageLedger} applies a
 * {@link com.ryuqq.stageledger.application.ledger.StageRequest} and returns a
 * {@link com.ryuqq.stageledger.application.ledger.StageReport}.
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.application.ledger;
