/**
 * Document model package: value objects describing the persisted state document.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stageledger.core.model.StageName} - Stage key in the document</li>
 *   <li>{@link com.ryuqq.stageledger.core.model.StageStatus} - Persisted status (started, completed)</li>
 *   <li>{@link com.ryuqq.stageledger.core.model.StageState} - Observed state including UNSET</li>
 *   <li>{@link com.ryuqq.stageledger.core.model.StateDocument} - Schema version + stage map</li>
 *   <li>{@link com.ryuqq.stageledger.core.model.StateLocation} - Path or bucket/key of a document</li>
 *   <li>{@link com.ryuqq.stageledger.core.model.StageResult} - Final state + changed flag</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.core.model;
