/**
 * Configuration and backend selection.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stageledger.application.config.LedgerConfig} - backend kind, state file, bucket</li>
 *   <li>{@link com.ryuqq.stageledger.application.config.BackendFactory} - builds the configured Backend</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.application.config;
