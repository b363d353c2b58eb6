/**
 * Local filesystem adapter for the Backend SPI.
 *
 * <p>{@link com.ryuqq.stageledger.adapter.local.LocalFileBackend} stores each state document
 * as one JSON file.</p>
 *
 * @see com.ryuqq.stageledger.core.spi.Backend
 * @author StageLedger Team
 * @since 1.0.0
 */
package com.ryuqq.stageledger.adapter.local;
