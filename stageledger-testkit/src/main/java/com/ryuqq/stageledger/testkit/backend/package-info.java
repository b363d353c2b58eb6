/**
 * Test doubles for the Backend SPI.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stageledger.testkit.backend.InMemoryBackend} - map-backed Backend</li>
 *   <li>{@link com.ryuqq.stageledger.testkit.backend.RecordingBackend} - counts reads and writes</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.testkit.backend;
