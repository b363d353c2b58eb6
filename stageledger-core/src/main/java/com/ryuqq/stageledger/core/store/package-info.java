/**
 * State store package: the only component callers should normally use.
 *
 * <p>{@link com.ryuqq.stageledger.core.store.StateStore} combines a
 * {@link com.ryuqq.stageledger.core.spi.Backend}, the document codec and the stage
 * transition rule into the get / set / ensure-initialized operations.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateStore store = new StateStore(backend);
 * StateLocation location = StateLocation.ofPath("state.json");
 *
 * store.ensureInitialized(location);
 * StageResult result = store.set(location, StageName.of("step1"), StageStatus.STARTED);
 * </pre>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.core.store;
