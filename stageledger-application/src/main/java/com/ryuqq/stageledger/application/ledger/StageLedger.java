package com.ryuqq.stageledger.application.ledger;

import com.ryuqq.stageledger.application.config.BackendFactory;
import com.ryuqq.stageledger.application.config.LedgerConfig;
import com.ryuqq.stageledger.core.model.StageResult;
import com.ryuqq.stageledger.core.model.StateLocation;
import com.ryuqq.stageledger.core.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Workflow-facing entry point: one state document, one {@link StageRequest} per call.
 *
 * <p><strong>Processing Flow:</strong></p>
 * <pre>
 * apply(request)
 *   1. checkMode ? skip : ensureInitialized(location)
 *   2. readOnly  → readOnlyGet
 *      checkMode → preview
 *      otherwise → set
 *   3. StageReport(name, state, changed)
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (BackendFactory factory = new BackendFactory()) {
 *     StageLedger ledger = StageLedger.open(LedgerConfig.load("stageledger.properties"), factory);
 *     if (ledger.apply(StageRequest.started("migrate-users").asReadOnly()).state().isTerminal()) {
 *         return; // already done on a previous run
 *     }
 *     ledger.apply(StageRequest.started("migrate-users"));
 *     // ... run the stage ...
 *     ledger.apply(StageRequest.completed("migrate-users"));
 * }
 * </pre>
 *
 * <p>Every failure from the store propagates; the caller decides whether to abort the workflow.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public final class StageLedger {

    private static final Logger log = LoggerFactory.getLogger(StageLedger.class);

    private final StateStore store;
    private final StateLocation location;

    /**
     * 생성자.
     *
     * @param store 상태 저장소
     * @param location 상태 문서 위치
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StageLedger(StateStore store, StateLocation location) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        this.store = store;
        this.location = location;
    }

    /**
     * Creates a ledger for the configured backend and location.
     *
     * @param config ledger configuration
     * @param backendFactory factory for the configured backend
     * @return a ledger bound to {@code config.location()}
     * @throws IllegalArgumentException if an argument is null
     */
    public static StageLedger open(LedgerConfig config, BackendFactory backendFactory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backendFactory == null) {
            throw new IllegalArgumentException("backendFactory cannot be null");
        }
        return new StageLedger(new StateStore(backendFactory.create(config)), config.location());
    }

    /**
     * Applies a request to the state document.
     *
     * @param request the stage request
     * @return the final state of the stage and whether the document changed
     * @throws IllegalArgumentException if request is null
     */
    public StageReport apply(StageRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (!request.checkMode()) {
            store.ensureInitialized(location);
        }

        StageResult result;
        if (request.readOnly()) {
            result = store.readOnlyGet(location, request.name(), request.desiredStatus());
        } else if (request.checkMode()) {
            result = store.preview(location, request.name(), request.desiredStatus());
        } else {
            result = store.set(location, request.name(), request.desiredStatus());
        }

        log.info("Stage {}: state={}, changed={}", request.name().getValue(), result.state(), result.changed());
        return new StageReport(request.name(), result.state(), result.changed());
    }

    /**
     * Location of the state document this ledger works on.
     *
     * @return the document location
     */
    public StateLocation location() {
        return location;
    }
}
