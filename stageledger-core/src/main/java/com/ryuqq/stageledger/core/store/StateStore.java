package com.ryuqq.stageledger.core.store;

import com.ryuqq.stageledger.core.codec.StateDocumentCodec;
import com.ryuqq.stageledger.core.exception.DocumentNotFoundException;
import com.ryuqq.stageledger.core.exception.MalformedDocumentException;
import com.ryuqq.stageledger.core.model.StageName;
import com.ryuqq.stageledger.core.model.StageResult;
import com.ryuqq.stageledger.core.model.StageState;
import com.ryuqq.stageledger.core.model.StageStatus;
import com.ryuqq.stageledger.core.model.StateDocument;
import com.ryuqq.stageledger.core.model.StateLocation;
import com.ryuqq.stageledger.core.spi.Backend;
import com.ryuqq.stageledger.core.statemachine.StageTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotency policy layer over a {@link Backend}.
 *
 * <p>Every mutation is a full read-modify-write of the state document:</p>
 * <pre>
 * 1. backend.read(location)       → decode
 * 2. StageTransition.resolve(current, desired)
 * 3. changed ? backend.write(location, encode(doc.withStage(...))) : no write
 * </pre>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>A stage marked COMPLETED is never reopened</li>
 *   <li>No write when the requested status is already stored</li>
 *   <li>Setting one stage never alters another stage</li>
 *   <li>{@link #ensureInitialized(StateLocation)} never overwrites an existing document</li>
 *   <li>The document is re-read on every call (no caching)</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> calls against one location from one process are sequential
 * by construction. Concurrent writers in different processes race and the last write wins.</p>
 *
 * <p><strong>Errors:</strong> backend and decoding failures propagate unchanged; there is no retry.
 * A missing document is treated as empty by {@link #get}, {@link #set}, {@link #readOnlyGet}
 * and {@link #preview}, so {@link DocumentNotFoundException} never escapes them.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final Backend backend;

    /**
     * 생성자.
     *
     * @param backend 문서 저장소
     * @throws IllegalArgumentException backend가 null인 경우
     */
    public StateStore(Backend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        this.backend = backend;
    }

    /**
     * Creates an empty document at the location if none exists.
     *
     * @param location the document location
     * @return true if a document was created, false if one already existed
     * @throws IllegalArgumentException if location is null
     */
    public boolean ensureInitialized(StateLocation location) {
        requireLocation(location);
        if (backend.exists(location)) {
            log.debug("State document already present at {}", location);
            return false;
        }
        backend.write(location, StateDocumentCodec.encode(StateDocumentCodec.newEmpty()));
        log.info("Initialized empty state document at {}", location);
        return true;
    }

    /**
     * Returns the stored state of a stage.
     *
     * @param location the document location
     * @param stage the stage name
     * @return the stored state, or {@link StageState#UNSET} if never recorded
     * @throws IllegalArgumentException if location or stage is null
     */
    public StageState get(StateLocation location, StageName stage) {
        requireLocation(location);
        requireStage(stage);
        StageState state = load(location).stateOf(stage);
        log.debug("Read {} = {} from {}", stage.getValue(), state, location);
        return state;
    }

    /**
     * Records the desired status of a stage, honoring the terminal COMPLETED rule.
     *
     * @param location the document location
     * @param stage the stage name
     * @param desired the requested status
     * @return the final state and whether the document was written
     * @throws IllegalArgumentException if any argument is null
     */
    public StageResult set(StateLocation location, StageName stage, StageStatus desired) {
        requireLocation(location);
        requireStage(stage);
        requireStatus(desired);

        StateDocument document = load(location);
        StageState current = document.stateOf(stage);
        StageResult result = StageTransition.resolve(current, desired);

        if (!result.changed()) {
            logUnchanged(location, stage, current, desired);
            return result;
        }

        backend.write(location, StateDocumentCodec.encode(document.withStage(stage, desired)));
        log.info("Stage {} transitioned {} → {} at {}", stage.getValue(), current, result.state(), location);
        return result;
    }

    /**
     * Reports the stored state of a stage without ever writing.
     *
     * <p>The desired status is accepted for call-site symmetry with
     * {@link #set(StateLocation, StageName, StageStatus)} and does not affect the result.</p>
     *
     * @param location the document location
     * @param stage the stage name
     * @param desired the status the caller would have requested (may be null)
     * @return the stored state with {@code changed=false}
     * @throws IllegalArgumentException if location or stage is null
     */
    public StageResult readOnlyGet(StateLocation location, StageName stage, StageStatus desired) {
        return StageResult.unchanged(get(location, stage));
    }

    /**
     * Computes what {@link #set(StateLocation, StageName, StageStatus)} would return, without writing.
     *
     * @param location the document location
     * @param stage the stage name
     * @param desired the requested status
     * @return the would-be final state and changed flag
     * @throws IllegalArgumentException if any argument is null
     */
    public StageResult preview(StateLocation location, StageName stage, StageStatus desired) {
        requireLocation(location);
        requireStage(stage);
        requireStatus(desired);
        StageResult result = StageTransition.resolve(load(location).stateOf(stage), desired);
        log.debug("Check mode: {} → {} would {}change {}", stage.getValue(), desired,
                result.changed() ? "" : "not ", location);
        return result;
    }

    private StateDocument load(StateLocation location) {
        byte[] content;
        try {
            content = backend.read(location);
        } catch (DocumentNotFoundException e) {
            log.debug("No state document at {}, treating as empty", location);
            return StateDocumentCodec.newEmpty();
        }
        try {
            return StateDocumentCodec.decode(content);
        } catch (MalformedDocumentException e) {
            throw new MalformedDocumentException(e.getMessage() + " (" + location + ")", location, e);
        }
    }

    private void logUnchanged(StateLocation location, StageName stage, StageState current, StageStatus desired) {
        if (StageTransition.isBackward(current, desired)) {
            log.warn("Ignoring {} for completed stage {} at {}", desired, stage.getValue(), location);
        } else {
            log.debug("Stage {} already {} at {}", stage.getValue(), current, location);
        }
    }

    private static void requireLocation(StateLocation location) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
    }

    private static void requireStage(StageName stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
    }

    private static void requireStatus(StageStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("desired status cannot be null");
        }
    }
}
