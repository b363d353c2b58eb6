package com.ryuqq.stageledger.core.exception;

import com.ryuqq.stageledger.core.model.StateLocation;

/**
 * No document exists at the requested location.
 *
 * <p>Only used between backends and the store to decide on initialization.
 * {@code StateStore} never lets it escape {@code get} or {@code set}.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class DocumentNotFoundException extends StateStoreException {

    public DocumentNotFoundException(StateLocation location) {
        this(location, null);
    }

    public DocumentNotFoundException(StateLocation location, Throwable cause) {
        super("No state document found at " + location, location, cause);
    }
}
