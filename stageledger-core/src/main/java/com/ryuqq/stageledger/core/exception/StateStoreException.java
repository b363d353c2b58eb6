package com.ryuqq.stageledger.core.exception;

import com.ryuqq.stageledger.core.model.StateLocation;

/**
 * Base type for every failure surfaced by the state store and its backends.
 *
 * <p>Subtypes let callers tell a corrupt document apart from unreachable storage:</p>
 * <ul>
 *   <li>{@link MalformedDocumentException} - stored bytes do not match the document schema</li>
 *   <li>{@link DocumentNotFoundException} - no document at the location</li>
 *   <li>{@link BackendUnavailableException} - I/O, network or authorization failure</li>
 * </ul>
 *
 * <p>None of these are retried inside the store; they propagate to the caller unchanged.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public abstract class StateStoreException extends RuntimeException {

    private final transient StateLocation location;

    protected StateStoreException(String message, StateLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Location of the document involved in the failure.
     *
     * @return the location, or null if the failure is not tied to a location
     */
    public StateLocation location() {
        return location;
    }
}
