package com.ryuqq.stageledger.core.exception;

import com.ryuqq.stageledger.core.model.StateLocation;

/**
 * Stored bytes are not a valid state document.
 *
 * <p>Raised for invalid JSON, a missing {@code version} string or {@code stages} object,
 * an unsupported schema version, or an unknown status value. The document is never
 * replaced automatically.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class MalformedDocumentException extends StateStoreException {

    public MalformedDocumentException(String message) {
        super(message, null, null);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public MalformedDocumentException(String message, StateLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
