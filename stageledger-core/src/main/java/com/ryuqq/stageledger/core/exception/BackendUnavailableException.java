package com.ryuqq.stageledger.core.exception;

import com.ryuqq.stageledger.core.model.StateLocation;

/**
 * The storage medium could not be reached or refused the request.
 *
 * <p>Covers filesystem I/O errors, network failures and authorization errors.
 * Always fatal for the current call.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class BackendUnavailableException extends StateStoreException {

    public BackendUnavailableException(String message, StateLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
