/**
 * Failure taxonomy of the state store.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.ryuqq.stageledger.core.exception.StateStoreException}. Argument validation
 * failures keep using {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 * @author StageLedger Team
 */
package com.ryuqq.stageledger.core.exception;
