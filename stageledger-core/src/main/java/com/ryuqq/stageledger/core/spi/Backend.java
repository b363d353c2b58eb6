package com.ryuqq.stageledger.core.spi;

import com.ryuqq.stageledger.core.exception.BackendUnavailableException;
import com.ryuqq.stageledger.core.exception.DocumentNotFoundException;
import com.ryuqq.stageledger.core.model.StateLocation;

/**
 * Storage SPI for raw state document bytes.
 *
 * <p>A Backend knows where document bytes live and nothing about their content.
 * Parsing and the stage transition rule belong to {@code StateStore}; the Backend is the
 * only component allowed to perform I/O on the persisted document.</p>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>Local filesystem (stageledger-adapter-local): location is a path</li>
 *   <li>Amazon S3 (stageledger-adapter-s3): location is a bucket and key</li>
 *   <li>In-memory (stageledger-testkit): for tests</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> {@link #write(StateLocation, byte[])} replaces the whole
 * resource. No guarantee is made beyond what the medium provides natively
 * (local filesystem: best effort, S3: atomic PUT). No locking across processes.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Reject locations of the wrong shape with {@link IllegalArgumentException}</li>
 *   <li>Report absence as {@link DocumentNotFoundException}, never as {@link BackendUnavailableException}</li>
 *   <li>No retries: failures propagate to the caller</li>
 * </ul>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public interface Backend {

    /**
     * Checks whether a document exists at the location.
     *
     * <p>A missing resource is reported as {@code false}. Remote backends must not
     * report connectivity or authorization failures as {@code false}.</p>
     *
     * @param location the document location
     * @return true if a document exists
     * @throws IllegalArgumentException if location is null or of the wrong shape
     * @throws BackendUnavailableException if existence cannot be determined
     */
    boolean exists(StateLocation location);

    /**
     * Reads the full document bytes.
     *
     * @param location the document location
     * @return the stored bytes
     * @throws IllegalArgumentException if location is null or of the wrong shape
     * @throws DocumentNotFoundException if no document exists at the location
     * @throws BackendUnavailableException on I/O, network or authorization failure
     */
    byte[] read(StateLocation location);

    /**
     * Replaces the document at the location with the given bytes.
     *
     * @param location the document location
     * @param content the full document bytes
     * @throws IllegalArgumentException if location or content is null, or location is of the wrong shape
     * @throws BackendUnavailableException on I/O, network or authorization failure
     */
    void write(StateLocation location, byte[] content);
}
