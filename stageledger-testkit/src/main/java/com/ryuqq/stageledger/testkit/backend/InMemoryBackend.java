package com.ryuqq.stageledger.testkit.backend;

import com.ryuqq.stageledger.core.exception.DocumentNotFoundException;
import com.ryuqq.stageledger.core.model.StateLocation;
import com.ryuqq.stageledger.core.spi.Backend;

import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link Backend} for testing and reference purposes.
 *
 * <p>Documents are kept in a {@link ConcurrentHashMap} keyed by {@link StateLocation};
 * both path and bucket locations are accepted. Byte arrays are copied on the way in and
 * out so callers cannot mutate stored content.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class InMemoryBackend implements Backend {

    private final ConcurrentHashMap<StateLocation, byte[]> documents = new ConcurrentHashMap<>();

    @Override
    public boolean exists(StateLocation location) {
        requireLocation(location);
        return documents.containsKey(location);
    }

    @Override
    public byte[] read(StateLocation location) {
        requireLocation(location);
        byte[] content = documents.get(location);
        if (content == null) {
            throw new DocumentNotFoundException(location);
        }
        return Arrays.copyOf(content, content.length);
    }

    @Override
    public void write(StateLocation location, byte[] content) {
        requireLocation(location);
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        documents.put(location, Arrays.copyOf(content, content.length));
    }

    /**
     * Returns the number of stored documents.
     *
     * @return document count
     */
    public int size() {
        return documents.size();
    }

    private static void requireLocation(StateLocation location) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
    }
}
