package com.ryuqq.stageledger.testkit.backend;

import com.ryuqq.stageledger.core.model.StateLocation;
import com.ryuqq.stageledger.core.spi.Backend;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Backend} decorator counting calls to the delegate.
 *
 * <p>Used by contract tests to assert that idempotent operations perform no write.
 * Only calls that return normally are counted.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class RecordingBackend implements Backend {

    private final Backend delegate;
    private final AtomicInteger reads = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();

    public RecordingBackend(Backend delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public boolean exists(StateLocation location) {
        return delegate.exists(location);
    }

    @Override
    public byte[] read(StateLocation location) {
        byte[] content = delegate.read(location);
        reads.incrementAndGet();
        return content;
    }

    @Override
    public void write(StateLocation location, byte[] content) {
        delegate.write(location, content);
        writes.incrementAndGet();
    }

    public int readCount() {
        return reads.get();
    }

    public int writeCount() {
        return writes.get();
    }

    public Backend delegate() {
        return delegate;
    }

    /**
     * Resets both counters to zero.
     */
    public void reset() {
        reads.set(0);
        writes.set(0);
    }
}
