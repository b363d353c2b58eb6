package com.ryuqq.stageledger.application.config;

import com.ryuqq.stageledger.adapter.local.LocalFileBackend;
import com.ryuqq.stageledger.adapter.s3.S3Backend;
import com.ryuqq.stageledger.core.spi.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.function.Supplier;

/**
 * Builds the {@link Backend} selected by a {@link LedgerConfig}.
 *
 * <p>The S3 client is created on first use only, so local-only callers never touch AWS
 * configuration. The default supplier uses {@link S3Client#create()}, which resolves
 * credentials and region through the default AWS provider chains.</p>
 *
 * <p>The factory owns the client it created and closes it in {@link #close()}.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class BackendFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendFactory.class);

    private final Supplier<S3Client> s3ClientSupplier;
    private S3Client s3Client;

    /**
     * Creates a factory using the default AWS client configuration.
     */
    public BackendFactory() {
        this(S3Client::create);
    }

    /**
     * Creates a factory with a custom S3 client supplier.
     *
     * @param s3ClientSupplier supplier invoked at most once, on the first S3 backend request
     * @throws IllegalArgumentException if s3ClientSupplier is null
     */
    public BackendFactory(Supplier<S3Client> s3ClientSupplier) {
        if (s3ClientSupplier == null) {
            throw new IllegalArgumentException("s3ClientSupplier cannot be null");
        }
        this.s3ClientSupplier = s3ClientSupplier;
    }

    /**
     * Creates the backend for the configured medium.
     *
     * @param config ledger configuration
     * @return a backend accepting {@code config.location()}
     * @throws IllegalArgumentException if config is null
     */
    public Backend create(LedgerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        log.debug("Creating {} backend for {}", config.backend(), config.location());
        return switch (config.backend()) {
            case LOCAL -> new LocalFileBackend();
            case S3 -> new S3Backend(s3Client());
        };
    }

    private synchronized S3Client s3Client() {
        if (s3Client == null) {
            s3Client = s3ClientSupplier.get();
            if (s3Client == null) {
                throw new IllegalStateException("s3ClientSupplier returned null");
            }
        }
        return s3Client;
    }

    @Override
    public synchronized void close() {
        if (s3Client != null) {
            s3Client.close();
            s3Client = null;
        }
    }
}
