package com.ryuqq.stageledger.adapter.local;

import com.ryuqq.stageledger.core.exception.BackendUnavailableException;
import com.ryuqq.stageledger.core.exception.DocumentNotFoundException;
import com.ryuqq.stageledger.core.model.StateLocation;
import com.ryuqq.stageledger.core.spi.Backend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Local filesystem implementation of {@link Backend}.
 *
 * <p>The location key is a filesystem path, resolved against an optional base directory.</p>
 *
 * <p><strong>Implementation Notes:</strong></p>
 * <ul>
 *   <li>exists: plain presence check, never throws for a missing or unreadable path</li>
 *   <li>read: whole file; a missing file is {@link DocumentNotFoundException}</li>
 *   <li>write: truncate and rewrite the whole file, creating missing parent directories</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No locking: concurrent writers in different processes race, last write wins</li>
 *   <li>A crash during write may leave a truncated file</li>
 * </ul>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public class LocalFileBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(LocalFileBackend.class);

    private final Path baseDirectory;

    /**
     * Creates a backend resolving relative paths against the working directory.
     */
    public LocalFileBackend() {
        this(null);
    }

    /**
     * Creates a backend resolving relative paths against the given directory.
     *
     * @param baseDirectory directory for relative locations, or null for the working directory
     */
    public LocalFileBackend(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public boolean exists(StateLocation location) {
        return Files.exists(resolve(location));
    }

    @Override
    public byte[] read(StateLocation location) {
        Path path = resolve(location);
        try {
            byte[] content = Files.readAllBytes(path);
            log.debug("Read {} bytes from {}", content.length, path);
            return content;
        } catch (NoSuchFileException e) {
            throw new DocumentNotFoundException(location, e);
        } catch (IOException e) {
            throw new BackendUnavailableException("Failed to read state file " + path, location, e);
        }
    }

    @Override
    public void write(StateLocation location, byte[] content) {
        Path path = resolve(location);
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, content,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
            log.debug("Wrote {} bytes to {}", content.length, path);
        } catch (IOException e) {
            throw new BackendUnavailableException("Failed to write state file " + path, location, e);
        }
    }

    private Path resolve(StateLocation location) {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (location.isBucketLocation()) {
            throw new IllegalArgumentException("Local backend cannot handle bucket location: " + location);
        }
        try {
            Path path = Path.of(location.key());
            return baseDirectory == null ? path : baseDirectory.resolve(path);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid state file path: " + location.key(), e);
        }
    }
}
