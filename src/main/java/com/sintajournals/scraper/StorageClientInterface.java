package com.sintajournals.scraper;

import java.nio.file.Path;

/**
 * Interface for the I/O primitives used by the sink writers.
 * <p>
 * Every operation reports success or failure through its return value and never throws.
 */
public interface StorageClientInterface {
    /**
     * Writes bytes to a local file, creating parent directories as needed.
     * @return true on success
     */
    boolean writeLocal(Path path, byte[] content);

    /**
     * Ensures a directory exists on the distributed filesystem.
     * @return true if the directory exists afterwards
     */
    boolean ensureRemoteDir(String path);

    /**
     * Writes (overwrites) a file on the distributed filesystem.
     * @return true on success
     */
    boolean writeRemote(String path, byte[] content);
}
