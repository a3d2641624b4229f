package com.phillippitts.transcodeguard.service.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * File-system operations the coordinator needs for pre-flight checks and output handling.
 */
public interface FileStore {

    /** True if {@code path} exists and can be read. */
    boolean isReadable(Path path);

    /**
     * True if a file could be created at {@code path}: its parent directory exists and is
     * writable.
     */
    boolean isWritableTarget(Path path);

    /**
     * Usable bytes on the volume that holds {@code path} (or its nearest existing ancestor).
     *
     * @throws IOException if the volume cannot be queried
     */
    long freeSpace(Path path) throws IOException;

    /** Size of an existing file. */
    long size(Path path) throws IOException;
}
