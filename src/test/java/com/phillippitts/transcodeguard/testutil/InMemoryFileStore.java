package com.phillippitts.transcodeguard.testutil;

import com.phillippitts.transcodeguard.service.storage.FileStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * FileStore backed by a map of known files and a fixed free-space figure.
 */
public class InMemoryFileStore implements FileStore {
    private final Map<Path, Long> files = new ConcurrentHashMap<>();
    public volatile long freeSpace = 10L << 30;
    public volatile boolean writable = true;
    public volatile boolean freeSpaceFails;
    /** Runs at the start of every readability check, on the checking thread. */
    public volatile Runnable onReadCheck;

    public InMemoryFileStore withFile(Path path, long size) {
        files.put(path, size);
        return this;
    }

    @Override
    public boolean isReadable(Path path) {
        Runnable hook = onReadCheck;
        if (hook != null) {
            hook.run();
        }
        return files.containsKey(path);
    }

    @Override
    public boolean isWritableTarget(Path path) {
        return writable;
    }

    @Override
    public long freeSpace(Path path) throws IOException {
        if (freeSpaceFails) {
            throw new IOException("volume unavailable");
        }
        return freeSpace;
    }

    @Override
    public long size(Path path) throws IOException {
        Long size = files.get(path);
        if (size == null) {
            throw new IOException("no such file: " + path);
        }
        return size;
    }
}
