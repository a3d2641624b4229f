package com.phillippitts.transcodeguard.service.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * {@link FileStore} over the default NIO file system.
 */
public final class LocalFileStore implements FileStore {

    @Override
    public boolean isReadable(Path path) {
        return path != null && Files.isRegularFile(path) && Files.isReadable(path);
    }

    @Override
    public boolean isWritableTarget(Path path) {
        if (path == null) {
            return false;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null || !Files.isDirectory(parent) || !Files.isWritable(parent)) {
            return false;
        }
        return !Files.exists(path) || Files.isWritable(path);
    }

    @Override
    public long freeSpace(Path path) throws IOException {
        Path probe = path.toAbsolutePath();
        while (probe != null && !Files.exists(probe)) {
            probe = probe.getParent();
        }
        if (probe == null) {
            throw new NoSuchFileException(path.toString());
        }
        return Files.getFileStore(probe).getUsableSpace();
    }

    @Override
    public long size(Path path) throws IOException {
        return Files.size(path);
    }
}
