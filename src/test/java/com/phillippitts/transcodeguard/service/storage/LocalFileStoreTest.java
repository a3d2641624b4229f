package com.phillippitts.transcodeguard.service.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LocalFileStoreTest {

    @TempDir
    Path dir;

    private final LocalFileStore store = new LocalFileStore();

    @Test
    void shouldReportReadableRegularFilesOnly() throws IOException {
        Path file = Files.writeString(dir.resolve("in.mov"), "data");

        assertThat(store.isReadable(file)).isTrue();
        assertThat(store.isReadable(dir)).isFalse();
        assertThat(store.isReadable(dir.resolve("missing.mov"))).isFalse();
        assertThat(store.size(file)).isEqualTo(4);
    }

    @Test
    void shouldRequireExistingParentForOutput() {
        assertThat(store.isWritableTarget(dir.resolve("out.mp4"))).isTrue();
        assertThat(store.isWritableTarget(dir.resolve("nested/out.mp4"))).isFalse();
    }

    @Test
    void shouldResolveFreeSpaceThroughMissingDirectories() throws IOException {
        long free = store.freeSpace(dir.resolve("not/yet/created/out.mp4"));

        assertThat(free).isPositive();
    }
}
