package com.phillippitts.transcodeguard.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Source media description, fixed for the life of a job.
 *
 * @param path source file
 * @param sizeBytes size on disk
 * @param duration media duration (ZERO when unknown)
 * @param width frame width in pixels (0 when unknown)
 * @param height frame height in pixels (0 when unknown)
 * @param codec source video codec name, e.g. {@code h264}
 */
public record InputDescriptor(
        Path path,
        long sizeBytes,
        Duration duration,
        int width,
        int height,
        String codec
) {
    public InputDescriptor {
        Objects.requireNonNull(path, "path");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
        if (codec == null) {
            codec = "unknown";
        }
    }
}
