package com.phillippitts.transcodeguard.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Destination of a conversion, fixed for the life of a job.
 */
public record OutputTarget(Path path, EncodeParameters parameters) {

    public OutputTarget {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(parameters, "parameters");
    }
}
