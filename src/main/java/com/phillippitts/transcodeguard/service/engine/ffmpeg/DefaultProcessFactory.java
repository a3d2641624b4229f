package com.phillippitts.transcodeguard.service.engine.ffmpeg;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // Progress goes to stdout, diagnostics to stderr; both are read separately
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
