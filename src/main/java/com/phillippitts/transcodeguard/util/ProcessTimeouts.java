package com.phillippitts.transcodeguard.util;

import java.time.Duration;

/**
 * Standard timeout values for external process management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.transcodeguard.service.engine.ffmpeg.FfmpegCodecEngine}
 * and {@link com.phillippitts.transcodeguard.service.engine.ffmpeg.KillSignalSender}.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream reader threads to flush buffered output after process exit.
     */
    public static final Duration READER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Grace period between {@link Process#destroy()} and {@link Process#destroyForcibly()}.
     *
     * <p>ffmpeg finalizes the container trailer on SIGTERM, which can take a few seconds on
     * large outputs.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(3);

    /**
     * Upper bound for a short-lived helper process such as {@code kill}.
     */
    public static final Duration SIGNAL_COMMAND_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
