package com.phillippitts.transcodeguard.service.engine.ffmpeg;

import com.phillippitts.transcodeguard.service.engine.ProgressEvent;

import java.time.Duration;
import java.util.Optional;

/**
 * Parses the key=value blocks ffmpeg writes with {@code -progress pipe:1}.
 *
 * <p>A block ends with a {@code progress=continue} or {@code progress=end} line; one
 * {@link ProgressEvent} is produced per block. Percent is derived from {@code out_time_us}
 * against the input duration and held below 100 until {@code progress=end}.
 *
 * <p>Not thread-safe; one instance per conversion.
 */
public final class FfmpegProgressParser {

    static final String PHASE_ENCODING = "encoding";
    static final String PHASE_FINALIZING = "finalizing";

    private static final double MAX_RUNNING_PERCENT = 99.9;

    private final long totalMicros;

    private long outTimeMicros;
    private double speed;

    /**
     * @param inputDuration duration of the source, null or zero if unknown
     */
    public FfmpegProgressParser(Duration inputDuration) {
        this.totalMicros = inputDuration == null ? 0 : Math.max(0, inputDuration.toNanos() / 1_000);
    }

    /**
     * Feeds one line of ffmpeg progress output.
     *
     * @return an event when the line closes a progress block
     */
    public Optional<ProgressEvent> accept(String line) {
        if (line == null) {
            return Optional.empty();
        }
        int eq = line.indexOf('=');
        if (eq <= 0) {
            return Optional.empty();
        }
        String key = line.substring(0, eq).trim();
        String value = line.substring(eq + 1).trim();
        switch (key) {
            // out_time_ms is microseconds as well, a long-standing ffmpeg quirk
            case "out_time_us", "out_time_ms" -> parseLong(value).ifPresent(v -> outTimeMicros = Math.max(0, v));
            case "speed" -> speed = parseSpeed(value);
            case "progress" -> {
                return Optional.of(snapshot("end".equals(value)));
            }
            default -> {
                // other keys (frame, fps, bitrate, total_size, ...) are not used
            }
        }
        return Optional.empty();
    }

    private ProgressEvent snapshot(boolean end) {
        long processedMs = outTimeMicros / 1_000;
        long totalMs = totalMicros / 1_000;
        if (end) {
            return new ProgressEvent(100.0, PHASE_FINALIZING, Math.max(processedMs, totalMs), totalMs, 0);
        }
        double percent = 0.0;
        long eta = -1;
        if (totalMicros > 0) {
            percent = Math.min(MAX_RUNNING_PERCENT, outTimeMicros * 100.0 / totalMicros);
            if (speed > 0) {
                long remainingMicros = Math.max(0, totalMicros - outTimeMicros);
                eta = Math.round(remainingMicros / 1_000_000.0 / speed);
            }
        }
        return new ProgressEvent(percent, PHASE_ENCODING, processedMs, totalMs, eta);
    }

    private static Optional<Long> parseLong(String value) {
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            // "N/A" before the first frame is muxed
            return Optional.empty();
        }
    }

    private static double parseSpeed(String value) {
        String v = value.endsWith("x") ? value.substring(0, value.length() - 1) : value;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
