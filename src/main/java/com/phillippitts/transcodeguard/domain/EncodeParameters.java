package com.phillippitts.transcodeguard.domain;

import java.util.Objects;

/**
 * Requested encode settings. Zero or null fields mean "engine default".
 */
public record EncodeParameters(
        String container,
        String videoCodec,
        String audioCodec,
        long targetBitrate,
        int maxWidth,
        int maxHeight,
        double frameRate,
        Integer crf,
        String preset
) {
    public EncodeParameters {
        Objects.requireNonNull(container, "container");
        if (videoCodec == null) {
            videoCodec = "libx264";
        }
        if (audioCodec == null) {
            audioCodec = "aac";
        }
        if (targetBitrate < 0 || maxWidth < 0 || maxHeight < 0 || frameRate < 0) {
            throw new IllegalArgumentException("numeric encode parameters must be >= 0");
        }
    }

    /** H.264/AAC in an MP4 container with engine defaults for everything else. */
    public static EncodeParameters mp4Defaults() {
        return new EncodeParameters("mp4", "libx264", "aac", 0, 0, 0, 0, null, null);
    }
}
