package com.phillippitts.transcodeguard.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the ffmpeg-backed codec engine.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public class FfmpegProperties {

    /** ffmpeg executable; resolved through PATH when relative. */
    @NotBlank
    private String binaryPath = "ffmpeg";

    /** Encoder threads, 0 lets ffmpeg decide. */
    @Min(0)
    private int threads = 0;

    /** Share of each throttle cycle the process is allowed to run. */
    @Min(value = 1, message = "Throttle duty must be at least 1 percent")
    @Max(value = 100, message = "Throttle duty must be at most 100 percent")
    private int throttleDutyPercent = 50;

    /** Length of one throttle run/suspend cycle, in ms. */
    @Positive
    private long throttleCycleMs = 1_000;

    public String getBinaryPath() {
        return binaryPath;
    }

    public void setBinaryPath(String binaryPath) {
        this.binaryPath = binaryPath;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public int getThrottleDutyPercent() {
        return throttleDutyPercent;
    }

    public void setThrottleDutyPercent(int throttleDutyPercent) {
        this.throttleDutyPercent = throttleDutyPercent;
    }

    public long getThrottleCycleMs() {
        return throttleCycleMs;
    }

    public void setThrottleCycleMs(long throttleCycleMs) {
        this.throttleCycleMs = throttleCycleMs;
    }
}
