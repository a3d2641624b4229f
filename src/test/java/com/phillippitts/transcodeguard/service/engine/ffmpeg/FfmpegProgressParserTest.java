package com.phillippitts.transcodeguard.service.engine.ffmpeg;

import com.phillippitts.transcodeguard.service.engine.ProgressEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class FfmpegProgressParserTest {

    @Test
    void emitsOneEventPerBlock() {
        FfmpegProgressParser parser = new FfmpegProgressParser(Duration.ofSeconds(100));

        assertThat(parser.accept("frame=10")).isEmpty();
        assertThat(parser.accept("out_time_us=25000000")).isEmpty();
        assertThat(parser.accept("speed=5x")).isEmpty();
        Optional<ProgressEvent> event = parser.accept("progress=continue");

        assertThat(event).get().satisfies(e -> {
            assertThat(e.percent()).isEqualTo(25.0);
            assertThat(e.phase()).isEqualTo(FfmpegProgressParser.PHASE_ENCODING);
            assertThat(e.processedUnits()).isEqualTo(25_000);
            assertThat(e.totalUnits()).isEqualTo(100_000);
            assertThat(e.etaSeconds()).isEqualTo(15);
        });
    }

    @Test
    void treatsOutTimeMsAsMicroseconds() {
        FfmpegProgressParser parser = new FfmpegProgressParser(Duration.ofSeconds(10));

        parser.accept("out_time_ms=5000000");

        assertThat(parser.accept("progress=continue")).get()
                .extracting(ProgressEvent::percent).isEqualTo(50.0);
    }

    @Test
    void holdsBelowHundredUntilEnd() {
        FfmpegProgressParser parser = new FfmpegProgressParser(Duration.ofSeconds(10));

        parser.accept("out_time_us=12000000");
        ProgressEvent running = parser.accept("progress=continue").orElseThrow();
        ProgressEvent end = parser.accept("progress=end").orElseThrow();

        assertThat(running.percent()).isEqualTo(99.9);
        assertThat(end.percent()).isEqualTo(100.0);
        assertThat(end.phase()).isEqualTo(FfmpegProgressParser.PHASE_FINALIZING);
        assertThat(end.etaSeconds()).isZero();
    }

    @Test
    void reportsZeroPercentAndUnknownEtaWithoutDuration() {
        FfmpegProgressParser parser = new FfmpegProgressParser(Duration.ZERO);

        parser.accept("out_time_us=5000000");
        parser.accept("speed=1.0x");
        ProgressEvent event = parser.accept("progress=continue").orElseThrow();

        assertThat(event.percent()).isZero();
        assertThat(event.etaSeconds()).isEqualTo(-1);
    }

    @Test
    void ignoresUnavailableAndMalformedValues() {
        FfmpegProgressParser parser = new FfmpegProgressParser(Duration.ofSeconds(10));

        assertThat(parser.accept(null)).isEmpty();
        assertThat(parser.accept("no separator")).isEmpty();
        assertThat(parser.accept("=value")).isEmpty();
        parser.accept("out_time_us=N/A");
        parser.accept("speed=N/A");

        ProgressEvent event = parser.accept("progress=continue").orElseThrow();
        assertThat(event.percent()).isZero();
        assertThat(event.etaSeconds()).isEqualTo(-1);
    }
}
