package com.phillippitts.transcodeguard;

import com.phillippitts.transcodeguard.config.properties.ConversionProperties;
import com.phillippitts.transcodeguard.config.properties.FfmpegProperties;
import com.phillippitts.transcodeguard.config.properties.MonitorProperties;
import com.phillippitts.transcodeguard.config.properties.PolicyProperties;
import com.phillippitts.transcodeguard.config.properties.TelemetryProperties;
import com.phillippitts.transcodeguard.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MonitorProperties.class,
        PolicyProperties.class,
        ConversionProperties.class,
        FfmpegProperties.class,
        TelemetryProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class TranscodeGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranscodeGuardApplication.class, args);
    }

}
