package com.phillippitts.transcodeguard.presentation.controller;

import com.phillippitts.transcodeguard.domain.ConversionRequest;
import com.phillippitts.transcodeguard.domain.ConversionStatistics;
import com.phillippitts.transcodeguard.domain.EncodeParameters;
import com.phillippitts.transcodeguard.domain.InputDescriptor;
import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.OutputTarget;
import com.phillippitts.transcodeguard.exception.JobNotFoundException;
import com.phillippitts.transcodeguard.service.coordinator.CommandOutcome;
import com.phillippitts.transcodeguard.service.coordinator.ConversionCoordinator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Job submission, commands and read-only views over the coordinator.
 */
@RestController
@RequestMapping("/api/jobs")
class JobController {

    private static final Logger LOG = LogManager.getLogger(JobController.class);

    private final ConversionCoordinator coordinator;

    JobController(ConversionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Submission body. Zero or missing numeric fields mean "unknown" for the input and
     * "engine default" for the encode settings.
     */
    record SubmitJobRequest(
            @NotBlank String inputPath,
            @PositiveOrZero long inputSizeBytes,
            @PositiveOrZero long inputDurationMs,
            @PositiveOrZero int inputWidth,
            @PositiveOrZero int inputHeight,
            String inputCodec,
            @NotBlank String outputPath,
            String container,
            String videoCodec,
            String audioCodec,
            @PositiveOrZero long targetBitrate,
            @PositiveOrZero int maxWidth,
            @PositiveOrZero int maxHeight,
            @PositiveOrZero double frameRate,
            @Min(0) @Max(63) Integer crf,
            String preset
    ) {
        ConversionRequest toRequest() {
            InputDescriptor input = new InputDescriptor(Path.of(inputPath), inputSizeBytes,
                    Duration.ofMillis(inputDurationMs), inputWidth, inputHeight, inputCodec);
            EncodeParameters params = new EncodeParameters(container == null ? "mp4" : container,
                    videoCodec, audioCodec, targetBitrate, maxWidth, maxHeight, frameRate, crf, preset);
            return new ConversionRequest(input, new OutputTarget(Path.of(outputPath), params));
        }
    }

    @PostMapping
    ResponseEntity<JobView> submit(@Valid @RequestBody SubmitJobRequest body) {
        JobId id = coordinator.submit(body.toRequest());
        LOG.info("Job {} accepted via API", id);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(view(id));
    }

    @GetMapping("/active")
    ResponseEntity<JobView> active() {
        return coordinator.getActiveJob()
                .map(job -> ResponseEntity.ok(JobView.from(job)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}")
    JobView get(@PathVariable String id) {
        return view(JobId.of(id));
    }

    @GetMapping
    List<JobView> history(@RequestParam(defaultValue = "20") int limit) {
        return coordinator.getHistory(limit).stream().map(JobView::from).toList();
    }

    @DeleteMapping("/history")
    ResponseEntity<Void> clearHistory() {
        coordinator.clearHistory();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/statistics")
    Map<String, Object> statistics() {
        ConversionStatistics stats = coordinator.getStatistics();
        return Map.of(
                "submitted", stats.submitted(),
                "completed", stats.completed(),
                "failed", stats.failed(),
                "cancelled", stats.cancelled(),
                "averageProcessingTime", stats.averageProcessingTime().toString(),
                "successRate", stats.successRate());
    }

    @PostMapping("/{id}/cancel")
    ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        return outcome(id, coordinator.cancel(JobId.of(id)));
    }

    @PostMapping("/{id}/pause")
    ResponseEntity<Map<String, String>> pause(@PathVariable String id) {
        return outcome(id, coordinator.pause(JobId.of(id)));
    }

    @PostMapping("/{id}/resume")
    ResponseEntity<Map<String, String>> resume(@PathVariable String id) {
        return outcome(id, coordinator.resume(JobId.of(id)));
    }

    private JobView view(JobId id) {
        return coordinator.getJob(id).map(JobView::from).orElseThrow(() -> new JobNotFoundException(id));
    }

    private static ResponseEntity<Map<String, String>> outcome(String id, CommandOutcome outcome) {
        HttpStatus status = switch (outcome) {
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case REJECTED -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(Map.of("jobId", id, "outcome", outcome.name()));
    }
}
