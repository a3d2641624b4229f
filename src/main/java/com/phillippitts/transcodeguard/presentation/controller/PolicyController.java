package com.phillippitts.transcodeguard.presentation.controller;

import com.phillippitts.transcodeguard.service.coordinator.ConversionCoordinator;
import com.phillippitts.transcodeguard.service.policy.DecisionType;
import com.phillippitts.transcodeguard.service.policy.ResourceKind;
import com.phillippitts.transcodeguard.service.policy.Threshold;
import com.phillippitts.transcodeguard.service.policy.ThresholdComparator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Runtime threshold configuration. Changes apply from the next policy tick.
 */
@RestController
@RequestMapping("/api/policy/thresholds")
class PolicyController {

    private static final Logger LOG = LogManager.getLogger(PolicyController.class);

    private final ConversionCoordinator coordinator;

    PolicyController(ConversionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    record ThresholdRequest(@NotNull ThresholdComparator comparator, @NotNull Double limit,
                            @NotNull DecisionType decision) {
    }

    @GetMapping
    Map<ResourceKind, Threshold> list() {
        return coordinator.thresholds();
    }

    @PutMapping("/{kind}")
    Threshold put(@PathVariable ResourceKind kind, @Valid @RequestBody ThresholdRequest body) {
        Threshold threshold = new Threshold(kind, body.comparator(), body.limit(), body.decision());
        coordinator.setThreshold(kind, threshold);
        LOG.info("Threshold {} set: {} {} -> {}", kind, body.comparator(), body.limit(), body.decision());
        return threshold;
    }

    @DeleteMapping("/{kind}")
    ResponseEntity<Threshold> clear(@PathVariable ResourceKind kind) {
        return coordinator.clearThreshold(kind)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
