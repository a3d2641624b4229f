package com.phillippitts.transcodeguard.service.policy;

import com.phillippitts.transcodeguard.domain.Alert;
import com.phillippitts.transcodeguard.domain.ResourceSnapshot;

import java.util.List;

/**
 * Result of one policy evaluation.
 *
 * @param snapshot evaluated snapshot
 * @param decisions primary decision first, then ALERT decisions for lower-priority tripped rules
 * @param alerts new alerts that passed de-duplication
 */
public record PolicyEvaluation(ResourceSnapshot snapshot, List<Decision> decisions, List<Alert> alerts) {

    public PolicyEvaluation {
        decisions = List.copyOf(decisions);
        alerts = List.copyOf(alerts);
        if (decisions.isEmpty()) {
            throw new IllegalArgumentException("an evaluation always has a primary decision");
        }
    }

    public Decision primary() {
        return decisions.get(0);
    }
}
