package com.vortex.firewall.engine;

import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.FindingType;

import java.util.Optional;

/**
 * A single anomaly check. Implementations are stateless and side-effect free.
 */
public interface DetectionRule {

    /**
     * The finding type this rule produces.
     */
    FindingType getFindingType();

    /**
     * Evaluate the campaign in the given context.
     *
     * @return a finding when the rule trips, empty when it does not or when the
     *         data it needs (field, baseline, budget) is missing or zero
     */
    Optional<Finding> evaluate(DetectionContext context);
}
