package com.vortex.firewall.engine;

import com.vortex.firewall.config.MetricsConfig;
import com.vortex.firewall.model.Finding;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every registered {@link DetectionRule} against one campaign.
 * Rules are independent: a campaign may get several findings in one pass,
 * and a rule that throws is logged and skipped without affecting the others.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final List<DetectionRule> rules;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AnomalyDetector(List<DetectionRule> rules, Tracer tracer, MetricsConfig metricsConfig) {
        this.rules = List.copyOf(rules);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (DetectionRule rule : this.rules) {
            log.info("Registered detection rule: {} -> {}",
                    rule.getFindingType(), rule.getClass().getSimpleName());
        }
    }

    @Observed(name = "campaign.detect", contextualName = "detect-anomalies")
    public List<Finding> detect(DetectionContext context) {
        List<Finding> findings = new ArrayList<>();

        for (DetectionRule rule : rules) {
            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + rule.getFindingType())
                    .tag("campaign.id", context.resourceId())
                    .tag("rule.type", rule.getFindingType().name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                Optional<Finding> finding = rule.evaluate(context);
                ruleSpan.tag("rule.triggered", String.valueOf(finding.isPresent()));

                if (finding.isPresent()) {
                    findings.add(finding.get());
                    log.debug("Rule {} triggered for campaign {}: {}",
                            rule.getFindingType(), context.resourceId(), finding.get().getMessage());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                metricsConfig.recordRuleError(rule.getFindingType().name());
                log.error("Error evaluating rule {} for campaign {}: {}",
                        rule.getFindingType(), context.resourceId(), e.getMessage(), e);
            } finally {
                ruleSpan.end();
            }
        }

        return findings;
    }
}
