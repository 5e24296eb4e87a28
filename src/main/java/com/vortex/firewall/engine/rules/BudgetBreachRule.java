package com.vortex.firewall.engine.rules;

import com.vortex.firewall.engine.DetectionContext;
import com.vortex.firewall.engine.DetectionRule;
import com.vortex.firewall.model.Campaign;
import com.vortex.firewall.model.Finding;
import com.vortex.firewall.model.FindingType;
import com.vortex.firewall.model.MetricSnapshot;
import com.vortex.firewall.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects spend running past the campaign's declared daily budget.
 *
 * Logic: ratio = spend / daily budget; trips above the budget-breach threshold.
 * Campaigns without a positive daily budget (lifetime-budget campaigns) are skipped.
 */
@Component
public class BudgetBreachRule implements DetectionRule {

    @Override
    public FindingType getFindingType() {
        return FindingType.BUDGET_BREACH;
    }

    @Override
    public Optional<Finding> evaluate(DetectionContext context) {
        Campaign campaign = context.getCampaign();
        MetricSnapshot snapshot = context.getSnapshot();
        if (!campaign.hasDailyBudget() || !snapshot.hasSpend()) {
            return Optional.empty();
        }

        double budget = campaign.getDailyBudget();
        double spend = snapshot.getSpend();
        double ratio = spend / budget;
        if (ratio <= context.getThresholds().getBudgetBreach()) {
            return Optional.empty();
        }

        String message = String.format(
                "Campaign spent %.2f vs daily budget %.2f (ratio: %.2f, threshold: %.2f)",
                spend, budget, ratio, context.getThresholds().getBudgetBreach());

        return Optional.of(Finding.builder()
                .type(FindingType.BUDGET_BREACH)
                .severity(Severity.HIGH)
                .resourceId(context.resourceId())
                .message(message)
                .ratio(ratio)
                .observedValue(spend)
                .referenceValue(budget)
                .detectedAt(context.getEvaluatedAt())
                .build());
    }
}
