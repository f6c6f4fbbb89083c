package ai.scopeview.analyzer.context;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Caller-driven override of a plan: shows one node in full regardless of the budget. Expanding a node that is already
 * FULL returns the plan unchanged.
 */
public final class Expander {
    private static final Logger log = LogManager.getLogger(Expander.class);

    private Expander() {}

    /** @throws IllegalArgumentException if {@code nodeId} is not part of the plan's tree */
    public static CompressionPlan expand(CompressionPlan plan, int nodeId) {
        if (plan.decision(nodeId) == Decision.FULL) {
            return plan;
        }
        var costs = plan.costs();
        var state = new Compressor.PlanState(costs, plan.decisionArray());
        state.keepWithAncestors(nodeId, Decision.FULL);
        boolean overBudget = plan.isOverBudget() || state.total > plan.tokenLimit();
        if (overBudget && !plan.isOverBudget()) {
            log.debug("Expanding node {} exceeds the budget: {} > {}", nodeId, state.total, plan.tokenLimit());
        }
        return new CompressionPlan(
                plan.root(),
                costs,
                plan.tokenLimit(),
                state.decisions,
                overBudget,
                plan.isInfeasible(),
                plan.diagnostics());
    }
}
