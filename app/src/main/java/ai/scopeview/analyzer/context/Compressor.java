package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Diagnostic;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Greedy selection of which nodes to keep under a token budget.
 *
 * <p>The plan starts from the minimal structure: the root, every forced node and their ancestors, each at the cheapest
 * kept decision. Remaining nodes are then visited by descending importance (ties by id) and upgraded to FULL, or
 * failing that to SUMMARY, whenever the upgrade together with lifting any elided ancestors still fits.
 */
public final class Compressor {
    private static final Logger log = LogManager.getLogger(Compressor.class);

    private final TokenBudgeter budgeter;

    public Compressor(TokenBudgeter budgeter) {
        this.budgeter = Objects.requireNonNull(budgeter, "budgeter");
    }

    public TokenBudgeter budgeter() {
        return budgeter;
    }

    public CompressionPlan compress(AstNode root, int budget, ToDoubleFunction<AstNode> importance) {
        return compress(root, budget, importance, Set.of());
    }

    public CompressionPlan compress(
            AstNode root, int budget, ToDoubleFunction<AstNode> importance, Set<Integer> forcedIds) {
        return compress(root, budgeter.costs(root), budget, importance, forcedIds);
    }

    /** Variant reusing costs already computed for {@code root}. */
    public CompressionPlan compress(
            AstNode root, NodeCosts costs, int budget, ToDoubleFunction<AstNode> importance, Set<Integer> forcedIds) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(importance, "importance");
        if (budget < 0) {
            throw new IllegalArgumentException("budget must not be negative: " + budget);
        }
        if (costs.rootId() != root.id() || costs.size() != root.size()) {
            throw new IllegalArgumentException("costs were not computed for this tree");
        }

        var state = new PlanState(costs);
        state.keep(root.id(), costs.minimalKept(root.id()));
        for (int forced : forcedIds) {
            if (!costs.contains(forced)) {
                throw new IllegalArgumentException("Forced node id " + forced + " is not part of the tree");
            }
            state.keepWithAncestors(forced, costs.minimalKept(forced));
        }

        if (state.total > budget) {
            var message = "Minimal structure costs %d tokens, budget is %d".formatted(state.total, budget);
            log.debug("Compression infeasible: {}", message);
            var diagnostic = Diagnostic.warning(
                    Diagnostic.Code.BUDGET_INFEASIBLE, message, root.range(), root.path());
            return new CompressionPlan(root, costs, budget, state.decisions, false, true, List.of(diagnostic));
        }

        var nodes = new ArrayList<AstNode>(costs.size());
        root.stream().forEach(nodes::add);
        var scores = new double[costs.size()];
        for (var node : nodes) {
            double score = importance.applyAsDouble(node);
            scores[node.id() - root.id()] = Double.isNaN(score) ? 0.0 : score;
        }
        nodes.sort(Comparator.<AstNode>comparingDouble(n -> -scores[n.id() - root.id()])
                .thenComparingInt(AstNode::id));

        for (var node : nodes) {
            int id = node.id();
            if (state.decision(id) == Decision.FULL) {
                continue;
            }
            if (!state.tryUpgrade(id, Decision.FULL, budget)
                    && costs.hasSummaryForm(id)
                    && !state.tryUpgrade(id, Decision.SUMMARY, budget)) {
                log.trace("Node {} ({}) left {}", id, node.type(), state.decision(id));
            }
        }

        var plan = new CompressionPlan(root, costs, budget, state.decisions, false, false, List.of());
        log.debug("Compressed {} nodes into {}", costs.size(), plan);
        return plan;
    }

    /** Mutable decisions while a plan is being built. */
    static final class PlanState {
        private final NodeCosts costs;
        final Decision[] decisions;
        int total;

        PlanState(NodeCosts costs) {
            this.costs = costs;
            this.decisions = new Decision[costs.size()];
            Arrays.fill(decisions, Decision.ELIDED);
        }

        PlanState(NodeCosts costs, Decision[] decisions) {
            this.costs = costs;
            this.decisions = decisions.clone();
            for (int i = 0; i < decisions.length; i++) {
                total += costs.charge(costs.rootId() + i, decisions[i]);
            }
        }

        Decision decision(int id) {
            return decisions[id - costs.rootId()];
        }

        /** Raises {@code id} to {@code decision} if it currently keeps less. */
        void keep(int id, Decision decision) {
            var current = decision(id);
            if (current.atLeast(decision)) {
                return;
            }
            total += costs.charge(id, decision) - costs.charge(id, current);
            decisions[id - costs.rootId()] = decision;
        }

        void keepWithAncestors(int id, Decision decision) {
            keep(id, decision);
            for (int ancestor : costs.ancestors(id)) {
                if (!decision(ancestor).isKept()) {
                    keep(ancestor, costs.minimalKept(ancestor));
                }
            }
        }

        /** Cost of upgrading {@code id} to {@code decision}, elided ancestors included. */
        int upgradeDelta(int id, Decision decision) {
            int delta = costs.charge(id, decision) - costs.charge(id, decision(id));
            for (int ancestor : costs.ancestors(id)) {
                if (!decision(ancestor).isKept()) {
                    delta += costs.charge(ancestor, costs.minimalKept(ancestor));
                }
            }
            return delta;
        }

        boolean tryUpgrade(int id, Decision decision, int budget) {
            if (decision(id).atLeast(decision)) {
                return false;
            }
            if (total + upgradeDelta(id, decision) > budget) {
                return false;
            }
            keepWithAncestors(id, decision);
            return true;
        }
    }
}
