package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Diagnostic;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;
import org.jetbrains.annotations.Nullable;

/**
 * Per-node keep decisions over one AST. A plan annotates the tree it was computed for; it never copies or mutates it.
 *
 * <p>Every kept node (FULL or SUMMARY) has all its ancestors kept as well. Unless the plan is {@link #isInfeasible()
 * infeasible} or {@link #isOverBudget() over budget} the charged total stays within {@link #tokenLimit()}.
 */
public final class CompressionPlan {
    private final AstNode root;
    private final NodeCosts costs;
    private final int tokenLimit;
    private final Decision[] decisions;
    private final boolean overBudget;
    private final boolean infeasible;
    private final List<Diagnostic> diagnostics;

    CompressionPlan(
            AstNode root,
            NodeCosts costs,
            int tokenLimit,
            Decision[] decisions,
            boolean overBudget,
            boolean infeasible,
            List<Diagnostic> diagnostics) {
        this.root = root;
        this.costs = costs;
        this.tokenLimit = tokenLimit;
        this.decisions = decisions.clone();
        this.overBudget = overBudget;
        this.infeasible = infeasible;
        this.diagnostics = ImmutableList.copyOf(diagnostics);
    }

    public AstNode root() {
        return root;
    }

    public NodeCosts costs() {
        return costs;
    }

    public int tokenLimit() {
        return tokenLimit;
    }

    /** @throws IllegalArgumentException if {@code nodeId} is not part of the planned tree */
    public Decision decision(int nodeId) {
        if (!costs.contains(nodeId)) {
            throw new IllegalArgumentException("Node id " + nodeId + " is not part of this plan");
        }
        return decisions[nodeId - costs.rootId()];
    }

    public boolean isKept(int nodeId) {
        return decision(nodeId).isKept();
    }

    /** Tokens charged for the node under its current decision. */
    public int nodeCost(int nodeId) {
        return costs.charge(nodeId, decision(nodeId));
    }

    public int totalCost() {
        int total = 0;
        for (int i = 0; i < decisions.length; i++) {
            total += costs.charge(costs.rootId() + i, decisions[i]);
        }
        return total;
    }

    /** Decision of every node, keyed by id. */
    public Map<Integer, Decision> decisions() {
        var builder = ImmutableSortedMap.<Integer, Decision>naturalOrder();
        for (int i = 0; i < decisions.length; i++) {
            builder.put(costs.rootId() + i, decisions[i]);
        }
        return builder.build();
    }

    /** Charged cost of every node, keyed by id. */
    public Map<Integer, Integer> nodeCosts() {
        var builder = ImmutableSortedMap.<Integer, Integer>naturalOrder();
        for (int i = 0; i < decisions.length; i++) {
            int id = costs.rootId() + i;
            builder.put(id, costs.charge(id, decisions[i]));
        }
        return builder.build();
    }

    public List<Integer> keptIds() {
        return IntStream.range(0, decisions.length)
                .filter(i -> decisions[i].isKept())
                .mapToObj(i -> costs.rootId() + i)
                .toList();
    }

    public long count(Decision decision) {
        return Arrays.stream(decisions).filter(d -> d == decision).count();
    }

    /** True after an expansion pushed the total past the token limit. */
    public boolean isOverBudget() {
        return overBudget;
    }

    /** True when even the minimal structure did not fit; the plan is then that minimal structure. */
    public boolean isInfeasible() {
        return infeasible;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    Decision[] decisionArray() {
        return decisions.clone();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompressionPlan that)) {
            return false;
        }
        return tokenLimit == that.tokenLimit
                && overBudget == that.overBudget
                && infeasible == that.infeasible
                && costs.rootId() == that.costs.rootId()
                && Arrays.equals(decisions, that.decisions)
                && diagnostics.equals(that.diagnostics)
                && (root == that.root || root.equals(that.root));
    }

    @Override
    public int hashCode() {
        return Objects.hash(tokenLimit, overBudget, infeasible, costs.rootId(), Arrays.hashCode(decisions));
    }

    @Override
    public String toString() {
        return "CompressionPlan{limit=%d, total=%d, full=%d, summary=%d, elided=%d%s%s}"
                .formatted(
                        tokenLimit,
                        totalCost(),
                        count(Decision.FULL),
                        count(Decision.SUMMARY),
                        count(Decision.ELIDED),
                        overBudget ? ", overBudget" : "",
                        infeasible ? ", infeasible" : "");
    }
}
