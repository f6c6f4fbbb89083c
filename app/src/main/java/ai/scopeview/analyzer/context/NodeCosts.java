package ai.scopeview.analyzer.context;

import java.util.ArrayList;
import java.util.List;

/**
 * Token costs of every node of one AST subtree, addressed by node id, plus the parent links the compressor needs.
 * Computed once per tree by {@link TokenBudgeter}; immutable. Ids run from {@link #rootId()} to
 * {@code rootId() + size() - 1}.
 */
public final class NodeCosts {
    private final int[] ownCost;
    private final int[] fullCost;
    private final int[] parents;
    private final boolean[] summarizable;
    private final int summaryCost;
    private final int rootId;

    NodeCosts(int rootId, int[] ownCost, int[] fullCost, int[] parents, boolean[] summarizable, int summaryCost) {
        this.ownCost = ownCost;
        this.fullCost = fullCost;
        this.parents = parents;
        this.summarizable = summarizable;
        this.summaryCost = summaryCost;
        this.rootId = rootId;
    }

    public int rootId() {
        return rootId;
    }

    public boolean contains(int id) {
        return id >= rootId && id < rootId + ownCost.length;
    }

    private int index(int id) {
        if (!contains(id)) {
            throw new IllegalArgumentException("Node id %d outside [%d, %d)".formatted(id, rootId, rootId + size()));
        }
        return id - rootId;
    }

    public int size() {
        return ownCost.length;
    }

    /** Tokens of the node's own text, with its children's text removed. */
    public int ownCost(int id) {
        return ownCost[index(id)];
    }

    /** Tokens of the node with its whole subtree kept in full. */
    public int fullCost(int id) {
        return fullCost[index(id)];
    }

    public int summaryCost() {
        return summaryCost;
    }

    public boolean hasSummaryForm(int id) {
        return summarizable[index(id)];
    }

    /** Parent id, -1 for the root. */
    public int parentOf(int id) {
        return parents[index(id)];
    }

    /** Ancestor ids, nearest first. */
    public List<Integer> ancestors(int id) {
        var result = new ArrayList<Integer>();
        for (int p = parentOf(id); p >= 0; p = parentOf(p)) {
            result.add(p);
        }
        return result;
    }

    /**
     * Tokens charged for a node under {@code decision}. A FULL node pays for its own text only; its children are
     * charged under their own decisions.
     */
    public int charge(int id, Decision decision) {
        return switch (decision) {
            case FULL -> ownCost(id);
            case SUMMARY -> summaryCost;
            case ELIDED -> 0;
        };
    }

    /** The cheapest decision that keeps {@code id}: SUMMARY when it has a summary form, FULL otherwise. */
    public Decision minimalKept(int id) {
        return hasSummaryForm(id) ? Decision.SUMMARY : Decision.FULL;
    }
}
