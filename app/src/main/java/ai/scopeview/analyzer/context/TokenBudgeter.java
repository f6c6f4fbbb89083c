package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.AstNode;
import java.util.Arrays;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assigns token costs to AST nodes. A node's own cost is the estimate of its raw text with the children's text cut
 * out; its full cost adds the children's full costs, so full cost never decreases towards the root.
 */
public final class TokenBudgeter {
    private static final Logger log = LogManager.getLogger(TokenBudgeter.class);

    public static final int DEFAULT_SUMMARY_COST = 8;

    private final TokenEstimator estimator;
    private final int summaryCost;

    public TokenBudgeter(TokenEstimator estimator) {
        this(estimator, DEFAULT_SUMMARY_COST);
    }

    public TokenBudgeter(TokenEstimator estimator, int summaryCost) {
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        if (summaryCost < 0) {
            throw new IllegalArgumentException("summaryCost must not be negative: " + summaryCost);
        }
        this.summaryCost = summaryCost;
    }

    public int summaryCost() {
        return summaryCost;
    }

    public TokenEstimator estimator() {
        return estimator;
    }

    public NodeCosts costs(AstNode root) {
        int base = root.id();
        int size = root.size();
        var own = new int[size];
        var full = new int[size];
        var parents = new int[size];
        var summarizable = new boolean[size];
        Arrays.fill(parents, -1);

        var nodes = new AstNode[size];
        root.stream().forEach(n -> nodes[n.id() - base] = n);
        for (var node : nodes) {
            int i = node.id() - base;
            own[i] = estimator.estimate(ownText(node));
            summarizable[i] = node.type().hasSummaryForm();
            for (var child : node.children()) {
                parents[child.id() - base] = i;
            }
        }
        // children always have larger pre-order ids than their parent
        for (int i = size - 1; i >= 0; i--) {
            full[i] += own[i];
            if (parents[i] >= 0) {
                full[parents[i]] += full[i];
            }
        }
        // parent links are stored as absolute ids
        for (int i = 0; i < size; i++) {
            if (parents[i] >= 0) {
                parents[i] += base;
            }
        }
        log.trace("Costed {} nodes, full cost {}", size, size == 0 ? 0 : full[0]);
        return new NodeCosts(base, own, full, parents, summarizable, summaryCost);
    }

    /** Raw text of {@code node} with each child's raw text removed. */
    static String ownText(AstNode node) {
        var raw = node.rawContent();
        if (node.children().isEmpty()) {
            return raw;
        }
        var sb = new StringBuilder();
        int cursor = 0;
        for (var child : node.children()) {
            var text = child.rawContent();
            if (text.isEmpty()) {
                continue;
            }
            int at = raw.indexOf(text, cursor);
            if (at < 0) {
                continue;
            }
            sb.append(raw, cursor, at);
            cursor = at + text.length();
        }
        sb.append(raw, cursor, raw.length());
        return sb.toString();
    }
}
