package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.project.ProjectContext;
import ai.scopeview.analyzer.resolve.Reference;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Ranks, compresses, expands and renders AST views for a file or a whole project. */
public final class ContextEngine {
    private static final Logger log = LogManager.getLogger(ContextEngine.class);

    private final ContextOptions options;
    private final Compressor compressor;

    public ContextEngine(ContextOptions options, TokenEstimator estimator) {
        this.options = options;
        this.compressor = new Compressor(new TokenBudgeter(estimator, options.summaryCost()));
    }

    public ContextEngine(ContextOptions options) {
        this(options, new JtokkitTokenEstimator());
    }

    public ContextEngine() {
        this(ContextOptions.DEFAULTS);
    }

    public ContextOptions options() {
        return options;
    }

    public NodeCosts costs(AstNode root) {
        return compressor.budgeter().costs(root);
    }

    public CompressionPlan compress(AstNode root, int budget, ToDoubleFunction<AstNode> importance) {
        return compressor.compress(root, budget, importance);
    }

    public CompressionPlan compress(
            AstNode root, int budget, ToDoubleFunction<AstNode> importance, Set<Integer> forcedIds) {
        return compressor.compress(root, budget, importance, forcedIds);
    }

    public CompressionPlan expand(CompressionPlan plan, int nodeId) {
        return Expander.expand(plan, nodeId);
    }

    public String render(ParseResult parse, CompressionPlan plan) {
        return new ContextRenderer(parse.language()).render(plan);
    }

    /** Compresses one file under {@link ContextOptions#maxTokens()}, ranked against {@code query}. */
    public CompressionPlan buildContext(ParseResult parse, RelevanceQuery query) {
        return buildContext(parse, query, Map.of(), options.maxTokens());
    }

    private CompressionPlan buildContext(
            ParseResult parse, RelevanceQuery query, Map<String, Integer> referenceCounts, int budget) {
        var scorer = new RelevanceScorer(options, query, referenceCounts);
        return compressor.compress(parse.astRoot(), budget, scorer, focusedIds(parse, query));
    }

    /**
     * Shares {@link ContextOptions#maxTokens()} across the project's parsed files. Files are ordered by the score of
     * their most relevant node and each one is compressed into whatever budget the previous ones left. Stale files are
     * re-resolved first so reference counts reflect the current sources.
     */
    public ContextWindow buildProjectContext(ProjectContext project, RelevanceQuery query) {
        if (!project.staleFiles().isEmpty()) {
            project.resolveAll();
        }
        var referenceCounts = new HashMap<String, Integer>();
        for (var file : project.files()) {
            for (Reference ref : project.references(file)) {
                ref.resolvedSymbol().ifPresent(s -> referenceCounts.merge(s.qualifiedName(), 1, Integer::sum));
            }
        }

        var scorer = new RelevanceScorer(options, query, referenceCounts);
        var parses = new ArrayList<ParseResult>();
        var best = new HashMap<String, Double>();
        for (var file : project.files()) {
            project.parseResult(file).ifPresent(parse -> {
                parses.add(parse);
                best.put(file, parse.nodes().stream().mapToDouble(scorer).max().orElse(0.0));
            });
        }
        parses.sort(Comparator.<ParseResult>comparingDouble(p -> -best.get(p.path()))
                .thenComparing(ParseResult::path));

        int remaining = options.maxTokens();
        var included = new ArrayList<ContextWindow.FileContext>();
        var skipped = new ArrayList<String>();
        for (var parse : parses) {
            var plan = buildContext(parse, query, referenceCounts, remaining);
            if (plan.isInfeasible()) {
                skipped.add(parse.path());
                continue;
            }
            remaining -= plan.totalCost();
            included.add(new ContextWindow.FileContext(parse.path(), parse.language(), plan, render(parse, plan)));
        }
        log.debug(
                "Project context: {} files included, {} skipped, {} of {} tokens",
                included.size(),
                skipped.size(),
                options.maxTokens() - remaining,
                options.maxTokens());
        return new ContextWindow(options.maxTokens(), included, skipped);
    }

    /** Focused nodes of the file, which the compressor must keep. */
    private static Set<Integer> focusedIds(ParseResult parse, RelevanceQuery query) {
        if (query.focus().isEmpty()) {
            return Set.of();
        }
        var ids = new TreeSet<Integer>();
        for (var node : parse.nodes()) {
            if (!node.qualifiedName().isEmpty() && query.focus().contains(node.qualifiedName())) {
                ids.add(node.id());
            }
        }
        return ids;
    }
}
