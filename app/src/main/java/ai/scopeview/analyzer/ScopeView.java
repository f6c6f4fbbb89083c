package ai.scopeview.analyzer;

import ai.scopeview.analyzer.context.CompressionPlan;
import ai.scopeview.analyzer.context.ContextEngine;
import ai.scopeview.analyzer.context.ContextOptions;
import ai.scopeview.analyzer.context.TokenEstimator;
import ai.scopeview.analyzer.grammar.GrammarRegistry;
import ai.scopeview.analyzer.project.ProjectConfig;
import ai.scopeview.analyzer.project.ProjectContext;
import ai.scopeview.analyzer.resolve.ReferenceResolver;
import java.nio.file.Path;
import java.util.function.ToDoubleFunction;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point: language detection, parsing, and compression of single files, plus a factory for multi-file
 * {@link ProjectContext}s sharing the same grammar registry.
 */
public final class ScopeView {
    private final ParsePipeline pipeline;
    private final ContextEngine engine;

    public ScopeView() {
        this(GrammarRegistry.defaults(), new ContextEngine());
    }

    public ScopeView(GrammarRegistry registry, ContextEngine engine) {
        this.pipeline = new ParsePipeline(registry);
        this.engine = engine;
    }

    public ScopeView(GrammarRegistry registry, ContextOptions options, TokenEstimator estimator) {
        this(registry, new ContextEngine(options, estimator));
    }

    public ParsePipeline pipeline() {
        return pipeline;
    }

    public ContextEngine contextEngine() {
        return engine;
    }

    public Language detectLanguage(@Nullable String path, String content) {
        return ParsePipeline.detect(path == null ? "" : path, content);
    }

    /**
     * Parses one file. Syntax errors do not throw; they come back as diagnostics on a partial result.
     *
     * @param language null or UNKNOWN to detect it from the path and content
     * @throws ParseException when the language has no grammar or the grammar produced no tree
     */
    public ParseResult parse(String content, String path, @Nullable Language language) {
        return pipeline.parse(content, path, language);
    }

    public CompressionPlan compress(AstNode astRoot, int budget, ToDoubleFunction<AstNode> importance) {
        return engine.compress(astRoot, budget, importance);
    }

    public CompressionPlan expand(CompressionPlan plan, int nodeId) {
        return engine.expand(plan, nodeId);
    }

    public ProjectContext openProject(Path root, ProjectConfig config) {
        return new ProjectContext(root, config, pipeline, ReferenceResolver.defaults());
    }

    /** Opens {@code root} with the settings of its {@code scopeview.properties}, if any. */
    public ProjectContext openProject(Path root) {
        return openProject(root, ProjectConfig.load(root));
    }
}
