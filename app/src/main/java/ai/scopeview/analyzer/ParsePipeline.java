package ai.scopeview.analyzer;

import ai.scopeview.analyzer.ast.AstBuilder;
import ai.scopeview.analyzer.cst.CstBuilder;
import ai.scopeview.analyzer.grammar.GrammarRegistry;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs one file through detection, the grammar adapter, the CST builder and the AST builder. The stages run on the
 * calling thread; parallelism comes from running several pipelines at once, which is safe because adapters keep a
 * parser per thread and builders are created per call.
 */
public final class ParsePipeline {
    private static final Logger log = LogManager.getLogger(ParsePipeline.class);

    private final GrammarRegistry registry;

    public ParsePipeline(GrammarRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public GrammarRegistry registry() {
        return registry;
    }

    /**
     * Parses {@code content}. A null or UNKNOWN {@code language} is detected from the path and content.
     *
     * @throws GrammarUnavailableException when no grammar handles the language
     * @throws ParseException when the grammar engine produced nothing at all
     */
    public ParseResult parse(String content, String path, @Nullable Language language) {
        Objects.requireNonNull(content, "content");
        var safePath = Objects.requireNonNullElse(path, "");
        var lang = language == null || !language.isKnown() ? detect(safePath, content) : language;
        var adapter = registry.require(lang, safePath);
        var source = SourceContent.of(content);

        long start = System.nanoTime();
        var cst = adapter.parse(
                source,
                safePath,
                (root, syntaxDiagnostics) -> new CstStage(new CstBuilder(source).build(root), syntaxDiagnostics));
        var ast = AstBuilder.forLanguage(lang).build(cst.root(), safePath);
        var result = new ParseResult(
                lang, safePath, source, cst.root(), ast.root(), ast.imports(), ast.referenceSites(), cst.diagnostics());
        log.debug(
                "Parsed {} as {} in {} ms: {} AST nodes, {} diagnostics",
                safePath,
                lang,
                (System.nanoTime() - start) / 1_000_000,
                result.nodeCount(),
                result.diagnostics().size());
        return result;
    }

    static Language detect(String path, String content) {
        @Nullable Path p;
        try {
            p = path.isEmpty() ? null : Path.of(path);
        } catch (InvalidPathException e) {
            log.warn("Cannot interpret {} as a path, detecting from content only", path);
            p = null;
        }
        return LanguageDetector.detect(p, content);
    }

    /** The canonical tree copied out of the raw one, plus the adapter's syntax diagnostics. */
    private record CstStage(CstNode root, List<Diagnostic> diagnostics) {}
}
