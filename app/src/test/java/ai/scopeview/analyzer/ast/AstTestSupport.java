package ai.scopeview.analyzer.ast;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ParsePipeline;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.grammar.GrammarRegistry;

final class AstTestSupport {
    private static final ParsePipeline PIPELINE = new ParsePipeline(GrammarRegistry.defaults());

    private AstTestSupport() {}

    static ParseResult parse(String source, String path, Language language) {
        return PIPELINE.parse(source, path, language);
    }

    static AstNode node(ParseResult result, String qualifiedName) {
        return result.astRoot()
                .findByQualifiedName(qualifiedName)
                .orElseThrow(() -> new AssertionError("No node " + qualifiedName + " in " + result.path()));
    }
}
