package ai.scopeview.analyzer.grammar;

import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.SourceContent;

/**
 * Boundary around the grammar engine. The raw tree produced for a source is lent to the consumer and released right
 * after, so no engine object ever escapes this package.
 */
public interface GrammarAdapter {
    Language language();

    /**
     * Parses {@code source} and passes the root together with one diagnostic per ERROR or MISSING node. A source with
     * syntax errors still yields a (partial) tree.
     */
    <T> T parse(SourceContent source, String path, RawTreeConsumer<T> consumer);
}
