package ai.scopeview.analyzer.grammar;

import ai.scopeview.analyzer.Diagnostic;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ParseException;
import ai.scopeview.analyzer.SourceContent;
import ai.scopeview.analyzer.SourceRange;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Tree-sitter backed adapter. Parsers are not thread safe, so each thread gets its own from a {@link ThreadLocal}.
 */
public final class TreeSitterGrammarAdapter implements GrammarAdapter {
    private static final Logger log = LogManager.getLogger(TreeSitterGrammarAdapter.class);

    /** Stop reporting individual syntax errors after this many in one file. */
    static final int MAX_SYNTAX_DIAGNOSTICS = 100;

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    /** UTF-8 length of the byte order mark. */
    static final int BOM_BYTES = 3;

    private final Language language;
    private final ThreadLocal<TSParser> parserCache;

    public TreeSitterGrammarAdapter(Language language, Supplier<TSLanguage> grammar) {
        this.language = Objects.requireNonNull(language, "language");
        Objects.requireNonNull(grammar, "grammar");
        this.parserCache = ThreadLocal.withInitial(() -> {
            var parser = new TSParser();
            parser.setLanguage(grammar.get());
            return parser;
        });
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public <T> T parse(SourceContent source, String path, RawTreeConsumer<T> consumer) {
        var parser = parserCache.get();
        // the engine's offsets disagree with ours past a leading BOM, so it only sees the text after it
        var text = source.text();
        int shift = 0;
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
            shift = BOM_BYTES;
        }
        TSTree tree;
        try {
            tree = parser.parseString(null, text);
        } catch (RuntimeException e) {
            var diag = Diagnostic.error(
                    Diagnostic.Code.SYNTAX_ERROR, "Grammar engine failed: " + e.getMessage(), SourceRange.UNKNOWN, path);
            throw new ParseException("Failed to parse " + path, List.of(diag), e);
        }
        if (tree == null) {
            var diag = Diagnostic.error(
                    Diagnostic.Code.SYNTAX_ERROR, "Grammar engine returned no tree", SourceRange.UNKNOWN, path);
            throw new ParseException("Failed to parse " + path, List.of(diag));
        }
        var root = new TreeSitterRawNode(tree.getRootNode(), shift);
        var diagnostics = root.hasError() ? collectSyntaxDiagnostics(root, path) : List.<Diagnostic>of();
        if (!diagnostics.isEmpty()) {
            log.debug("{} syntax diagnostics in {}", diagnostics.size(), path);
        }
        // the tree stays reachable until the consumer returns; nothing handed out may outlive this call
        return consumer.accept(root, diagnostics);
    }

    /** One diagnostic per ERROR or MISSING node, in document order. ERROR subtrees are not searched further. */
    static List<Diagnostic> collectSyntaxDiagnostics(RawNode root, String path) {
        var diagnostics = new ArrayList<Diagnostic>();
        var stack = new ArrayDeque<RawNode>();
        stack.push(root);
        while (!stack.isEmpty() && diagnostics.size() < MAX_SYNTAX_DIAGNOSTICS) {
            var node = stack.pop();
            var range = new SourceRange(node.startRow(), node.startColumn(), node.endRow(), node.endColumn());
            if (node.isError()) {
                diagnostics.add(Diagnostic.error(Diagnostic.Code.SYNTAX_ERROR, "Syntax error", range, path));
                continue;
            }
            if (node.isMissing()) {
                diagnostics.add(Diagnostic.error(
                        Diagnostic.Code.MISSING_NODE, "Missing " + node.type(), range, path));
                continue;
            }
            for (int i = node.childCount() - 1; i >= 0; i--) {
                var child = node.child(i);
                if (child != null) {
                    stack.push(child);
                }
            }
        }
        return diagnostics;
    }
}
