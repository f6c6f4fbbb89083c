package ai.scopeview.analyzer;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Everything the parse pipeline produced for one file: both trees, the side tables collected while building the AST,
 * and the syntax diagnostics. AST nodes are addressed by their pre-order id through an arena, so symbols and plans can
 * point at nodes with a plain int.
 *
 * <p>Instances are immutable. A re-parse produces a new ParseResult; the old one is simply dropped.
 */
public final class ParseResult {
    private final Language language;
    private final String path;
    private final SourceContent source;
    private final CstNode cstRoot;
    private final AstNode astRoot;
    private final List<ImportDirective> imports;
    private final List<ReferenceSite> referenceSites;
    private final List<Diagnostic> diagnostics;

    private final ImmutableList<AstNode> arena;
    private final int[] parentIds;

    public ParseResult(
            Language language,
            String path,
            SourceContent source,
            CstNode cstRoot,
            AstNode astRoot,
            List<ImportDirective> imports,
            List<ReferenceSite> referenceSites,
            List<Diagnostic> diagnostics) {
        this.language = Objects.requireNonNull(language, "language");
        this.path = Objects.requireNonNullElse(path, "");
        this.source = Objects.requireNonNull(source, "source");
        this.cstRoot = Objects.requireNonNull(cstRoot, "cstRoot");
        this.astRoot = Objects.requireNonNull(astRoot, "astRoot");
        this.imports = List.copyOf(imports);
        this.referenceSites = List.copyOf(referenceSites);
        this.diagnostics = List.copyOf(diagnostics);

        var nodes = new ArrayList<AstNode>(astRoot.size());
        var parents = new int[astRoot.size()];
        Arrays.fill(parents, -1);
        var stack = new ArrayDeque<AstNode>();
        stack.push(astRoot);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (node.id() != nodes.size()) {
                throw new IllegalArgumentException(
                        "AST ids must be pre-order indexes: expected " + nodes.size() + " but found " + node.id());
            }
            nodes.add(node);
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                var child = children.get(i);
                parents[child.id()] = node.id();
                stack.push(child);
            }
        }
        this.arena = ImmutableList.copyOf(nodes);
        this.parentIds = parents;
    }

    public Language language() {
        return language;
    }

    public String path() {
        return path;
    }

    public SourceContent source() {
        return source;
    }

    public CstNode cstRoot() {
        return cstRoot;
    }

    public AstNode astRoot() {
        return astRoot;
    }

    public List<ImportDirective> imports() {
        return imports;
    }

    public List<ReferenceSite> referenceSites() {
        return referenceSites;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /** True when the grammar reported errors and the trees cover only what could be recovered. */
    public boolean isPartial() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    public int nodeCount() {
        return arena.size();
    }

    /** All AST nodes in pre-order; index equals id. */
    public List<AstNode> nodes() {
        return arena;
    }

    /** @throws IndexOutOfBoundsException for an id outside this file's arena */
    public AstNode node(int id) {
        return arena.get(id);
    }

    public Optional<AstNode> findNode(int id) {
        return id >= 0 && id < arena.size() ? Optional.of(arena.get(id)) : Optional.empty();
    }

    /** Parent id of {@code id}, or -1 for the root. */
    public int parentOf(int id) {
        Objects.checkIndex(id, parentIds.length);
        return parentIds[id];
    }

    public @Nullable AstNode parentNode(int id) {
        int parent = parentOf(id);
        return parent < 0 ? null : arena.get(parent);
    }

    /** Ancestor ids of {@code id}, nearest first, ending with the root. */
    public List<Integer> ancestors(int id) {
        var result = new ArrayList<Integer>();
        for (int p = parentOf(id); p >= 0; p = parentIds[p]) {
            result.add(p);
        }
        return result;
    }

    @Override
    public String toString() {
        return "ParseResult{" + language + " " + path + ", nodes=" + arena.size() + ", diagnostics="
                + diagnostics.size() + "}";
    }
}
