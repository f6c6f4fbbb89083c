package ai.scopeview.analyzer;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;

/**
 * A node of the canonical concrete syntax tree. Every grammar node maps to exactly one CstNode; gaps the grammar does
 * not cover (whitespace between tokens) are represented by {@link #TRIVIA} leaves so that the leaves, read in order,
 * reproduce the source text exactly.
 *
 * <p>Instances are immutable and own their children.
 */
public final class CstNode {
    public static final String UNKNOWN = "UNKNOWN";
    public static final String TRIVIA = "TRIVIA";

    private final String type;
    private final String content;
    private final SourceRange range;
    private final String field;
    private final boolean named;
    private final List<CstNode> children;

    public CstNode(
            @Nullable String type,
            @Nullable String content,
            @Nullable SourceRange range,
            @Nullable String field,
            boolean named,
            @Nullable List<CstNode> children) {
        this.type = type == null || type.isEmpty() ? UNKNOWN : type;
        this.content = Objects.requireNonNullElse(content, "");
        this.range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
        this.field = Objects.requireNonNullElse(field, "");
        this.named = named;
        this.children = children == null ? List.of() : ImmutableList.copyOf(children);
    }

    /** The node used in place of a missing or null grammar node. */
    public static CstNode unknown() {
        return new CstNode(UNKNOWN, "", SourceRange.UNKNOWN, "", false, List.of());
    }

    public static CstNode trivia(String content, SourceRange range) {
        return new CstNode(TRIVIA, content, range, "", false, List.of());
    }

    public String type() {
        return type;
    }

    public String content() {
        return content;
    }

    public SourceRange range() {
        return range;
    }

    /** Grammar field name under which this node hangs in its parent, or "". */
    public String field() {
        return field;
    }

    public boolean named() {
        return named;
    }

    public List<CstNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isTrivia() {
        return TRIVIA.equals(type);
    }

    public boolean isError() {
        return "ERROR".equals(type);
    }

    /** Children that are neither trivia nor anonymous tokens. */
    public List<CstNode> namedChildren() {
        var result = new ArrayList<CstNode>();
        for (var child : children) {
            if (child.named && !child.isTrivia()) {
                result.add(child);
            }
        }
        return result;
    }

    /** First child hanging under the given grammar field, or null. */
    public @Nullable CstNode childByField(String fieldName) {
        for (var child : children) {
            if (fieldName.equals(child.field)) {
                return child;
            }
        }
        return null;
    }

    public List<CstNode> childrenByField(String fieldName) {
        var result = new ArrayList<CstNode>();
        for (var child : children) {
            if (fieldName.equals(child.field)) {
                result.add(child);
            }
        }
        return result;
    }

    public @Nullable CstNode firstChildOfType(String childType) {
        for (var child : children) {
            if (childType.equals(child.type)) {
                return child;
            }
        }
        return null;
    }

    public boolean hasChildOfType(String childType) {
        return firstChildOfType(childType) != null;
    }

    /** Depth-first pre-order visit. Iterative, so deeply nested sources do not overflow the stack. */
    public void visit(Consumer<CstNode> visitor) {
        var stack = new ArrayDeque<CstNode>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            visitor.accept(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
    }

    /** Leaves in document order. */
    public List<CstNode> leaves() {
        var result = new ArrayList<CstNode>();
        visit(n -> {
            if (n.isLeaf()) {
                result.add(n);
            }
        });
        return result;
    }

    /** Concatenation of all leaf content; equals the parsed source for a tree produced by the CST builder. */
    public String leafText() {
        var sb = new StringBuilder();
        for (var leaf : leaves()) {
            sb.append(leaf.content);
        }
        return sb.toString();
    }

    /** Structural equality: type, content, range, field and children. */
    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof CstNode other)) return false;
        return named == other.named
                && type.equals(other.type)
                && content.equals(other.content)
                && range.equals(other.range)
                && field.equals(other.field)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, range, field, children.size());
    }

    @Override
    public String toString() {
        return "CstNode[" + type + " " + range + "]";
    }
}
