package ai.scopeview.analyzer.cst;

import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.SourceContent;
import ai.scopeview.analyzer.SourceRange;
import ai.scopeview.analyzer.grammar.RawNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Translates a raw grammar tree into the canonical {@link CstNode} form. Node order, types and ranges are preserved
 * one to one; bytes the grammar leaves uncovered become {@link CstNode#TRIVIA} leaves so that the leaves concatenate
 * back to the exact source. The root always spans the whole file.
 */
public final class CstBuilder {
    private static final Logger log = LogManager.getLogger(CstBuilder.class);

    private final SourceContent source;

    public CstBuilder(SourceContent source) {
        this.source = source;
    }

    public CstNode build(@Nullable RawNode root) {
        if (root == null) {
            log.debug("Null root node, producing an UNKNOWN root");
            var children = source.byteLength() == 0
                    ? List.<CstNode>of()
                    : List.of(trivia(0, source.byteLength()));
            return new CstNode(
                    CstNode.UNKNOWN, source.text(), source.rangeOf(0, source.byteLength()), "", false, children);
        }
        return convert(root, "", 0, source.byteLength());
    }

    /** Converts a single node; a null raw node becomes an UNKNOWN leaf with no content. */
    public CstNode convert(@Nullable RawNode node, @Nullable String field) {
        if (node == null) {
            return CstNode.unknown();
        }
        return convert(node, field, clamp(node.startByte()), clamp(node.endByte()));
    }

    /**
     * Converts {@code node} covering exactly the bytes [start, end), which may differ from the node's own span. Built
     * post-order on an explicit stack, so nesting depth is bounded by heap rather than thread stack.
     */
    private CstNode convert(RawNode node, @Nullable String field, int start, int end) {
        var stack = new ArrayDeque<PendingNode>();
        stack.push(new PendingNode(node, field, start, end));
        while (true) {
            var top = stack.peek();
            if (top.index < top.count) {
                int i = top.index++;
                var child = top.node.child(i);
                if (child == null) {
                    top.children.add(CstNode.unknown());
                    continue;
                }
                int childStart = clamp(child.startByte());
                int childEnd = clamp(child.endByte());
                if (childStart < top.cursor) {
                    // overlapping children would duplicate bytes in the leaf text
                    log.trace(
                            "Child {} at byte {} overlaps previous sibling ending at {}",
                            child.type(),
                            childStart,
                            top.cursor);
                    if (childEnd <= top.cursor) {
                        continue;
                    }
                    childStart = top.cursor;
                }
                if (childEnd > top.end) {
                    childEnd = Math.max(childStart, top.end);
                }
                if (childStart > top.cursor) {
                    top.children.add(trivia(top.cursor, childStart));
                }
                top.cursor = Math.max(top.cursor, childEnd);
                stack.push(new PendingNode(child, top.node.fieldNameForChild(i), childStart, childEnd));
                continue;
            }
            stack.pop();
            var built = finish(top);
            var parent = stack.peek();
            if (parent == null) {
                return built;
            }
            parent.children.add(built);
        }
    }

    private CstNode finish(PendingNode pending) {
        var node = pending.node;
        if (pending.count > 0 && pending.cursor < pending.end) {
            pending.children.add(trivia(pending.cursor, pending.end));
        }
        boolean exact = pending.start == node.startByte() && pending.end == node.endByte();
        var range = exact ? rangeOf(node) : source.rangeOf(pending.start, pending.end);
        return new CstNode(
                node.type(),
                source.substringFromBytes(pending.start, pending.end),
                range,
                pending.field,
                node.isNamed(),
                pending.children);
    }

    private CstNode trivia(int startByte, int endByte) {
        return CstNode.trivia(source.substringFromBytes(startByte, endByte), source.rangeOf(startByte, endByte));
    }

    private SourceRange rangeOf(RawNode node) {
        return SourceRange.clamped(node.startRow(), node.startColumn(), node.endRow(), node.endColumn());
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, source.byteLength()));
    }

    /** A raw node whose children are still being converted. */
    private static final class PendingNode {
        final RawNode node;
        final @Nullable String field;
        final int start;
        final int end;
        final int count;
        final List<CstNode> children;
        int index;
        int cursor;

        PendingNode(RawNode node, @Nullable String field, int start, int end) {
            this.node = node;
            this.field = field;
            this.start = start;
            this.end = end;
            this.count = node.childCount();
            this.children = new ArrayList<>(count);
            this.cursor = start;
        }
    }
}
