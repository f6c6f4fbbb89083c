package ai.scopeview.analyzer.grammar;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * {@link RawNode} over a tree-sitter node. Package-private so that TSNode stays inside the adapter.
 *
 * <p>{@code byteShift} is the number of source bytes the engine never saw (a stripped byte order mark). It is added to
 * every byte offset and to columns on the first row.
 */
final class TreeSitterRawNode implements RawNode {
    private final TSNode node;
    private final int byteShift;

    TreeSitterRawNode(TSNode node, int byteShift) {
        this.node = node;
        this.byteShift = byteShift;
    }

    static @Nullable RawNode wrap(@Nullable TSNode node, int byteShift) {
        if (node == null || node.isNull()) {
            return null;
        }
        return new TreeSitterRawNode(node, byteShift);
    }

    @Override
    public String type() {
        return node.getType();
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    public boolean isMissing() {
        return node.isMissing();
    }

    @Override
    public boolean isError() {
        return "ERROR".equals(node.getType());
    }

    @Override
    public int startByte() {
        return node.getStartByte() + byteShift;
    }

    @Override
    public int endByte() {
        return node.getEndByte() + byteShift;
    }

    @Override
    public int startRow() {
        return node.getStartPoint().getRow();
    }

    @Override
    public int startColumn() {
        var point = node.getStartPoint();
        return point.getRow() == 0 ? point.getColumn() + byteShift : point.getColumn();
    }

    @Override
    public int endRow() {
        return node.getEndPoint().getRow();
    }

    @Override
    public int endColumn() {
        var point = node.getEndPoint();
        return point.getRow() == 0 ? point.getColumn() + byteShift : point.getColumn();
    }

    @Override
    public int childCount() {
        return node.getChildCount();
    }

    @Override
    public @Nullable RawNode child(int index) {
        return wrap(node.getChild(index), byteShift);
    }

    @Override
    public @Nullable String fieldNameForChild(int index) {
        return node.getFieldNameForChild(index);
    }

    boolean hasError() {
        return node.hasError();
    }
}
