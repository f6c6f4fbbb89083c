package ai.scopeview.analyzer.grammar;

import org.jetbrains.annotations.Nullable;

/**
 * Read-only view of a grammar engine node. Only valid inside the {@link RawTreeConsumer} it was handed to; the
 * underlying tree is released as soon as the consumer returns.
 */
public interface RawNode {
    String type();

    boolean isNamed();

    /** Zero-width node the engine inserted to recover from a syntax error. */
    boolean isMissing();

    boolean isError();

    int startByte();

    int endByte();

    int startRow();

    /** Zero-based UTF-8 byte column. */
    int startColumn();

    int endRow();

    int endColumn();

    int childCount();

    /** The i-th child, or null when the engine has no node there. */
    @Nullable
    RawNode child(int index);

    /** Grammar field under which the i-th child hangs, or null. */
    @Nullable
    String fieldNameForChild(int index);
}
