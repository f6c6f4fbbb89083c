package ai.scopeview.analyzer.symbols;

import ai.scopeview.analyzer.NodeType;

/**
 * A node of a file's scope tree. Scope 0 is the file scope and has parent -1.
 *
 * @param ownerNodeId AST node that opens the scope
 * @param kind semantic type of the owner
 * @param qualifiedName qualified name of the owner, "" for the file scope
 */
public record Scope(int scopeId, int parentScopeId, int ownerNodeId, NodeType kind, String qualifiedName) {
    public static final int FILE_SCOPE = 0;

    public boolean isFileScope() {
        return parentScopeId < 0;
    }

    public boolean isFunction() {
        return kind.isFunctionLike();
    }

    public boolean isClass() {
        return kind.isClassLike();
    }
}
