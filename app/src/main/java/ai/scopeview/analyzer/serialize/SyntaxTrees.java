package ai.scopeview.analyzer.serialize;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.Language;

/** The trees read back from a serialized parse result. */
public record SyntaxTrees(Language language, AstNode ast, CstNode cst) {}
