package ai.scopeview.analyzer.ast;

import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Per-language table that drives AST construction: which grammar node types produce which semantic nodes and where
 * the interesting parts of a declaration live in its subtree.
 *
 * @param nodeTypes grammar node type to semantic type; a grammar type mapped to {@link NodeType#INCLUDE} is an
 *     include/import directive and is emitted as {@code importNodeType}
 * @param transparentTypes grammar containers walked through as if their children belonged to the enclosing scope
 * @param importNodeType COMMENT for the C family (includes normalize to a comment-like node), IMPORT for Python
 * @param callTypes grammar types of call sites; the callee hangs under {@code calleeField}
 * @param typeReferenceTypes grammar types naming a type where it is used
 * @param useReferenceTypes identifier types reported as plain USE references inside function bodies
 * @param modifierTokens anonymous tokens recorded as boolean attributes (async, static, ...)
 */
public record ComplianceRules(
        Language language,
        Map<String, NodeType> nodeTypes,
        Set<String> transparentTypes,
        Set<String> commentTypes,
        NodeType importNodeType,
        DocstringStyle docstringStyle,
        String nameField,
        String parametersField,
        String bodyField,
        String returnTypeField,
        Set<String> callTypes,
        String calleeField,
        Set<String> typeReferenceTypes,
        Set<String> useReferenceTypes,
        Set<String> modifierTokens) {

    public ComplianceRules {
        nodeTypes = Map.copyOf(nodeTypes);
        transparentTypes = Set.copyOf(transparentTypes);
        commentTypes = Set.copyOf(commentTypes);
        callTypes = Set.copyOf(callTypes);
        typeReferenceTypes = Set.copyOf(typeReferenceTypes);
        useReferenceTypes = Set.copyOf(useReferenceTypes);
        modifierTokens = Set.copyOf(modifierTokens);
        if (importNodeType != NodeType.COMMENT && importNodeType != NodeType.IMPORT) {
            throw new IllegalArgumentException("Imports normalize to COMMENT or IMPORT, not " + importNodeType);
        }
    }

    public @Nullable NodeType semanticType(String grammarType) {
        return nodeTypes.get(grammarType);
    }

    public boolean isTransparent(String grammarType) {
        return transparentTypes.contains(grammarType);
    }

    public boolean isComment(String grammarType) {
        return commentTypes.contains(grammarType);
    }

    /** Table for {@code language}; throws for {@link Language#UNKNOWN}. */
    public static ComplianceRules forLanguage(Language language) {
        return switch (language) {
            case C -> CAstBuilder.RULES;
            case CPP -> CppAstBuilder.RULES;
            case PYTHON -> PythonAstBuilder.RULES;
            case JAVASCRIPT -> JsTsAstBuilder.JAVASCRIPT_RULES;
            case TYPESCRIPT -> JsTsAstBuilder.TYPESCRIPT_RULES;
            case UNKNOWN -> throw new IllegalArgumentException("No compliance rules for " + language);
        };
    }
}
