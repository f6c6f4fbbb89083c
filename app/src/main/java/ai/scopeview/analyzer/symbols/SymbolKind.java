package ai.scopeview.analyzer.symbols;

import ai.scopeview.analyzer.NodeType;
import java.util.Optional;

/** What a symbol declares. */
public enum SymbolKind {
    FUNCTION,
    METHOD,
    CLASS,
    STRUCT,
    UNION,
    ENUM,
    INTERFACE,
    NAMESPACE,
    MODULE,
    VARIABLE,
    PARAMETER,
    TYPE,
    MACRO,
    IMPORT;

    /** Kind of symbol a declaration node of {@code type} introduces; empty for nodes that declare nothing. */
    public static Optional<SymbolKind> forNodeType(NodeType type) {
        return Optional.ofNullable(
                switch (type) {
                    case FUNCTION, LAMBDA -> FUNCTION;
                    case METHOD -> METHOD;
                    case CLASS -> CLASS;
                    case STRUCT -> STRUCT;
                    case UNION -> UNION;
                    case ENUM -> ENUM;
                    case INTERFACE -> INTERFACE;
                    case NAMESPACE -> NAMESPACE;
                    case MODULE -> MODULE;
                    case VARIABLE, PROPERTY -> VARIABLE;
                    case TYPEDEF -> TYPE;
                    case MACRO -> MACRO;
                    case ROOT, USING, INCLUDE, IMPORT, COMMENT, DOCSTRING, UNKNOWN -> null;
                });
    }

    public boolean isType() {
        return switch (this) {
            case CLASS, STRUCT, UNION, ENUM, INTERFACE, TYPE -> true;
            default -> false;
        };
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD || this == MACRO;
    }

    /** Kinds whose members can be reached through a qualified name. */
    public boolean isContainer() {
        return isType() || this == NAMESPACE || this == MODULE;
    }
}
