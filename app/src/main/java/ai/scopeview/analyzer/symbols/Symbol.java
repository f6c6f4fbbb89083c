package ai.scopeview.analyzer.symbols;

import ai.scopeview.analyzer.Language;
import java.util.Comparator;
import java.util.Objects;

/**
 * A declaration. The declaring AST node is referenced by id within the file's parse result, never by object, so that
 * symbol tables do not keep trees alive.
 */
public record Symbol(
        String name,
        String qualifiedName,
        SymbolKind kind,
        String file,
        int declaringNodeId,
        int scopeId,
        Visibility visibility,
        Language language) {

    /** Order used wherever several symbols compete: by file path, then by node id. */
    public static final Comparator<Symbol> STABLE_ORDER = Comparator.comparing(Symbol::file)
            .thenComparingInt(Symbol::declaringNodeId)
            .thenComparing(Symbol::qualifiedName)
            .thenComparing(Symbol::kind);

    public Symbol {
        name = Objects.requireNonNullElse(name, "");
        qualifiedName = Objects.requireNonNullElse(qualifiedName, "");
        Objects.requireNonNull(kind, "kind");
        file = Objects.requireNonNullElse(file, "");
        Objects.requireNonNull(visibility, "visibility");
        language = Objects.requireNonNullElse(language, Language.UNKNOWN);
    }

    public boolean isLocal() {
        return visibility == Visibility.LOCAL;
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName + " (" + file + "#" + declaringNodeId + ")";
    }
}
