package ai.scopeview.analyzer;

import java.util.List;
import java.util.Objects;

/**
 * An identifier occurrence collected while building the AST. {@code name} may be qualified ({@code ns::f},
 * {@code mod.attr}); {@link #segments()} splits it on the language separator.
 *
 * @param enclosingNodeId id of the innermost scope-opening AST node containing the site
 * @param source for IMPORT sites, the module or header the name is imported from; otherwise ""
 */
public record ReferenceSite(
        String name, ReferenceKind kind, SourceRange range, int enclosingNodeId, Language language, String source) {
    public ReferenceSite {
        Objects.requireNonNull(kind, "kind");
        name = Objects.requireNonNullElse(name, "");
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
        language = Objects.requireNonNullElse(language, Language.UNKNOWN);
        source = Objects.requireNonNullElse(source, "");
    }

    public ReferenceSite(String name, ReferenceKind kind, SourceRange range, int enclosingNodeId, Language language) {
        this(name, kind, range, enclosingNodeId, language, "");
    }

    public boolean isQualified() {
        return name.contains(language.separator());
    }

    public List<String> segments() {
        return QualifiedNames.split(name, language);
    }

    public String simpleName() {
        return QualifiedNames.simpleName(name, language);
    }
}
