package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.SourceRange;
import ai.scopeview.analyzer.symbols.Symbol;
import java.util.List;
import java.util.Optional;

/** Lookups shared by the language strategies. */
abstract class AbstractResolutionStrategy implements ResolutionStrategy {

    /** Whether class scopes are invisible from the methods nested in them. */
    protected abstract boolean skipsEnclosingClasses();

    protected Optional<Symbol> inScopeChain(String name, int scopeId, ResolutionContext context) {
        return context.table().lookupInChain(scopeId, name, skipsEnclosingClasses());
    }

    /** Non-local declarations of {@code qualifiedName} in this file or a file it can see. */
    protected List<Symbol> visible(String qualifiedName, ResolutionContext context) {
        return context.project().lookup(qualifiedName).stream()
                .filter(s -> s.file().equals(context.path())
                        || (context.canSee(s.file()) && s.visibility().crossesFiles()))
                .toList();
    }

    /** Declarations of {@code qualifiedName} that {@code file} offers to importers. */
    protected List<Symbol> exportedFrom(String file, String qualifiedName, ResolutionContext context) {
        return context.project().lookup(qualifiedName).stream()
                .filter(s -> s.file().equals(file) && s.visibility().crossesFiles())
                .toList();
    }

    /** The import statement a site lies in, for IMPORT sites. */
    protected static Optional<ImportDirective> directiveAt(ReferenceSite site, ResolutionContext context) {
        for (var directive : context.parse().imports()) {
            if (encloses(directive.range(), site.range())) {
                return Optional.of(directive);
            }
        }
        return Optional.empty();
    }

    static boolean encloses(SourceRange outer, SourceRange inner) {
        boolean startsAfter = inner.startLine() > outer.startLine()
                || (inner.startLine() == outer.startLine() && inner.startColumn() >= outer.startColumn());
        boolean endsBefore = inner.endLine() < outer.endLine()
                || (inner.endLine() == outer.endLine() && inner.endColumn() <= outer.endColumn());
        return startsAfter && endsBefore;
    }
}
