package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.symbols.Symbol;
import java.util.List;

/**
 * C: one global namespace. Declarations in the transitive include closure are visible; {@code static} declarations
 * of other files are not. Macros are ordinary symbols, so a macro call resolves like a function call.
 */
public class CResolutionStrategy extends AbstractResolutionStrategy {

    @Override
    protected boolean skipsEnclosingClasses() {
        return false;
    }

    @Override
    public List<Symbol> candidates(ReferenceSite site, int scopeId, ResolutionContext context) {
        var local = inScopeChain(site.name(), scopeId, context);
        if (local.isPresent()) {
            return List.of(local.get());
        }
        return visible(site.name(), context);
    }
}
