package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.symbols.Symbol;
import java.util.List;

/** Per-language name lookup rules applied once the local scope chain has been consulted. */
public interface ResolutionStrategy {
    /**
     * Declarations {@code site} may refer to, in stable order; empty when none is visible.
     *
     * @param scopeId innermost scope enclosing the site
     */
    List<Symbol> candidates(ReferenceSite site, int scopeId, ResolutionContext context);
}
