package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.symbols.Scope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Links the reference sites of a file to declarations. The file's own scope chain is consulted first, then the
 * strategy of the file's language decides what other files contribute. Resolution reads a single snapshot and never
 * mutates it; the same context always gives the same references.
 */
public final class ReferenceResolver {
    private static final Logger log = LogManager.getLogger(ReferenceResolver.class);

    private final Map<Language, ResolutionStrategy> strategies;

    public ReferenceResolver(Map<Language, ResolutionStrategy> strategies) {
        var copy = new EnumMap<Language, ResolutionStrategy>(Language.class);
        copy.putAll(strategies);
        this.strategies = Collections.unmodifiableMap(copy);
    }

    /** Resolver with the built-in strategy for every supported language. */
    public static ReferenceResolver defaults() {
        var map = new EnumMap<Language, ResolutionStrategy>(Language.class);
        map.put(Language.C, new CResolutionStrategy());
        map.put(Language.CPP, new CppResolutionStrategy());
        map.put(Language.PYTHON, new PythonResolutionStrategy());
        var jsTs = new JsTsResolutionStrategy();
        map.put(Language.JAVASCRIPT, jsTs);
        map.put(Language.TYPESCRIPT, jsTs);
        return new ReferenceResolver(map);
    }

    public List<Reference> resolveFile(ResolutionContext context) {
        var sites = context.parse().referenceSites();
        var result = new ArrayList<Reference>(sites.size());
        for (var site : sites) {
            result.add(resolve(site, context));
        }
        if (log.isDebugEnabled()) {
            long resolved = result.stream().filter(Reference::isResolved).count();
            log.debug("Resolved {}/{} references in {}", resolved, result.size(), context.path());
        }
        return result;
    }

    public Reference resolve(ReferenceSite site, ResolutionContext context) {
        var strategy = strategies.get(context.parse().language());
        if (strategy == null) {
            return Reference.of(site, context.path(), List.of());
        }
        int scopeId = context.table()
                .scopeOwnedBy(site.enclosingNodeId())
                .map(Scope::scopeId)
                .orElse(Scope.FILE_SCOPE);
        var reference = Reference.of(site, context.path(), strategy.candidates(site, scopeId, context));
        log.trace("{} {} at {} -> {}", site.kind(), site.name(), site.range(), reference.status());
        return reference;
    }
}
