package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.QualifiedNames;
import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.symbols.Scope;
import ai.scopeview.analyzer.symbols.Symbol;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * C++: names are tried against every enclosing namespace or class, innermost first, then through {@code using}
 * declarations and {@code using namespace} directives. A leading {@code ::} forces global lookup.
 */
public class CppResolutionStrategy extends CResolutionStrategy {

    @Override
    public List<Symbol> candidates(ReferenceSite site, int scopeId, ResolutionContext context) {
        var name = site.name();
        if (name.startsWith("::")) {
            return visible(name.substring(2), context);
        }
        var segments = QualifiedNames.split(name, Language.CPP);
        if (segments.size() == 1) {
            var local = inScopeChain(name, scopeId, context);
            if (local.isPresent()) {
                return List.of(local.get());
            }
        }

        // using ns::name; rebinds the first segment
        var binding = context.table().importBinding(scopeId, segments.get(0));
        if (binding.isPresent() && !binding.get().bindsModule()) {
            var rest = segments.subList(1, segments.size());
            var rebound = rest.isEmpty()
                    ? binding.get().importedName()
                    : binding.get().importedName() + "::" + QualifiedNames.join(rest, Language.CPP);
            var found = visible(rebound, context);
            if (!found.isEmpty()) {
                return found;
            }
        }

        for (var prefix : enclosingPrefixes(scopeId, context)) {
            var found = visible(QualifiedNames.of(prefix, name, Language.CPP), context);
            if (!found.isEmpty()) {
                return found;
            }
        }

        var viaUsing = new ArrayList<Symbol>();
        for (var ns : new LinkedHashSet<>(context.table().usingNamespaces(scopeId))) {
            viaUsing.addAll(visible(QualifiedNames.of(ns, name, Language.CPP), context));
        }
        viaUsing.sort(Symbol.STABLE_ORDER);
        return viaUsing.stream().distinct().toList();
    }

    /**
     * Qualified names of the enclosing scopes, innermost first, ending with "". An out-of-line member definition
     * {@code void A::f()} contributes {@code A::f} and then {@code A}.
     */
    static List<String> enclosingPrefixes(int scopeId, ResolutionContext context) {
        var prefixes = new LinkedHashSet<String>();
        for (int s : context.table().scopeChain(scopeId)) {
            Scope scope = context.table().scope(s);
            var qn = scope.qualifiedName();
            while (!qn.isEmpty()) {
                prefixes.add(qn);
                qn = QualifiedNames.parentOf(qn, Language.CPP);
            }
        }
        prefixes.add("");
        return List.copyOf(prefixes);
    }
}
