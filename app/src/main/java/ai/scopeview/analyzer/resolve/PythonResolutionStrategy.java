package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.QualifiedNames;
import ai.scopeview.analyzer.ReferenceKind;
import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.symbols.ImportBinding;
import ai.scopeview.analyzer.symbols.Scope;
import ai.scopeview.analyzer.symbols.Symbol;
import ai.scopeview.analyzer.symbols.SymbolKind;
import java.util.List;
import java.util.Optional;

/**
 * Python: LEGB lookup without class scopes for nested functions, then import bindings. {@code mod.attr} follows a
 * module binding into the imported file; {@code self.attr} and {@code cls.attr} look in the enclosing class.
 */
public class PythonResolutionStrategy extends AbstractResolutionStrategy {

    @Override
    protected boolean skipsEnclosingClasses() {
        return true;
    }

    @Override
    public List<Symbol> candidates(ReferenceSite site, int scopeId, ResolutionContext context) {
        if (site.kind() == ReferenceKind.IMPORT) {
            return importedName(site, context);
        }
        var segments = QualifiedNames.split(site.name(), Language.PYTHON);
        if (segments.isEmpty()) {
            return List.of();
        }
        var head = segments.get(0);
        var rest = segments.subList(1, segments.size());

        if (("self".equals(head) || "cls".equals(head)) && !rest.isEmpty()) {
            return enclosingClass(scopeId, context)
                    .map(cls -> visible(QualifiedNames.of(cls.qualifiedName(), join(rest), Language.PYTHON), context))
                    .orElse(List.of());
        }

        var local = inScopeChain(head, scopeId, context);
        if (local.isPresent() && local.get().kind() != SymbolKind.IMPORT) {
            if (rest.isEmpty()) {
                return List.of(local.get());
            }
            return visible(QualifiedNames.of(local.get().qualifiedName(), join(rest), Language.PYTHON), context);
        }

        var binding = context.table().importBinding(scopeId, head);
        if (binding.isPresent()) {
            var followed = follow(binding.get(), rest, context);
            if (!followed.isEmpty()) {
                return followed;
            }
            // bound by an import whose target is outside the project
            return local.map(List::of).orElse(List.of());
        }

        if (rest.isEmpty()) {
            for (var wildcard : context.table().importsIn(Scope.FILE_SCOPE)) {
                if (!wildcard.isWildcard()) {
                    continue;
                }
                var found = targetFile(wildcard, context)
                        .map(file -> exportedFrom(file, head, context))
                        .orElse(List.of());
                if (!found.isEmpty()) {
                    return found;
                }
            }
        }
        return List.of();
    }

    private List<Symbol> follow(ImportBinding binding, List<String> rest, ResolutionContext context) {
        var file = targetFile(binding, context);
        if (file.isEmpty()) {
            return List.of();
        }
        if (binding.bindsModule()) {
            if (rest.isEmpty()) {
                return List.of();
            }
            // import a.b binds "a"; a.b.f names f in a/b.py
            var directive = binding.directive();
            var moduleSegments = directive == null
                    ? List.<String>of()
                    : QualifiedNames.split(directive.target(), Language.PYTHON);
            var remaining = rest;
            if (directive != null && directive.moduleAlias() == null && moduleSegments.size() > 1) {
                int skip = Math.min(moduleSegments.size() - 1, rest.size());
                if (!rest.subList(0, skip).equals(moduleSegments.subList(1, 1 + skip))) {
                    return List.of();
                }
                remaining = rest.subList(skip, rest.size());
            }
            return remaining.isEmpty() ? List.of() : exportedFrom(file.get(), join(remaining), context);
        }
        var qn = rest.isEmpty()
                ? binding.importedName()
                : QualifiedNames.of(binding.importedName(), join(rest), Language.PYTHON);
        return exportedFrom(file.get(), qn, context);
    }

    private List<Symbol> importedName(ReferenceSite site, ResolutionContext context) {
        return directiveAt(site, context)
                .flatMap(context::targetOf)
                .map(file -> exportedFrom(file, site.name(), context))
                .orElse(List.of());
    }

    private static Optional<String> targetFile(ImportBinding binding, ResolutionContext context) {
        var directive = binding.directive();
        return directive == null ? Optional.empty() : context.targetOf(directive);
    }

    private static Optional<Scope> enclosingClass(int scopeId, ResolutionContext context) {
        for (int s : context.table().scopeChain(scopeId)) {
            var scope = context.table().scope(s);
            if (scope.isClass()) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }

    private static String join(List<String> segments) {
        return QualifiedNames.join(segments, Language.PYTHON);
    }
}
