package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.QualifiedNames;
import ai.scopeview.analyzer.ReferenceKind;
import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.symbols.ImportBinding;
import ai.scopeview.analyzer.symbols.Scope;
import ai.scopeview.analyzer.symbols.Symbol;
import java.util.List;
import java.util.Optional;

/**
 * JavaScript and TypeScript: declarations are hoisted to the top of their scope, so any declaration in an enclosing
 * scope is visible regardless of position. Names not declared locally are looked up through named, default and
 * namespace imports; only exported declarations of the imported module qualify.
 */
public class JsTsResolutionStrategy extends AbstractResolutionStrategy {
    private static final String DEFAULT = "default";

    @Override
    protected boolean skipsEnclosingClasses() {
        return true;
    }

    @Override
    public List<Symbol> candidates(ReferenceSite site, int scopeId, ResolutionContext context) {
        if (site.kind() == ReferenceKind.IMPORT) {
            return directiveAt(site, context)
                    .flatMap(context::targetOf)
                    .map(file -> exported(file, site.name(), context))
                    .orElse(List.of());
        }
        var segments = QualifiedNames.split(site.name(), Language.JAVASCRIPT);
        if (segments.isEmpty()) {
            return List.of();
        }
        var head = segments.get(0);
        var rest = segments.subList(1, segments.size());

        if ("this".equals(head) || "super".equals(head)) {
            if (rest.isEmpty()) {
                return List.of();
            }
            return enclosingClass(scopeId, context)
                    .map(cls -> visible(
                            QualifiedNames.of(cls.qualifiedName(), join(rest), Language.JAVASCRIPT), context))
                    .orElse(List.of());
        }

        var local = inScopeChain(head, scopeId, context);
        if (local.isPresent()) {
            if (rest.isEmpty()) {
                return List.of(local.get());
            }
            return visible(QualifiedNames.of(local.get().qualifiedName(), join(rest), Language.JAVASCRIPT), context);
        }

        var binding = context.table().importBinding(scopeId, head);
        if (binding.isEmpty()) {
            return List.of();
        }
        var file = targetFile(binding.get(), context);
        if (file.isEmpty()) {
            return List.of();
        }
        if (binding.get().bindsModule()) {
            // import * as ns from "./m"; ns.f()
            return rest.isEmpty() ? List.of() : exported(file.get(), join(rest), context);
        }
        var qn = rest.isEmpty()
                ? binding.get().importedName()
                : QualifiedNames.of(binding.get().importedName(), join(rest), Language.JAVASCRIPT);
        if (DEFAULT.equals(binding.get().importedName())) {
            var target = defaultExport(file.get(), context);
            return target.map(t -> exported(
                            file.get(),
                            rest.isEmpty() ? t : QualifiedNames.of(t, join(rest), Language.JAVASCRIPT),
                            context))
                    .orElse(List.of());
        }
        return exported(file.get(), qn, context);
    }

    /**
     * Declarations of {@code qualifiedName} in {@code file} that the file exports. Members of an exported class or
     * namespace count as exported.
     */
    private List<Symbol> exported(String file, String qualifiedName, ResolutionContext context) {
        var parse = context.parseOf(file);
        var candidates = exportedFrom(file, qualifiedName, context);
        if (parse.isEmpty()) {
            return candidates;
        }
        return candidates.stream()
                .filter(s -> isExported(s, parse.get()))
                .toList();
    }

    private static boolean isExported(Symbol symbol, ParseResult parse) {
        if (symbol.declaringNodeId() >= parse.nodeCount()) {
            return false;
        }
        if (parse.node(symbol.declaringNodeId()).hasAttribute("exported")) {
            return true;
        }
        for (int ancestor : parse.ancestors(symbol.declaringNodeId())) {
            if (parse.node(ancestor).hasAttribute("exported")) {
                return true;
            }
        }
        return false;
    }

    /** Qualified name of the declaration {@code file} exports as default. */
    private static Optional<String> defaultExport(String file, ResolutionContext context) {
        return context.parseOf(file).flatMap(parse -> parse.astRoot().children().stream()
                .filter(n -> n.hasAttribute("default") && !n.qualifiedName().isEmpty())
                .map(AstNode::qualifiedName)
                .findFirst());
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
        return QualifiedNames.join(segments, Language.JAVASCRIPT);
    }
}
