package ai.scopeview.analyzer.symbols;

import ai.scopeview.analyzer.Diagnostic;
import ai.scopeview.analyzer.Language;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The declarations of one file, indexed by (scope, name), together with the file's scope tree, its import bindings and
 * C++ using-directives. Built by {@link SymbolTableBuilder}; immutable afterwards.
 */
public final class SymbolTable {
    /** Key of the per-scope index. */
    public record ScopedName(int scopeId, String name) {}

    private final String path;
    private final Language language;
    private final List<Scope> scopes;
    private final Map<ScopedName, Symbol> byScope;
    private final List<Symbol> symbols;
    private final Map<Integer, Integer> scopeByOwner;
    private final Map<Integer, List<ImportBinding>> importsByScope;
    private final Map<Integer, List<String>> usingByScope;
    private final List<Diagnostic> diagnostics;

    SymbolTable(
            String path,
            Language language,
            List<Scope> scopes,
            Map<ScopedName, Symbol> byScope,
            List<Symbol> symbols,
            Map<Integer, Integer> scopeByOwner,
            Map<Integer, List<ImportBinding>> importsByScope,
            Map<Integer, List<String>> usingByScope,
            List<Diagnostic> diagnostics) {
        this.path = path;
        this.language = language;
        this.scopes = List.copyOf(scopes);
        this.byScope = Collections.unmodifiableMap(byScope);
        this.symbols = ImmutableList.copyOf(symbols);
        this.scopeByOwner = Map.copyOf(scopeByOwner);
        this.importsByScope = Collections.unmodifiableMap(importsByScope);
        this.usingByScope = Collections.unmodifiableMap(usingByScope);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String path() {
        return path;
    }

    public Language language() {
        return language;
    }

    public List<Scope> scopes() {
        return scopes;
    }

    public Scope scope(int scopeId) {
        return scopes.get(scopeId);
    }

    public Scope fileScope() {
        return scopes.get(Scope.FILE_SCOPE);
    }

    /** Scope opened by AST node {@code nodeId}, or empty when that node opens none. */
    public Optional<Scope> scopeOwnedBy(int nodeId) {
        var id = scopeByOwner.get(nodeId);
        return id == null ? Optional.empty() : Optional.of(scopes.get(id));
    }

    /** Ids from {@code scopeId} outward to the file scope. */
    public List<Integer> scopeChain(int scopeId) {
        var chain = new ArrayList<Integer>();
        for (int s = scopeId; s >= 0; s = scopes.get(s).parentScopeId()) {
            chain.add(s);
        }
        return chain;
    }

    /** All symbols in declaration order, including out-of-line definitions that live in no local scope. */
    public List<Symbol> symbols() {
        return symbols;
    }

    /** Symbol declared as {@code name} directly in {@code scopeId}. */
    public Optional<Symbol> lookup(int scopeId, String name) {
        return Optional.ofNullable(byScope.get(new ScopedName(scopeId, name)));
    }

    /**
     * Walks the scope chain outward from {@code scopeId}. With {@code skipEnclosingClasses}, class scopes other than
     * the starting one are not searched, which is how Python and JavaScript method bodies see names.
     */
    public Optional<Symbol> lookupInChain(int scopeId, String name, boolean skipEnclosingClasses) {
        for (int s : scopeChain(scopeId)) {
            if (skipEnclosingClasses && s != scopeId && scopes.get(s).isClass()) {
                continue;
            }
            var found = byScope.get(new ScopedName(s, name));
            if (found != null) {
                return Optional.of(found);
            }
        }
        return Optional.empty();
    }

    public List<Symbol> symbolsIn(int scopeId) {
        return symbols.stream().filter(s -> s.scopeId() == scopeId && isIndexed(s)).toList();
    }

    /** Symbols declared by AST node {@code nodeId} (more than one for C enumerators). */
    public List<Symbol> symbolsOfNode(int nodeId) {
        return symbols.stream().filter(s -> s.declaringNodeId() == nodeId).toList();
    }

    /** Symbols other files may see. */
    public List<Symbol> exported() {
        return symbols.stream().filter(s -> s.visibility().crossesFiles()).toList();
    }

    public List<ImportBinding> importsIn(int scopeId) {
        return importsByScope.getOrDefault(scopeId, List.of());
    }

    public List<ImportBinding> allImports() {
        return importsByScope.values().stream().flatMap(List::stream).toList();
    }

    /** Import bindings visible from {@code scopeId}, innermost scope first. */
    public Optional<ImportBinding> importBinding(int scopeId, String localName) {
        for (int s : scopeChain(scopeId)) {
            for (var binding : importsIn(s)) {
                if (binding.localName().equals(localName)) {
                    return Optional.of(binding);
                }
            }
        }
        return Optional.empty();
    }

    /** Namespaces named by {@code using namespace} in {@code scopeId} and its enclosing scopes. */
    public List<String> usingNamespaces(int scopeId) {
        var result = new ArrayList<String>();
        for (int s : scopeChain(scopeId)) {
            result.addAll(usingByScope.getOrDefault(s, List.of()));
        }
        return result;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public int size() {
        return symbols.size();
    }

    private boolean isIndexed(Symbol symbol) {
        return symbol.equals(byScope.get(new ScopedName(symbol.scopeId(), symbol.name())));
    }

    @Override
    public String toString() {
        return "SymbolTable{" + path + ", symbols=" + symbols.size() + ", scopes=" + scopes.size() + "}";
    }
}
