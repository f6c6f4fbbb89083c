package ai.scopeview.analyzer.symbols;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Diagnostic;
import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.QualifiedNames;
import ai.scopeview.analyzer.SourceRange;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Builds a file's {@link SymbolTable} in one top-down pass over its AST. Every declaration-producing node inserts one
 * symbol into the scope it appears in; function parameters go into the function's own scope.
 *
 * <p>Redeclaring a name in the same scope replaces the earlier symbol and records a REDECLARATION warning. A
 * definition completing an earlier prototype is not a redeclaration, and a prototype after its definition is ignored.
 */
public final class SymbolTableBuilder {
    private static final Logger log = LogManager.getLogger(SymbolTableBuilder.class);

    private final ParseResult parse;
    private final Language language;
    private final String path;

    private final List<Scope> scopes = new ArrayList<>();
    private final Map<SymbolTable.ScopedName, Symbol> byScope = new LinkedHashMap<>();
    private final List<Symbol> detached = new ArrayList<>();
    private final Map<Integer, Integer> scopeByOwner = new HashMap<>();
    private final Map<SourceRange, Integer> importScopes = new HashMap<>();
    private final Map<Integer, List<ImportBinding>> imports = new HashMap<>();
    private final Map<Integer, List<String>> usings = new HashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private SymbolTableBuilder(ParseResult parse) {
        this.parse = parse;
        this.language = parse.language();
        this.path = parse.path();
    }

    public static SymbolTable build(ParseResult parse) {
        return new SymbolTableBuilder(parse).run();
    }

    private SymbolTable run() {
        var root = parse.astRoot();
        var fileScope = new Scope(Scope.FILE_SCOPE, -1, root.id(), NodeType.ROOT, "");
        scopes.add(fileScope);
        scopeByOwner.put(root.id(), Scope.FILE_SCOPE);
        for (var child : root.children()) {
            visit(child, fileScope, false);
        }
        bindImports();

        var symbols = new ArrayList<Symbol>(byScope.values());
        symbols.addAll(detached);
        symbols.sort(Symbol.STABLE_ORDER);
        log.debug("Symbol table for {}: {} symbols in {} scopes", path, symbols.size(), scopes.size());
        return new SymbolTable(
                path, language, scopes, byScope, symbols, scopeByOwner, imports, usings, diagnostics);
    }

    /** {@code fileLocal} is set inside C++ anonymous namespaces. */
    private void visit(AstNode node, Scope scope, boolean fileLocal) {
        var type = node.type();
        if (type == NodeType.USING) {
            addUsing(node, scope);
            return;
        }
        if (node.hasAttribute("import")) {
            importScopes.putIfAbsent(node.range(), scope.scopeId());
            return;
        }

        var kind = SymbolKind.forNodeType(type);
        @Nullable Symbol declared = null;
        if (kind.isPresent() && !node.name().isEmpty()) {
            declared = declare(node, kind.get(), scope, fileLocal);
        }
        if (!type.opensScope()) {
            return;
        }

        var inner = new Scope(scopes.size(), scope.scopeId(), node.id(), type, node.qualifiedName());
        scopes.add(inner);
        scopeByOwner.put(node.id(), inner.scopeId());
        boolean childFileLocal = fileLocal || node.hasAttribute("anonymous");

        if (type.isFunctionLike()) {
            for (var param : node.parameters()) {
                var name = parameterName(param.name());
                if (name.isEmpty()) {
                    continue;
                }
                put(new Symbol(
                                name,
                                QualifiedNames.of(node.qualifiedName(), name, language),
                                SymbolKind.PARAMETER,
                                path,
                                node.id(),
                                inner.scopeId(),
                                Visibility.LOCAL,
                                language),
                        node);
            }
        }
        for (var child : node.children()) {
            visit(child, inner, childFileLocal);
            boolean lift = type == NodeType.ENUM && declared != null && liftsEnumerators(node);
            if (lift && child.hasAttribute("enumerator")) {
                // unscoped enumerators are also visible in the enclosing scope
                put(new Symbol(
                                child.name(),
                                QualifiedNames.of(scope.qualifiedName(), child.name(), language),
                                SymbolKind.VARIABLE,
                                path,
                                child.id(),
                                scope.scopeId(),
                                visibility(child, scope, fileLocal),
                                language),
                        child);
            }
        }
    }

    private Symbol declare(AstNode node, SymbolKind kind, Scope scope, boolean fileLocal) {
        var symbol = new Symbol(
                node.name(),
                node.qualifiedName().isEmpty() ? node.name() : node.qualifiedName(),
                kind,
                path,
                node.id(),
                scope.scopeId(),
                visibility(node, scope, fileLocal),
                language);
        if (node.hasAttribute("owner")) {
            // out-of-line C++ member definition: reachable by qualified name only
            detached.add(symbol);
            return symbol;
        }
        return put(symbol, node);
    }

    private Symbol put(Symbol symbol, AstNode node) {
        var key = new SymbolTable.ScopedName(symbol.scopeId(), symbol.name());
        var existing = byScope.get(key);
        if (existing == null) {
            byScope.put(key, symbol);
            return symbol;
        }
        var existingNode = parse.node(existing.declaringNodeId());
        if (isPrototype(node) && existing.kind().isCallable()) {
            log.trace("Ignoring prototype of {} after its definition", symbol.qualifiedName());
            return existing;
        }
        if (!isPrototype(existingNode) || !symbol.kind().isCallable()) {
            diagnostics.add(Diagnostic.warning(
                    Diagnostic.Code.REDECLARATION,
                    "'%s' redeclared; previous declaration at %s".formatted(symbol.name(), existingNode.range()),
                    node.range(),
                    path));
        }
        byScope.remove(key);
        byScope.put(key, symbol);
        return symbol;
    }

    private static boolean isPrototype(AstNode node) {
        return "false".equals(node.attribute("definition"));
    }

    private boolean liftsEnumerators(AstNode enumNode) {
        return (language == Language.C || language == Language.CPP) && !enumNode.hasAttribute("scoped");
    }

    private Visibility visibility(AstNode node, Scope scope, boolean fileLocal) {
        if (insideFunction(scope)) {
            return Visibility.LOCAL;
        }
        return switch (language) {
            case C, CPP -> fileLocal || ("true".equals(node.attribute("static")) && !scope.isClass())
                    ? Visibility.FILE
                    : Visibility.GLOBAL;
            case PYTHON, JAVASCRIPT, TYPESCRIPT, UNKNOWN -> Visibility.MODULE;
        };
    }

    private boolean insideFunction(Scope scope) {
        for (int s = scope.scopeId(); s >= 0; s = scopes.get(s).parentScopeId()) {
            if (scopes.get(s).isFunction()) {
                return true;
            }
        }
        return false;
    }

    /** "x" from "*x", "&x", "...args", "x?" and similar spellings. */
    static String parameterName(String spelled) {
        var sb = new StringBuilder();
        for (int i = 0; i < spelled.length(); i++) {
            char c = spelled.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '$') {
                sb.append(c);
            } else if (sb.length() > 0) {
                break;
            }
        }
        return sb.toString();
    }

    private void addUsing(AstNode node, Scope scope) {
        if ("true".equals(node.attribute("namespace"))) {
            usings.computeIfAbsent(scope.scopeId(), k -> new ArrayList<>()).add(node.name());
            return;
        }
        // using ns::name; binds the simple name
        var local = QualifiedNames.simpleName(node.name(), language);
        imports.computeIfAbsent(scope.scopeId(), k -> new ArrayList<>())
                .add(new ImportBinding(local, "", node.name(), scope.scopeId(), null));
    }

    private void bindImports() {
        for (var directive : parse.imports()) {
            int scopeId = importScopes.getOrDefault(directive.range(), Scope.FILE_SCOPE);
            var bindings = imports.computeIfAbsent(scopeId, k -> new ArrayList<>());
            for (var binding : bindingsOf(directive, scopeId)) {
                bindings.add(binding);
                if (language == Language.PYTHON && !binding.isWildcard()) {
                    var symbol = new Symbol(
                            binding.localName(),
                            binding.bindsModule()
                                    ? binding.module()
                                    : QualifiedNames.of(binding.module(), binding.importedName(), language),
                            SymbolKind.IMPORT,
                            path,
                            parse.astRoot().id(),
                            scopeId,
                            scopeId == Scope.FILE_SCOPE ? Visibility.MODULE : Visibility.LOCAL,
                            language);
                    byScope.putIfAbsent(new SymbolTable.ScopedName(scopeId, binding.localName()), symbol);
                }
            }
        }
    }

    private List<ImportBinding> bindingsOf(ImportDirective directive, int scopeId) {
        var result = new ArrayList<ImportBinding>();
        var module = directive.target();
        if (language == Language.C || language == Language.CPP) {
            return result;
        }
        if (directive.wildcard()) {
            result.add(new ImportBinding(ImportBinding.WILDCARD, module, ImportBinding.WILDCARD, scopeId, directive));
        }
        if (directive.moduleAlias() != null) {
            result.add(new ImportBinding(directive.moduleAlias(), module, "", scopeId, directive));
        } else if (language == Language.PYTHON && directive.names().isEmpty() && !directive.wildcard()) {
            // import a.b binds "a"
            var first = QualifiedNames.split(module, language);
            if (!first.isEmpty()) {
                result.add(new ImportBinding(first.get(0), first.get(0), "", scopeId, directive));
            }
        }
        for (var name : directive.names()) {
            if (!name.localName().isEmpty()) {
                result.add(new ImportBinding(name.localName(), module, name.name(), scopeId, directive));
            }
        }
        return result;
    }
}
