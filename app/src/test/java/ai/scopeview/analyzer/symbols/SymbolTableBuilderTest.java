package ai.scopeview.analyzer.symbols;

import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.Diagnostic;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ParsePipeline;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.grammar.GrammarRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class SymbolTableBuilderTest {
    private static final ParsePipeline PIPELINE = new ParsePipeline(GrammarRegistry.defaults());

    private static final String C_SOURCE =
            """
            static int counter;
            int add(int a, int b);

            int add(int a, int b) {
                int sum = a + b;
                return sum;
            }

            enum Color { RED, GREEN };
            int total;
            int total;
            """;

    private static final String PYTHON_SOURCE =
            """
            import os.path
            from .models import User as U
            from helpers import *

            class Service:
                def run(self, job):
                    result = job
                    return result
            """;

    private static ParseResult parse(String source, String path, Language language) {
        return PIPELINE.parse(source, path, language);
    }

    @Test
    void cVisibilityFollowsStorageClass() {
        var table = SymbolTableBuilder.build(parse(C_SOURCE, "src/math.c", Language.C));

        var counter = table.lookup(Scope.FILE_SCOPE, "counter").orElseThrow();
        assertEquals(Visibility.FILE, counter.visibility());
        var add = table.lookup(Scope.FILE_SCOPE, "add").orElseThrow();
        assertEquals(Visibility.GLOBAL, add.visibility());
        assertEquals(SymbolKind.FUNCTION, add.kind());
        assertFalse(table.exported().contains(counter));
        assertTrue(table.exported().contains(add));
    }

    @Test
    @DisplayName("a definition completes its prototype without a redeclaration warning")
    void definitionReplacesPrototype() {
        var parse = parse(C_SOURCE, "src/math.c", Language.C);
        var table = SymbolTableBuilder.build(parse);

        var add = table.lookup(Scope.FILE_SCOPE, "add").orElseThrow();
        assertEquals("true", parse.node(add.declaringNodeId()).attribute("definition"));

        var redeclarations = table.diagnostics().stream()
                .filter(d -> d.code() == Diagnostic.Code.REDECLARATION)
                .toList();
        assertEquals(1, redeclarations.size());
        assertTrue(redeclarations.get(0).message().contains("total"));
    }

    @Test
    void parametersAndLocalsLiveInFunctionScope() {
        var parse = parse(C_SOURCE, "src/math.c", Language.C);
        var table = SymbolTableBuilder.build(parse);

        var add = table.lookup(Scope.FILE_SCOPE, "add").orElseThrow();
        var scope = table.scopeOwnedBy(add.declaringNodeId()).orElseThrow();
        assertTrue(scope.isFunction());

        var a = table.lookup(scope.scopeId(), "a").orElseThrow();
        assertEquals(SymbolKind.PARAMETER, a.kind());
        assertTrue(a.isLocal());
        assertEquals(Visibility.LOCAL, table.lookup(scope.scopeId(), "sum").orElseThrow().visibility());
        assertTrue(table.lookup(Scope.FILE_SCOPE, "sum").isEmpty());
        assertEquals(
                counterId(table), table.lookupInChain(scope.scopeId(), "counter", false).orElseThrow().declaringNodeId());
    }

    private static int counterId(SymbolTable table) {
        return table.lookup(Scope.FILE_SCOPE, "counter").orElseThrow().declaringNodeId();
    }

    @Test
    void unscopedEnumeratorsAreLifted() {
        var table = SymbolTableBuilder.build(parse(C_SOURCE, "src/math.c", Language.C));

        var red = table.lookup(Scope.FILE_SCOPE, "RED").orElseThrow();
        assertEquals(SymbolKind.VARIABLE, red.kind());
        assertEquals(SymbolKind.ENUM, table.lookup(Scope.FILE_SCOPE, "Color").orElseThrow().kind());
    }

    @Test
    void pythonImportBindings() {
        var table = SymbolTableBuilder.build(parse(PYTHON_SOURCE, "pkg/service.py", Language.PYTHON));

        var os = table.importBinding(Scope.FILE_SCOPE, "os").orElseThrow();
        assertTrue(os.bindsModule());
        assertEquals("os", os.module());

        var user = table.importBinding(Scope.FILE_SCOPE, "U").orElseThrow();
        assertEquals("User", user.importedName());
        assertEquals("models", user.module());
        assertEquals(1, user.directive().relativeLevel());

        assertTrue(table.importsIn(Scope.FILE_SCOPE).stream().anyMatch(ImportBinding::isWildcard));
        var symbol = table.lookup(Scope.FILE_SCOPE, "U").orElseThrow();
        assertEquals(SymbolKind.IMPORT, symbol.kind());
        assertEquals("models.User", symbol.qualifiedName());
    }

    @Test
    @DisplayName("method bodies skip the enclosing class scope")
    void classScopesAreSkipped() {
        var parse = parse(PYTHON_SOURCE, "pkg/service.py", Language.PYTHON);
        var table = SymbolTableBuilder.build(parse);

        var run = parse.astRoot().findByQualifiedName("Service.run").orElseThrow();
        var scope = table.scopeOwnedBy(run.id()).orElseThrow();

        assertTrue(table.lookupInChain(scope.scopeId(), "run", true).isEmpty());
        assertTrue(table.lookupInChain(scope.scopeId(), "run", false).isPresent());
        assertTrue(table.lookupInChain(scope.scopeId(), "Service", true).isPresent());
        assertTrue(table.lookup(scope.scopeId(), "result").orElseThrow().isLocal());
        assertEquals(Visibility.MODULE, table.lookup(Scope.FILE_SCOPE, "Service").orElseThrow().visibility());
    }

    @Test
    void parameterNamesDropDecoration() {
        assertEquals("args", SymbolTableBuilder.parameterName("*args"));
        assertEquals("kwargs", SymbolTableBuilder.parameterName("**kwargs"));
        assertEquals("prefix", SymbolTableBuilder.parameterName("prefix?"));
        assertEquals("rest", SymbolTableBuilder.parameterName("...rest"));
        assertEquals("", SymbolTableBuilder.parameterName("..."));
    }
}
