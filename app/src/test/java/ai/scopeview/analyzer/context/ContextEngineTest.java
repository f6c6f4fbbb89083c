package ai.scopeview.analyzer.context;

import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ParsePipeline;
import ai.scopeview.analyzer.grammar.GrammarRegistry;
import ai.scopeview.analyzer.project.ProjectConfig;
import ai.scopeview.analyzer.project.ProjectContext;
import ai.scopeview.analyzer.resolve.ReferenceResolver;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ContextEngineTest {
    private static final ParsePipeline PIPELINE = new ParsePipeline(GrammarRegistry.defaults());

    private static final String STORE =
            """
            class Store:
                def get(self, key):
                    value = self.items.get(key)
                    return value

                def put(self, key, value):
                    self.items[key] = value
                    return None

            def make_store():
                return Store()
            """;

    private static final String APP =
            """
            from store import make_store

            def main():
                store = make_store()
                store.put("a", 1)
                return store.get("a")
            """;

    private static ContextEngine engine(int maxTokens) {
        return new ContextEngine(ContextOptions.DEFAULTS.withMaxTokens(maxTokens), new CharCountTokenEstimator());
    }

    @Test
    void largeBudgetKeepsTheWholeFile() {
        var parse = PIPELINE.parse(STORE, "store.py", Language.PYTHON);
        var engine = engine(10_000);

        var plan = engine.buildContext(parse, RelevanceQuery.NONE);

        assertEquals(parse.nodeCount(), plan.count(Decision.FULL));
        assertEquals(parse.astRoot().rawContent(), engine.render(parse, plan));
    }

    @Test
    @DisplayName("focused nodes survive a budget that would otherwise drop them")
    void focusForcesNodes() {
        var parse = PIPELINE.parse(STORE, "store.py", Language.PYTHON);
        var put = parse.astRoot().findByQualifiedName("Store.put").orElseThrow();
        var engine = engine(30);

        var plan = engine.buildContext(parse, RelevanceQuery.NONE.withFocus(Set.of("Store.put")));

        assertFalse(plan.isInfeasible());
        assertTrue(plan.isKept(put.id()));
        assertTrue(plan.totalCost() <= 30);
        assertTrue(engine.render(parse, plan).contains("def put"));
    }

    @Test
    void cursorPullsNearbyCodeIn() {
        var parse = PIPELINE.parse(STORE, "store.py", Language.PYTHON);
        var makeStore = parse.astRoot().findByQualifiedName("make_store").orElseThrow();
        var engine = engine(40);

        var plan = engine.buildContext(parse, RelevanceQuery.atCursor("store.py", makeStore.range().startLine()));

        assertEquals(Decision.FULL, plan.decision(makeStore.id()));
    }

    @Test
    void expandOverridesTheBudget() {
        var parse = PIPELINE.parse(STORE, "store.py", Language.PYTHON);
        var engine = engine(10);
        var get = parse.astRoot().findByQualifiedName("Store.get").orElseThrow();

        var plan = engine.buildContext(parse, RelevanceQuery.NONE);
        var expanded = engine.expand(plan, get.id());

        assertEquals(Decision.FULL, expanded.decision(get.id()));
        assertTrue(expanded.isOverBudget());
        assertTrue(engine.render(parse, expanded).contains("return value"));
    }

    @Test
    void projectContextSharesTheBudget(@TempDir Path root) {
        try (var project = new ProjectContext(
                root, ProjectConfig.defaults().withParseThreads(2), PIPELINE, ReferenceResolver.defaults())) {
            project.parseAllSources(Map.of("store.py", STORE, "app.py", APP));

            var window = engine(10_000).buildProjectContext(project, RelevanceQuery.atCursor("app.py", 3));

            assertTrue(project.staleFiles().isEmpty());
            assertEquals(2, window.files().size());
            assertEquals("app.py", window.files().get(0).path());
            assertTrue(window.skipped().isEmpty());
            assertTrue(window.render().startsWith("# app.py\n"));
            assertEquals(
                    window.files().get(0).plan().totalCost() + window.files().get(1).plan().totalCost(),
                    window.totalCost());
        }
    }

    @Test
    void filesThatDoNotFitAreSkipped(@TempDir Path root) {
        try (var project = new ProjectContext(
                root, ProjectConfig.defaults().withParseThreads(2), PIPELINE, ReferenceResolver.defaults())) {
            project.parseAllSources(Map.of("store.py", STORE, "app.py", APP));

            var window = engine(8).buildProjectContext(project, RelevanceQuery.atCursor("store.py", 1));

            assertTrue(window.totalCost() <= 8);
            assertEquals(2, window.files().size() + window.skipped().size());
            assertEquals("store.py", window.files().get(0).path());
            assertEquals(List.of("app.py"), window.skipped());
        }
    }
}
