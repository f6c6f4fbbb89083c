package ai.scopeview.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.context.CharCountTokenEstimator;
import ai.scopeview.analyzer.context.ContextOptions;
import ai.scopeview.analyzer.context.Decision;
import ai.scopeview.analyzer.grammar.GrammarRegistry;
import ai.scopeview.analyzer.project.ProjectConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScopeViewTest {
    private final ScopeView scopeView =
            new ScopeView(GrammarRegistry.defaults(), ContextOptions.DEFAULTS, new CharCountTokenEstimator());

    @Test
    void detectsAndParses() {
        var source = "def greet(name):\n    return 'hi ' + name\n";

        assertEquals(Language.PYTHON, scopeView.detectLanguage("greet.py", source));
        assertEquals(Language.CPP, scopeView.detectLanguage(null, "#include <vector>\nnamespace a { class B {}; }\n"));

        var result = scopeView.parse(source, "greet.py", null);
        assertEquals(Language.PYTHON, result.language());
        assertTrue(result.astRoot().findByQualifiedName("greet").isPresent());
    }

    @Test
    void compressThenExpand() {
        var result = scopeView.parse("int add(int a, int b) {\n    return a + b;\n}\n", "add.c", Language.C);
        var add = result.astRoot().findByQualifiedName("add").orElseThrow();

        var plan = scopeView.compress(result.astRoot(), 8, n -> 0.0);
        assertTrue(plan.totalCost() <= 8);
        assertNotEquals(Decision.FULL, plan.decision(add.id()));

        var expanded = scopeView.expand(plan, add.id());
        assertEquals(Decision.FULL, expanded.decision(add.id()));
    }

    @Test
    void openProjectReadsItsConfiguration(@TempDir Path root) throws IOException {
        Files.writeString(root.resolve(ProjectConfig.FILE_NAME), "project.maxFiles=2\nproject.parseThreads=1\n");
        Files.writeString(root.resolve("a.py"), "def a():\n    pass\n");

        try (var project = scopeView.openProject(root)) {
            assertEquals(2, project.config().maxFiles());
            var stats = project.parseAll(List.of("a.py"));
            assertEquals(1, stats.parsedFiles());
        }
    }
}
