package ai.scopeview.analyzer.project;

import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.SourceRange;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ImportPathResolverTest {
    private static ImportDirective module(String target, int relativeLevel) {
        return new ImportDirective(target, false, List.of(), null, false, relativeLevel, SourceRange.UNKNOWN);
    }

    @Test
    void cIncludesPreferTheIncludingDirectory() {
        var resolver = new ImportPathResolver(List.of("include"));
        var files = Set.of("src/util.h", "util.h", "include/api.h");
        var quoted = ImportDirective.include("util.h", false, SourceRange.UNKNOWN);

        assertEquals(Optional.of("src/util.h"), resolver.resolve("src/main.c", Language.C, quoted, files));
        assertEquals(Optional.of("util.h"), resolver.resolve("other/main.c", Language.C, quoted, files));
        assertEquals(
                Optional.of("include/api.h"),
                resolver.resolve("src/main.c", Language.C, ImportDirective.include("api.h", true, SourceRange.UNKNOWN), files));
    }

    @Test
    void systemIncludesSkipTheIncludingDirectory() {
        var resolver = new ImportPathResolver(List.of());
        var system = ImportDirective.include("util.h", true, SourceRange.UNKNOWN);
        assertEquals(Optional.empty(), resolver.resolve("src/main.c", Language.C, system, Set.of("src/util.h")));
    }

    @Test
    void pythonModules() {
        var resolver = new ImportPathResolver(List.of());
        var files = Set.of("pkg/models.py", "pkg/sub/__init__.py", "util.py");

        assertEquals(Optional.of("pkg/models.py"), resolver.resolve("main.py", Language.PYTHON, module("pkg.models", 0), files));
        assertEquals(Optional.of("pkg/sub/__init__.py"), resolver.resolve("main.py", Language.PYTHON, module("pkg.sub", 0), files));
        assertEquals(Optional.of("pkg/models.py"), resolver.resolve("pkg/service.py", Language.PYTHON, module("models", 1), files));
        assertEquals(Optional.of("util.py"), resolver.resolve("pkg/sub/x.py", Language.PYTHON, module("util", 3), files));
        assertEquals(Optional.empty(), resolver.resolve("main.py", Language.PYTHON, module("os", 0), files));
    }

    @Test
    void scriptSpecifiers() {
        var resolver = new ImportPathResolver(List.of());
        var files = Set.of("src/math.ts", "src/lib/index.js", "src/app.js");

        assertEquals(Optional.of("src/math.ts"), resolver.resolve("src/app.js", Language.JAVASCRIPT, module("./math", 0), files));
        assertEquals(Optional.of("src/math.ts"), resolver.resolve("src/app.js", Language.TYPESCRIPT, module("./math.js", 0), files));
        assertEquals(Optional.of("src/lib/index.js"), resolver.resolve("src/app.js", Language.JAVASCRIPT, module("./lib", 0), files));
        assertEquals(Optional.empty(), resolver.resolve("src/app.js", Language.JAVASCRIPT, module("react", 0), files));
        assertEquals(Optional.empty(), resolver.resolve("src/app.js", Language.JAVASCRIPT, module("../../out", 0), files));
    }

    @Test
    void aFileNeverResolvesToItself() {
        var resolver = new ImportPathResolver(List.of());
        var self = ImportDirective.include("main.c", false, SourceRange.UNKNOWN);
        assertEquals(Optional.empty(), resolver.resolve("main.c", Language.C, self, Set.of("main.c")));
    }
}
