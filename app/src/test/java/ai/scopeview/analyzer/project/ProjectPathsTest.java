package ai.scopeview.analyzer.project;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

public class ProjectPathsTest {
    @Test
    void normalize() {
        assertEquals(Optional.of("src/main.c"), ProjectPaths.normalize("src/./main.c"));
        assertEquals(Optional.of("main.c"), ProjectPaths.normalize("src/../main.c"));
        assertEquals(Optional.of("src/main.c"), ProjectPaths.normalize("src\\main.c"));
        assertEquals(Optional.of("a/b"), ProjectPaths.normalize("a//b/"));
    }

    @Test
    void refusesPathsLeavingTheRoot() {
        assertTrue(ProjectPaths.normalize("../main.c").isEmpty());
        assertTrue(ProjectPaths.normalize("/etc/passwd").isEmpty());
        assertTrue(ProjectPaths.normalize("C:\\work\\main.c").isEmpty());
        assertTrue(ProjectPaths.normalize("").isEmpty());
        assertTrue(ProjectPaths.normalize(".").isEmpty());
    }

    @Test
    void parentAndResolve() {
        assertEquals("src/lib", ProjectPaths.parent("src/lib/a.c"));
        assertEquals("", ProjectPaths.parent("a.c"));
        assertEquals(Optional.of("src/util.h"), ProjectPaths.resolve("src", "util.h"));
        assertEquals(Optional.of("util.h"), ProjectPaths.resolve("", "util.h"));
        assertEquals(Optional.of("include/util.h"), ProjectPaths.resolve("src", "../include/util.h"));
        assertTrue(ProjectPaths.resolve("", "../util.h").isEmpty());
    }
}
