package ai.scopeview.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ProjectFileTest {

    @Test
    void readsRelativeToTheRoot(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/a.c"), "int a;\n");

        var file = new ProjectFile(root, "src/./a.c");

        assertEquals(root.toAbsolutePath().normalize().resolve("src/a.c"), file.absPath());
        assertEquals(Optional.of("int a;\n"), file.read());
        assertEquals(Optional.empty(), new ProjectFile(root, "src/missing.c").read());
    }

    @Test
    void pathsMayNotEscapeTheRoot(@TempDir Path root) {
        assertThrows(IllegalArgumentException.class, () -> new ProjectFile(root, "../outside.c"));
        assertThrows(IllegalArgumentException.class, () -> new ProjectFile(root, "src/../../outside.c"));
        assertThrows(IllegalArgumentException.class, () -> new ProjectFile(root, root.resolve("abs.c")));
    }
}
