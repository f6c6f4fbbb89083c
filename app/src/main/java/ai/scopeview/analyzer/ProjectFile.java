package ai.scopeview.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A file name relative to a project root. The relative path may not escape the root.
 */
public final class ProjectFile {
    private static final Logger log = LogManager.getLogger(ProjectFile.class);

    private final Path root;
    private final Path relPath;

    public ProjectFile(Path root, Path relPath) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(relPath, "relPath");
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        var normalizedRel = relPath.normalize();
        if (normalizedRel.startsWith("..")) {
            throw new IllegalArgumentException("RelPath escapes the project root: " + relPath);
        }
        this.root = root.toAbsolutePath().normalize();
        this.relPath = normalizedRel;
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public Optional<String> read() {
        try {
            return Optional.of(Files.readString(absPath(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Unable to read {}: {}", absPath(), e.getMessage());
            return Optional.empty();
        }
    }
}
