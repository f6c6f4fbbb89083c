package ai.scopeview.analyzer.project;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ProjectConfigTest {
    @Test
    void defaultsWhenFileIsAbsent(@TempDir Path root) {
        var config = ProjectConfig.load(root);
        assertEquals(ProjectConfig.DEFAULT_MAX_FILES, config.maxFiles());
        assertEquals(ProjectConfig.DEFAULT_SUMMARY_COST, config.summaryCost());
        assertTrue(config.parseThreads() >= 1);
        assertTrue(config.includePaths().isEmpty());
    }

    @Test
    void loadsPropertiesFile(@TempDir Path root) throws IOException {
        Files.writeString(
                root.resolve(ProjectConfig.FILE_NAME),
                "project.maxFiles=50\nproject.parseThreads=3\nproject.includePaths=include, third_party/inc,\n"
                        + "context.summaryCost=12\n");

        var config = ProjectConfig.load(root);

        assertEquals(50, config.maxFiles());
        assertEquals(3, config.parseThreads());
        assertEquals(List.of("include", "third_party/inc"), config.includePaths());
        assertEquals(12, config.summaryCost());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        var props = new Properties();
        props.setProperty(ProjectConfig.PROP_MAX_FILES, "lots");
        props.setProperty(ProjectConfig.PROP_PARSE_THREADS, "0");
        props.setProperty(ProjectConfig.PROP_SUMMARY_COST, "-4");

        var config = ProjectConfig.fromProperties(props);

        assertEquals(ProjectConfig.DEFAULT_MAX_FILES, config.maxFiles());
        assertEquals(ProjectConfig.defaults().parseThreads(), config.parseThreads());
        assertEquals(ProjectConfig.DEFAULT_SUMMARY_COST, config.summaryCost());
    }

    @Test
    void constructorRejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> new ProjectConfig(0, 1, List.of(), 8));
        assertThrows(IllegalArgumentException.class, () -> new ProjectConfig(1, 0, List.of(), 8));
        assertThrows(IllegalArgumentException.class, () -> new ProjectConfig(1, 1, List.of(), -1));
    }
}
