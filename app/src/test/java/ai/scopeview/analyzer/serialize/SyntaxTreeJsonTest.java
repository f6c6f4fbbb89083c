package ai.scopeview.analyzer.serialize;

import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.Parameter;
import ai.scopeview.analyzer.ParsePipeline;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.SourceRange;
import ai.scopeview.analyzer.grammar.GrammarRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SyntaxTreeJsonTest {
    private static final ParsePipeline PIPELINE = new ParsePipeline(GrammarRegistry.defaults());

    private static ParseResult sample() {
        return PIPELINE.parse(
                "#include <stdio.h>\n\n/* Entry point. */\nint main(int argc, char **argv) {\n    return 0;\n}\n",
                "src/main.c",
                Language.C);
    }

    @Test
    void savedTreesLoadBackEqual(@TempDir Path dir) {
        var result = sample();
        var file = dir.resolve("out/main.c.json");

        SyntaxTreeJson.save(result, file);
        var loaded = SyntaxTreeJson.load(file).orElseThrow();

        assertEquals(Language.C, loaded.language());
        assertEquals(result.astRoot(), loaded.ast());
        assertEquals(result.cstRoot(), loaded.cst());
    }

    @Test
    void fieldsAreSnakeCase() {
        var tree = SyntaxTreeJson.toTree(sample());

        assertEquals("c", tree.get("language").asText());
        JsonNode main = null;
        for (var child : tree.get("ast").get("children")) {
            if ("main".equals(child.get("name").asText())) {
                main = child;
            }
        }
        assertNotNull(main);
        assertEquals("FUNCTION", main.get("type").asText());
        assertEquals("main", main.get("qualified_name").asText());
        assertEquals("int", main.get("return_type").asText());
        assertEquals("argv", main.get("parameters").get(1).get("name").asText());
        assertTrue(main.has("raw_content"));
        assertEquals(3, main.get("range").get("start_line").asInt());
        assertEquals(0, tree.get("cst").get("range").get("start").get("line").asInt());
    }

    @Test
    @DisplayName("lenient reading: nulls become empty strings, unknown types become UNKNOWN")
    void lenientReading() throws IOException {
        var json =
                """
                {
                  "language": "python",
                  "ast": {"type": "mystery", "name": null, "range": {"start": {"line": 2, "column": 1}, "end": {"line": 3, "column": 0}},
                          "children": [{"type": "function", "name": "f", "attributes": {"async": "true"}}]},
                  "cst": {"type": "module", "content": null, "range": {"start_line": 0, "start_column": 0, "end_line": 4, "end_column": 0}}
                }
                """;

        var trees = SyntaxTreeJson.fromJson(json);

        assertEquals(Language.PYTHON, trees.language());
        assertEquals(NodeType.UNKNOWN, trees.ast().type());
        assertEquals("", trees.ast().name());
        assertEquals(new SourceRange(2, 1, 3, 0), trees.ast().range());
        var f = trees.ast().children().get(0);
        assertEquals(NodeType.FUNCTION, f.type());
        assertEquals(1, f.id());
        assertEquals("true", f.attribute("async"));
        assertEquals("", trees.cst().content());
        assertEquals(new SourceRange(0, 0, 4, 0), trees.cst().range());
    }

    @Test
    @DisplayName("parameter defaults are written as 'default' and read from either spelling")
    void parameterDefaultKey() throws IOException {
        var f = AstNode.builder(NodeType.FUNCTION)
                .name("f")
                .addParameter(Parameter.of("x", "int", "2"))
                .build();
        var written = SyntaxTreeJson.writeAst(f).get("parameters").get(0);
        assertEquals("2", written.get("default").asText());
        assertFalse(written.has("default_value"));

        var json =
                """
                {
                  "language": "c",
                  "ast": {"type": "FUNCTION", "name": "f", "parameters": [
                    {"name": "x", "type": "int", "default": "2"},
                    {"name": "y", "type": "int", "default_value": "3"},
                    {"name": "z", "type": "int"}]},
                  "cst": {"type": "translation_unit"}
                }
                """;
        var params = SyntaxTreeJson.fromJson(json).ast().parameters();

        assertEquals("2", params.get(0).defaultValue());
        assertEquals("3", params.get(1).defaultValue());
        assertEquals("", params.get(2).defaultValue());
    }

    @Test
    void missingTreesAreRejected() {
        assertThrows(IOException.class, () -> SyntaxTreeJson.fromJson("{\"ast\": {}}"));
        assertThrows(IOException.class, () -> SyntaxTreeJson.fromJson("[1, 2]"));
        assertThrows(IOException.class, () -> SyntaxTreeJson.fromJson("{not json"));
    }

    @Test
    void loadReportsMissingOrBrokenFilesAsEmpty(@TempDir Path dir) throws IOException {
        assertTrue(SyntaxTreeJson.load(dir.resolve("absent.json")).isEmpty());

        var broken = dir.resolve("broken.json");
        Files.writeString(broken, "{\"ast\": 1");
        assertTrue(SyntaxTreeJson.load(broken).isEmpty());
    }
}
