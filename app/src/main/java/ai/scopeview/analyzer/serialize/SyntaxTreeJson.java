package ai.scopeview.analyzer.serialize;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.Parameter;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.SourceRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * JSON form of a parse result: {@code {language, ast, cst}}.
 *
 * <p>AST ranges are written flat ({@code start_line, start_column, end_line, end_column}) and CST ranges nested
 * ({@code start:{line,column}, end:{line,column}}). Reading accepts either form in both trees. Missing or null strings
 * read back as the empty string, and unknown node types as UNKNOWN, so a document from an older or foreign writer
 * still loads.
 */
public final class SyntaxTreeJson {
    private static final Logger log = LogManager.getLogger(SyntaxTreeJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SyntaxTreeJson() {}

    /* ================= Public API ================= */

    public static String toJson(ParseResult result) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(result));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode toTree(ParseResult result) {
        var root = MAPPER.createObjectNode();
        root.put("language", result.language().tag());
        root.set("ast", writeAst(result.astRoot()));
        root.set("cst", writeCst(result.cstRoot()));
        return root;
    }

    /** @throws IOException if {@code json} is not well-formed or lacks the {@code ast} and {@code cst} members */
    public static SyntaxTrees fromJson(String json) throws IOException {
        return fromTree(MAPPER.readTree(json));
    }

    public static SyntaxTrees fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isObject() || !root.path("ast").isObject() || !root.path("cst").isObject()) {
            throw new IOException("Expected an object with 'ast' and 'cst' members");
        }
        var language = Language.fromString(root.path("language").asText(null));
        var ast = readAst(root.get("ast")).build();
        var cst = readCst(root.get("cst"));
        return new SyntaxTrees(language, ast, cst);
    }

    /** Writes {@code result} to {@code file}, creating parent directories. On error, logs and returns. */
    public static void save(ParseResult result, Path file) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toTree(result));
            log.debug("Saved syntax trees of {} to {}", result.path(), file);
        } catch (IOException e) {
            log.warn("Failed to save syntax trees to {}: {}", file, e.getMessage(), e);
        }
    }

    /** Reads trees saved by {@link #save}. Empty when the file is missing or unreadable. */
    public static Optional<SyntaxTrees> load(Path file) {
        if (!Files.exists(file)) {
            log.debug("Syntax tree file does not exist: {}", file);
            return Optional.empty();
        }
        try {
            var trees = fromTree(MAPPER.readTree(file.toFile()));
            log.debug("Loaded syntax trees from {}", file);
            return Optional.of(trees);
        } catch (IOException e) {
            log.warn("Failed to load syntax trees from {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /* ================= Writers ================= */

    static ObjectNode writeAst(AstNode node) {
        var out = MAPPER.createObjectNode();
        out.put("id", node.id());
        out.put("type", node.type().name());
        out.put("name", node.name());
        out.put("qualified_name", node.qualifiedName());
        out.put("docstring", node.docstring());
        out.put("signature", node.signature());
        out.put("return_type", node.returnType());
        var params = out.putArray("parameters");
        for (var p : node.parameters()) {
            params.addObject()
                    .put("name", p.name())
                    .put("type", p.type())
                    .put("default", p.defaultValue());
        }
        out.put("path", node.path());
        out.put("system", node.isSystem());
        var range = out.putObject("range");
        range.put("start_line", node.range().startLine());
        range.put("start_column", node.range().startColumn());
        range.put("end_line", node.range().endLine());
        range.put("end_column", node.range().endColumn());
        out.put("raw_content", node.rawContent());
        var attrs = out.putObject("attributes");
        node.attributes().forEach(attrs::put);
        var children = out.putArray("children");
        for (var child : node.children()) {
            children.add(writeAst(child));
        }
        return out;
    }

    static ObjectNode writeCst(CstNode node) {
        var out = MAPPER.createObjectNode();
        out.put("type", node.type());
        out.put("content", node.content());
        out.put("field", node.field());
        out.put("named", node.named());
        var range = out.putObject("range");
        range.putObject("start")
                .put("line", node.range().startLine())
                .put("column", node.range().startColumn());
        range.putObject("end").put("line", node.range().endLine()).put("column", node.range().endColumn());
        ArrayNode children = out.putArray("children");
        for (var child : node.children()) {
            children.add(writeCst(child));
        }
        return out;
    }

    /* ================= Readers ================= */

    static AstNode.Builder readAst(JsonNode in) {
        var b = AstNode.builder(nodeType(in.get("type")))
                .name(text(in, "name"))
                .qualifiedName(text(in, "qualified_name"))
                .docstring(text(in, "docstring"))
                .signature(text(in, "signature"))
                .returnType(text(in, "return_type"))
                .path(text(in, "path"))
                .system(in.path("system").asBoolean(false))
                .range(range(in.get("range")))
                .rawContent(text(in, "raw_content"));
        for (var p : in.path("parameters")) {
            // older documents spell the default "default_value"
            var defaultValue = p.has("default") ? text(p, "default") : text(p, "default_value");
            b.addParameter(Parameter.of(text(p, "name"), text(p, "type"), defaultValue));
        }
        var attrs = in.path("attributes");
        if (attrs.isObject()) {
            attrs.fields().forEachRemaining(e -> b.attribute(e.getKey(), e.getValue().isNull()
                    ? ""
                    : e.getValue().asText()));
        }
        for (var child : in.path("children")) {
            if (child.isObject()) {
                b.addChild(readAst(child));
            }
        }
        return b;
    }

    static CstNode readCst(JsonNode in) {
        var children = new ArrayList<CstNode>();
        for (var child : in.path("children")) {
            if (child.isObject()) {
                children.add(readCst(child));
            }
        }
        return new CstNode(
                text(in, "type"),
                text(in, "content"),
                range(in.get("range")),
                text(in, "field"),
                in.path("named").asBoolean(false),
                children);
    }

    /** Accepts both the flat and the nested range form. */
    static SourceRange range(@Nullable JsonNode in) {
        if (in == null || !in.isObject()) {
            return SourceRange.UNKNOWN;
        }
        if (in.has("start") || in.has("end")) {
            var start = in.path("start");
            var end = in.path("end");
            return SourceRange.clamped(
                    start.path("line").asInt(0),
                    start.path("column").asInt(0),
                    end.path("line").asInt(0),
                    end.path("column").asInt(0));
        }
        return SourceRange.clamped(
                in.path("start_line").asInt(0),
                in.path("start_column").asInt(0),
                in.path("end_line").asInt(0),
                in.path("end_column").asInt(0));
    }

    private static NodeType nodeType(@Nullable JsonNode in) {
        if (in == null || in.isNull()) {
            return NodeType.UNKNOWN;
        }
        try {
            return NodeType.valueOf(in.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown node type '{}', reading as UNKNOWN", in.asText());
            return NodeType.UNKNOWN;
        }
    }

    private static String text(JsonNode in, String field) {
        var value = in.get(field);
        if (value == null || value.isNull()) {
            log.debug("Missing string field '{}', coercing to empty", field);
            return "";
        }
        return value.asText();
    }
}
