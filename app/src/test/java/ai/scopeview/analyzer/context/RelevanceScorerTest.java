package ai.scopeview.analyzer.context;

import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.SourceRange;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class RelevanceScorerTest {
    private static final ContextOptions NO_WEIGHTS = new ContextOptions(100, 0, 0, 0, 0, 0, false, false, 8);

    private static AstNode function(String name, String path, int startLine, int endLine) {
        return AstNode.builder(NodeType.FUNCTION)
                .name(name)
                .qualifiedName("mod." + name)
                .signature("def " + name + "(path)")
                .docstring("Reads tokens from a file.")
                .path(path)
                .range(new SourceRange(startLine, 0, endLine, 0))
                .build();
    }

    @Test
    void proximityDecaysWithLineDistance() {
        var scorer = new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.atCursor("a.py", 10));

        assertEquals(1.0, scorer.proximity(function("f", "a.py", 8, 12)));
        assertEquals(1.0 / 3, scorer.proximity(function("f", "a.py", 12, 20)), 1e-9);
        assertEquals(0.0, scorer.proximity(function("f", "b.py", 8, 12)));
        assertEquals(0.0, new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.NONE).proximity(function("f", "a.py", 8, 12)));
    }

    @Test
    void similarityIsTheShareOfQueryTermsFound() {
        var node = function("parse_file", "a.py", 0, 1);

        assertEquals(1.0, new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.NONE.withText("parse tokens")).similarity(node));
        assertEquals(0.5, new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.NONE.withText("Parse xyz")).similarity(node));
        assertEquals(0.0, new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.NONE).similarity(node));
    }

    @Test
    void termsIgnoreCaseAndShortWords() {
        assertEquals(Set.of("bb", "cc", "load"), RelevanceScorer.terms("a bb CC, load_x"));
        assertTrue(RelevanceScorer.terms("").isEmpty());
    }

    @Test
    void referencesSaturate() {
        var scorer = new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.NONE, Map.of("mod.f", 3));
        assertEquals(0.75, scorer.references(function("f", "a.py", 0, 1)));
        assertEquals(0.0, scorer.references(function("g", "a.py", 0, 1)));
    }

    @Test
    void focusMatchesQualifiedOrSimpleName() {
        var byQualified = new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.NONE.withFocus(Set.of("mod.f")));
        var bySimple = new RelevanceScorer(NO_WEIGHTS, RelevanceQuery.NONE.withFocus(Set.of("f")));

        assertEquals(1.0, byQualified.focus(function("f", "a.py", 0, 1)));
        assertEquals(1.0, bySimple.focus(function("f", "a.py", 0, 1)));
        assertEquals(0.0, bySimple.focus(function("g", "a.py", 0, 1)));
    }

    @Test
    void recencyIsClamped() {
        var scorer = new RelevanceScorer(
                NO_WEIGHTS, RelevanceQuery.NONE.withRecency(Map.of("a.py", 1.7, "b.py", -0.5, "c.py", 0.25)));

        assertEquals(1.0, scorer.recency(function("f", "a.py", 0, 1)));
        assertEquals(0.0, scorer.recency(function("f", "b.py", 0, 1)));
        assertEquals(0.25, scorer.recency(function("f", "c.py", 0, 1)));
    }

    @Test
    void bonusesFavourFunctionsThenStructure() {
        var options = new ContextOptions(100, 0, 0, 0, 0, 0, true, true, 8);
        var scorer = new RelevanceScorer(options, RelevanceQuery.NONE);
        var cls = AstNode.builder(NodeType.CLASS).name("C").build();
        var variable = AstNode.builder(NodeType.VARIABLE).name("v").build();

        assertEquals(RelevanceScorer.FUNCTION_BONUS, scorer.applyAsDouble(function("f", "a.py", 0, 1)), 1e-9);
        assertEquals(RelevanceScorer.STRUCTURE_BONUS, scorer.applyAsDouble(cls), 1e-9);
        assertEquals(0.0, scorer.applyAsDouble(variable));
    }

    @Test
    void weightsCombineTheSignals() {
        var options = new ContextOptions(100, 0.5, 0.3, 0.7, 0.2, 1.0, false, false, 8);
        var query = RelevanceQuery.atCursor("a.py", 0)
                .withText("parse")
                .withFocus(Set.of("mod.parse"))
                .withRecency(Map.of("a.py", 1.0));
        var scorer = new RelevanceScorer(options, query, Map.of("mod.parse", 1));

        assertEquals(0.5 + 0.3 + 0.7 + 0.2 * 0.5 + 1.0, scorer.applyAsDouble(function("parse", "a.py", 0, 2)), 1e-9);
    }
}
