package ai.scopeview.analyzer.context;

import static ai.scopeview.analyzer.context.ContextFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class ContextRendererTest {
    private static final ContextRenderer PYTHON = new ContextRenderer(Language.PYTHON);

    private static CompressionPlan plan(AstNode root, Decision... decisions) {
        return new CompressionPlan(root, budgeter().costs(root), 100, decisions, false, false, List.of());
    }

    @Test
    void fullPlanReproducesTheSource() {
        var root = module();
        var plan = compressor().compress(root, 1000, n -> 0.0);
        assertEquals(MODULE, PYTHON.render(plan));
    }

    @Test
    void summariesShowTheSignature() {
        var text = PYTHON.render(plan(module(), Decision.FULL, Decision.SUMMARY, Decision.FULL, Decision.ELIDED));
        assertEquals("def alpha()\n\n" + BETA + "\n\n# ...\n", text);
    }

    @Test
    @DisplayName("consecutive elided siblings collapse into one placeholder")
    void elidedRunsCollapse() {
        var text = PYTHON.render(plan(module(), Decision.FULL, Decision.FULL, Decision.ELIDED, Decision.ELIDED));
        assertEquals(ALPHA + "\n\n# ...\n", text);
    }

    @Test
    void placeholderBeforeAKeptSibling() {
        var text = PYTHON.render(plan(module(), Decision.FULL, Decision.ELIDED, Decision.FULL, Decision.ELIDED));
        assertEquals("# ...\n" + BETA + "\n\n# ...\n", text);
    }

    @Test
    void summarizedRootListsKeptChildren() {
        var text = PYTHON.render(plan(module(), Decision.SUMMARY, Decision.ELIDED, Decision.ELIDED, Decision.SUMMARY));
        assertEquals("# ...\ndef gamma()", text);
    }

    @Test
    void summarizedClassIndentsItsMembers() {
        var plan = Expander.expand(compressor().compress(box(), 5, n -> 0.0), 2);
        assertEquals("class Box\n    " + BOX_METHOD + "\n", PYTHON.render(plan));
    }

    @Test
    void placeholdersFollowTheLanguage() {
        assertEquals("# ...", PYTHON.placeholder());
        assertEquals("// ...", new ContextRenderer(Language.CPP).placeholder());
        assertEquals("// ...", new ContextRenderer(Language.TYPESCRIPT).placeholder());
    }

    @Test
    void headerFallsBackToTheFirstLine() {
        var node = AstNode.builder(NodeType.CLASS)
                .rawContent("struct point {  \n  int x;\n}")
                .build();
        assertEquals("struct point {", ContextRenderer.header(node));
        assertEquals("", ContextRenderer.header(module()));
    }
}
