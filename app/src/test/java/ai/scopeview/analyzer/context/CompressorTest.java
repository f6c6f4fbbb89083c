package ai.scopeview.analyzer.context;

import static ai.scopeview.analyzer.context.ContextFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Diagnostic;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ParsePipeline;
import ai.scopeview.analyzer.grammar.GrammarRegistry;
import java.util.List;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class CompressorTest {
    private static final String SAMPLE =
            """
            import os

            LIMIT = 10

            class Repository:
                \"\"\"Stores records on disk.\"\"\"

                def __init__(self, root):
                    self.root = root

                def load(self, name):
                    path = os.path.join(self.root, name)
                    with open(path) as handle:
                        return handle.read()

                def save(self, name, data):
                    with open(os.path.join(self.root, name), "w") as handle:
                        handle.write(data)

            def main():
                repo = Repository("/tmp")
                print(repo.load("a"))
            """;

    @Test
    void everythingFitsUnderALargeBudget() {
        var plan = compressor().compress(module(), 1000, ContextFixtures::moduleScore);

        assertEquals(4, plan.count(Decision.FULL));
        assertEquals(MODULE.length(), plan.totalCost());
        assertFalse(plan.isInfeasible());
        assertFalse(plan.isOverBudget());
    }

    @Test
    @DisplayName("higher scores are upgraded first and fall back to a summary when full text does not fit")
    void greedyByImportance() {
        var plan = compressor().compress(module(), 30, ContextFixtures::moduleScore);

        assertEquals(Decision.FULL, plan.decision(0));
        assertEquals(Decision.SUMMARY, plan.decision(1));
        assertEquals(Decision.FULL, plan.decision(2));
        assertEquals(Decision.ELIDED, plan.decision(3));
        assertEquals(30, plan.totalCost());
        assertEquals(List.of(0, 1, 2), plan.keptIds());
    }

    @Test
    void budgetBelowTheMinimalStructureIsInfeasible() {
        var plan = compressor().compress(module(), SUMMARY_COST - 1, ContextFixtures::moduleScore);

        assertTrue(plan.isInfeasible());
        assertEquals(Decision.SUMMARY, plan.decision(0));
        assertEquals(1, plan.count(Decision.SUMMARY));
        assertEquals(3, plan.count(Decision.ELIDED));
        assertEquals(SUMMARY_COST, plan.totalCost());
        assertEquals(Diagnostic.Code.BUDGET_INFEASIBLE, plan.diagnostics().get(0).code());
    }

    @Test
    @DisplayName("a ten node tree under a budget below the root summary keeps only the root summary")
    void tenNodeTreeBelowRootCostIsInfeasible() {
        var tree = shapes();
        assertEquals(10, tree.stream().count());

        var plan = compressor().compress(tree, SUMMARY_COST - 2, n -> n.name().length());

        assertTrue(plan.isInfeasible());
        assertEquals(Decision.SUMMARY, plan.decision(0));
        assertEquals(List.of(0), plan.keptIds());
        assertEquals(9, plan.count(Decision.ELIDED));
        assertEquals(SUMMARY_COST, plan.totalCost());
        assertEquals(Diagnostic.Code.BUDGET_INFEASIBLE, plan.diagnostics().get(0).code());
    }

    @Test
    void forcedNodesAreAlwaysKept() {
        var plan = compressor().compress(module(), 10, n -> 0.0, Set.of(1));

        assertFalse(plan.isInfeasible());
        assertTrue(plan.isKept(1));
        assertEquals(Decision.FULL, plan.decision(0));
        assertFalse(plan.isKept(2));
        assertFalse(plan.isKept(3));
        assertTrue(plan.totalCost() <= 10);
    }

    @Test
    void forcedNodeBringsItsAncestors() {
        var plan = compressor().compress(box(), 15, n -> 0.0, Set.of(2));

        assertTrue(plan.isKept(2));
        assertTrue(plan.isKept(1));
        assertTrue(plan.isKept(0));
    }

    @Test
    void nanScoresCountAsZero() {
        var plan = compressor().compress(module(), 30, n -> Double.NaN);
        assertTrue(plan.totalCost() <= 30);
    }

    @Test
    void invalidArguments() {
        var compressor = compressor();
        var root = module();
        assertThrows(IllegalArgumentException.class, () -> compressor.compress(root, -1, n -> 0.0));
        assertThrows(IllegalArgumentException.class, () -> compressor.compress(root, 10, n -> 0.0, Set.of(42)));
        var otherCosts = compressor.budgeter().costs(box());
        assertThrows(
                IllegalArgumentException.class, () -> compressor.compress(root, otherCosts, 10, n -> 0.0, Set.of()));
    }

    @Test
    void sameInputsGiveEqualPlans() {
        var root = module();
        var first = compressor().compress(root, 30, ContextFixtures::moduleScore);
        var second = compressor().compress(root, 30, ContextFixtures::moduleScore);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    @DisplayName("kept nodes have kept ancestors and the total respects every budget")
    void invariantsOnARealFile() {
        var parse = new ParsePipeline(GrammarRegistry.defaults()).parse(SAMPLE, "repo.py", Language.PYTHON);
        var root = parse.astRoot();
        var compressor = new Compressor(new TokenBudgeter(new CharCountTokenEstimator(), 8));
        ToDoubleFunction<AstNode> byLine = n -> 1.0 / (1 + n.range().startLine());

        for (int budget : new int[] {0, 7, 8, 20, 40, 80, 120, 200, 10_000}) {
            var plan = compressor.compress(root, budget, byLine);
            if (plan.isInfeasible()) {
                assertTrue(budget < 8, "infeasible at " + budget);
                continue;
            }
            assertTrue(plan.totalCost() <= budget, "over budget at " + budget);
            for (int id : plan.keptIds()) {
                for (int ancestor : plan.costs().ancestors(id)) {
                    assertTrue(plan.isKept(ancestor), "node " + id + " kept without ancestor " + ancestor);
                }
            }
        }
        var all = compressor.compress(root, 10_000, byLine);
        assertEquals(root.size(), all.count(Decision.FULL));
    }
}
