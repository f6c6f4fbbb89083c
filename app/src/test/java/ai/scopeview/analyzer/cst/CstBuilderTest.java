package ai.scopeview.analyzer.cst;

import static org.junit.jupiter.api.Assertions.*;

import ai.scopeview.analyzer.CstNode;
import ai.scopeview.analyzer.SourceContent;
import ai.scopeview.analyzer.grammar.RawNode;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class CstBuilderTest {

    /** Minimal in-memory raw node; rows and columns are not exercised here. */
    private record FakeNode(String type, boolean named, int start, int end, List<FakeNode> kids) implements RawNode {
        static FakeNode leaf(String type, int start, int end) {
            return new FakeNode(type, true, start, end, List.of());
        }

        static FakeNode parent(String type, int start, int end, FakeNode... kids) {
            return new FakeNode(type, true, start, end, Arrays.asList(kids));
        }

        @Override
        public boolean isNamed() {
            return named;
        }

        @Override
        public boolean isMissing() {
            return false;
        }

        @Override
        public boolean isError() {
            return "ERROR".equals(type);
        }

        @Override
        public int startByte() {
            return start;
        }

        @Override
        public int endByte() {
            return end;
        }

        @Override
        public int startRow() {
            return 0;
        }

        @Override
        public int startColumn() {
            return start;
        }

        @Override
        public int endRow() {
            return 0;
        }

        @Override
        public int endColumn() {
            return end;
        }

        @Override
        public int childCount() {
            return kids.size();
        }

        @Override
        public @Nullable RawNode child(int index) {
            return kids.get(index);
        }

        @Override
        public @Nullable String fieldNameForChild(int index) {
            return index == 0 ? "first" : null;
        }
    }

    @Test
    @DisplayName("gaps between children become trivia so leaves reproduce the source")
    void triviaFillsGaps() {
        var source = SourceContent.of("  ab  cd\n");
        var root = FakeNode.parent("module", 0, 9, FakeNode.leaf("id", 2, 4), FakeNode.leaf("id", 6, 8));

        var cst = new CstBuilder(source).build(root);

        assertEquals("  ab  cd\n", cst.leafText());
        var types = cst.children().stream().map(CstNode::type).toList();
        assertEquals(List.of(CstNode.TRIVIA, "id", CstNode.TRIVIA, "id", CstNode.TRIVIA), types);
        assertEquals("first", cst.children().get(1).field());
        assertEquals("", cst.children().get(3).field());
    }

    @Test
    @DisplayName("a null child becomes an UNKNOWN leaf and the tree stays complete")
    void nullChildBecomesUnknown() {
        var source = SourceContent.of("ab cd");
        var root = FakeNode.parent("module", 0, 5, FakeNode.leaf("id", 0, 2), null, FakeNode.leaf("id", 3, 5));

        var cst = new CstBuilder(source).build(root);

        assertEquals("ab cd", cst.leafText());
        assertEquals(CstNode.UNKNOWN, cst.children().get(1).type());
        assertEquals("", cst.children().get(1).content());
    }

    @Test
    void nullRootBecomesUnknownRoot() {
        var source = SourceContent.of("int x;\n");

        var cst = new CstBuilder(source).build(null);

        assertEquals(CstNode.UNKNOWN, cst.type());
        assertEquals("int x;\n", cst.leafText());
        assertEquals(CstNode.unknown(), new CstBuilder(source).convert(null, "body"));
    }

    @Test
    @DisplayName("overlapping siblings are clipped instead of duplicating bytes")
    void overlappingChildrenAreClipped() {
        var source = SourceContent.of("ab cd");
        var root = FakeNode.parent("module", 0, 5, FakeNode.leaf("a", 0, 3), FakeNode.leaf("b", 2, 5));

        var cst = new CstBuilder(source).build(root);

        assertEquals("ab cd", cst.leafText());
        assertEquals("cd", cst.children().get(1).content());
    }

    @Test
    void childrenPastTheEndAreTruncated() {
        var source = SourceContent.of("abc");
        var root = FakeNode.parent("module", 0, 3, FakeNode.leaf("a", 1, 40));

        var cst = new CstBuilder(source).build(root);

        assertEquals("abc", cst.leafText());
        assertEquals("bc", cst.children().get(1).content());
    }

    @Test
    @DisplayName("deeply nested trees are converted without exhausting a small thread stack")
    void deepNestingIsIterative() throws InterruptedException {
        int depth = 10_000;
        var text = "(".repeat(depth) + ")".repeat(depth);
        var node = FakeNode.leaf("paren", depth - 1, depth + 1);
        for (int i = depth - 2; i >= 0; i--) {
            node = FakeNode.parent("paren", i, 2 * depth - i, node);
        }
        var root = node;

        var built = new AtomicReference<CstNode>();
        var failure = new AtomicReference<Throwable>();
        var worker = new Thread(
                null,
                () -> {
                    try {
                        built.set(new CstBuilder(SourceContent.of(text)).build(root));
                    } catch (Throwable t) {
                        failure.set(t);
                    }
                },
                "deep-cst",
                256 * 1024);
        worker.start();
        worker.join();

        assertNull(failure.get());
        var cst = built.get();
        assertEquals(text, cst.leafText());
        int[] parens = {0};
        cst.visit(n -> {
            if (!n.isTrivia()) parens[0]++;
        });
        assertEquals(depth, parens[0]);
    }
}
