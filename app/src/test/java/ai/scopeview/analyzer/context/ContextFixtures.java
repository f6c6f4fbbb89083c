package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.NodeType;
import ai.scopeview.analyzer.SourceRange;

/** Small hand-built trees with costs that are easy to reason about: one token per character, summaries cost 5. */
final class ContextFixtures {
    static final String ALPHA = "def alpha():\n    pass";
    static final String BETA = "def beta():\n    pass";
    static final String GAMMA = "def gamma():\n    pass";
    static final String MODULE = ALPHA + "\n\n" + BETA + "\n\n" + GAMMA + "\n";

    static final String BOX_METHOD = "def open(self):\n        pass";
    static final String BOX_CLASS = "class Box:\n    " + BOX_METHOD;
    static final String BOX_MODULE = BOX_CLASS + "\n";

    static final int SUMMARY_COST = 5;

    private ContextFixtures() {}

    static TokenBudgeter budgeter() {
        return new TokenBudgeter(new CharCountTokenEstimator(1), SUMMARY_COST);
    }

    static Compressor compressor() {
        return new Compressor(budgeter());
    }

    private static AstNode.Builder function(String name, String raw, int line) {
        return AstNode.builder(NodeType.FUNCTION)
                .name(name)
                .qualifiedName(name)
                .signature("def " + name + "()")
                .path("mod.py")
                .rawContent(raw)
                .range(new SourceRange(line, 0, line + 1, 8));
    }

    /** Root (id 0) with functions alpha (1), beta (2) and gamma (3). */
    static AstNode module() {
        return AstNode.builder(NodeType.ROOT)
                .path("mod.py")
                .rawContent(MODULE)
                .range(new SourceRange(0, 0, 9, 0))
                .addChild(function("alpha", ALPHA, 0))
                .addChild(function("beta", BETA, 3))
                .addChild(function("gamma", GAMMA, 6))
                .build();
    }

    /** Root (id 0), class Box (1) and its method open (2). */
    static AstNode box() {
        var method = AstNode.builder(NodeType.METHOD)
                .name("open")
                .qualifiedName("Box.open")
                .signature("def open(self)")
                .path("box.py")
                .rawContent(BOX_METHOD)
                .range(new SourceRange(1, 4, 2, 12));
        var cls = AstNode.builder(NodeType.CLASS)
                .name("Box")
                .qualifiedName("Box")
                .signature("class Box")
                .path("box.py")
                .rawContent(BOX_CLASS)
                .range(new SourceRange(0, 0, 2, 12))
                .addChild(method);
        return AstNode.builder(NodeType.ROOT)
                .path("box.py")
                .rawContent(BOX_MODULE)
                .range(new SourceRange(0, 0, 3, 0))
                .addChild(cls)
                .build();
    }

    /** Root (id 0) with three classes, each holding two methods: ten nodes in all. */
    static AstNode shapes() {
        var root = AstNode.builder(NodeType.ROOT)
                .path("shapes.py")
                .rawContent("# shapes\n")
                .range(new SourceRange(0, 0, 18, 0));
        int line = 0;
        for (var shape : new String[] {"Circle", "Square", "Line"}) {
            var cls = AstNode.builder(NodeType.CLASS)
                    .name(shape)
                    .qualifiedName(shape)
                    .signature("class " + shape)
                    .path("shapes.py")
                    .rawContent("class " + shape + ":\n    pass")
                    .range(new SourceRange(line, 0, line + 5, 0));
            for (var method : new String[] {"area", "draw"}) {
                line += 2;
                cls.addChild(AstNode.builder(NodeType.METHOD)
                        .name(method)
                        .qualifiedName(shape + "." + method)
                        .signature("def " + method + "(self)")
                        .path("shapes.py")
                        .rawContent("def " + method + "(self):\n        return 0")
                        .range(new SourceRange(line, 4, line + 1, 16)));
            }
            line += 2;
            root.addChild(cls);
        }
        return root.build();
    }

    /** Importance giving each id of {@link #module()} its own fixed score. */
    static double moduleScore(AstNode node) {
        return switch (node.name()) {
            case "beta" -> 3;
            case "alpha" -> 2;
            case "gamma" -> 1;
            default -> 0;
        };
    }
}
