package ai.scopeview.analyzer.context;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.NodeType;

/**
 * Turns a plan back into source-like text. FULL nodes keep their raw text with each child replaced by its own
 * rendering, SUMMARY nodes show their signature line followed by their kept children, and every run of consecutive
 * elided siblings collapses into one placeholder comment.
 */
public final class ContextRenderer {
    private final String placeholder;

    public ContextRenderer(Language language) {
        this.placeholder = placeholderFor(language);
    }

    static String placeholderFor(Language language) {
        return language == Language.PYTHON ? "# ..." : "// ...";
    }

    public String placeholder() {
        return placeholder;
    }

    public String render(CompressionPlan plan) {
        var out = new StringBuilder();
        render(plan, plan.root(), out);
        return out.toString();
    }

    private void render(CompressionPlan plan, AstNode node, StringBuilder out) {
        switch (plan.decision(node.id())) {
            case FULL -> renderFull(plan, node, out);
            case SUMMARY -> renderSummary(plan, node, out);
            case ELIDED -> out.append(placeholder);
        }
    }

    private void renderFull(CompressionPlan plan, AstNode node, StringBuilder out) {
        var raw = node.rawContent();
        int cursor = 0;
        boolean inElidedRun = false;
        for (var child : node.children()) {
            var text = child.rawContent();
            int at = text.isEmpty() ? -1 : raw.indexOf(text, cursor);
            if (at < 0) {
                continue;
            }
            var gap = raw.substring(cursor, at);
            cursor = at + text.length();
            if (!plan.isKept(child.id())) {
                if (!inElidedRun) {
                    out.append(gap).append(placeholder);
                    inElidedRun = true;
                }
                continue;
            }
            // whitespace between two elided siblings is dropped with them
            out.append(inElidedRun ? leadingBreak(gap) : gap);
            inElidedRun = false;
            render(plan, child, out);
        }
        out.append(raw, cursor, raw.length());
    }

    private void renderSummary(CompressionPlan plan, AstNode node, StringBuilder out) {
        var header = header(node);
        out.append(header);
        boolean first = header.isEmpty();
        boolean inElidedRun = false;
        for (var child : node.children()) {
            boolean kept = plan.isKept(child.id());
            if (!kept && inElidedRun) {
                continue;
            }
            if (!first) {
                out.append('\n');
            }
            first = false;
            out.append(" ".repeat(child.range().startColumn()));
            if (kept) {
                render(plan, child, out);
                inElidedRun = false;
            } else {
                out.append(placeholder);
                inElidedRun = true;
            }
        }
    }

    /** Signature line of a summarized node; the root has none. */
    static String header(AstNode node) {
        if (node.type() == NodeType.ROOT) {
            return "";
        }
        if (!node.signature().isEmpty()) {
            return node.signature();
        }
        var raw = node.rawContent();
        int newline = raw.indexOf('\n');
        return (newline < 0 ? raw : raw.substring(0, newline)).stripTrailing();
    }

    private static String leadingBreak(String gap) {
        int newline = gap.lastIndexOf('\n');
        return newline < 0 ? gap : gap.substring(newline);
    }
}
