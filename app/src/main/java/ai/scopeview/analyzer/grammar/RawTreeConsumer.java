package ai.scopeview.analyzer.grammar;

import ai.scopeview.analyzer.Diagnostic;
import java.util.List;

/** Receives a raw tree on loan. Whatever it returns must not hold on to any {@link RawNode}. */
@FunctionalInterface
public interface RawTreeConsumer<T> {
    T accept(RawNode root, List<Diagnostic> syntaxDiagnostics);
}
