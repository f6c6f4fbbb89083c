package ai.scopeview.analyzer.ast;

import ai.scopeview.analyzer.AstNode;
import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.ReferenceSite;
import java.util.List;

/** The AST of one file together with the side tables collected while building it. */
public record AstBuildResult(AstNode root, List<ImportDirective> imports, List<ReferenceSite> referenceSites) {
    public AstBuildResult {
        imports = List.copyOf(imports);
        referenceSites = List.copyOf(referenceSites);
    }
}
