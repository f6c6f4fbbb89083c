package ai.scopeview.analyzer.symbols;

import ai.scopeview.analyzer.ImportDirective;
import org.jetbrains.annotations.Nullable;

/**
 * A local name introduced by an import, or by a C++ using-declaration.
 *
 * @param module module or header the name comes from, as written; "" for using-declarations
 * @param importedName name inside the module; "" binds the module itself, "*" is a wildcard import
 * @param directive the import it came from; null for using-declarations
 */
public record ImportBinding(
        String localName, String module, String importedName, int scopeId, @Nullable ImportDirective directive) {
    public static final String WILDCARD = "*";

    public boolean bindsModule() {
        return importedName.isEmpty();
    }

    public boolean isWildcard() {
        return WILDCARD.equals(importedName);
    }
}
