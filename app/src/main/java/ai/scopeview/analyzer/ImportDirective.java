package ai.scopeview.analyzer;

import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * An include or import found in a file. {@code target} is the path or module exactly as written (without quotes or
 * angle brackets); {@code system} marks {@code #include <...>}.
 *
 * @param names imported bindings; empty for plain includes and {@code import x} forms
 * @param wildcard true for {@code from x import *}
 * @param relativeLevel number of leading dots of a Python relative import
 */
public record ImportDirective(
        String target,
        boolean system,
        List<ImportedName> names,
        @Nullable String moduleAlias,
        boolean wildcard,
        int relativeLevel,
        SourceRange range) {

    /** One name bound by an import: {@code import {name as alias}}. A default import has name "default". */
    public record ImportedName(String name, String alias) {
        public ImportedName {
            name = Objects.requireNonNullElse(name, "");
            alias = Objects.requireNonNullElse(alias, "");
        }

        /** The local name the import introduces. */
        public String localName() {
            return alias.isEmpty() ? name : alias;
        }
    }

    public ImportDirective {
        target = Objects.requireNonNullElse(target, "");
        names = names == null ? List.of() : List.copyOf(names);
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public static ImportDirective include(String target, boolean system, SourceRange range) {
        return new ImportDirective(target, system, List.of(), null, false, 0, range);
    }

    public boolean isRelative() {
        return relativeLevel > 0 || target.startsWith("./") || target.startsWith("../");
    }
}
