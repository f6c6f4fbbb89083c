package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.symbols.ProjectSymbolTable;
import ai.scopeview.analyzer.symbols.SymbolTable;
import ai.scopeview.analyzer.symbols.SymbolTableBuilder;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Everything a strategy may consult while resolving the sites of one file. All of it comes from a single project
 * snapshot, so resolution is deterministic and needs no locking.
 *
 * @param visibleFiles files whose declarations this file may see besides its own: its imports, or for C and C++ its
 *     transitive include closure
 * @param importTargets maps an import directive of this file to the project file it names, when there is one
 * @param parses parse results of other project files, for checks that need node attributes (exports)
 */
public record ResolutionContext(
        ParseResult parse,
        SymbolTable table,
        ProjectSymbolTable project,
        Set<String> visibleFiles,
        Function<ImportDirective, Optional<String>> importTargets,
        Function<String, Optional<ParseResult>> parses) {

    public ResolutionContext {
        visibleFiles = Set.copyOf(visibleFiles);
    }

    /** Context for a file resolved on its own: nothing outside the file is visible. */
    public static ResolutionContext standalone(ParseResult parse) {
        var table = SymbolTableBuilder.build(parse);
        var project = ProjectSymbolTable.EMPTY.withFile(table);
        var self = Map.of(parse.path(), parse);
        return new ResolutionContext(
                parse, table, project, Set.of(), d -> Optional.empty(), p -> Optional.ofNullable(self.get(p)));
    }

    public String path() {
        return parse.path();
    }

    public boolean canSee(String file) {
        return file.equals(parse.path()) || visibleFiles.contains(file);
    }

    public Optional<String> targetOf(ImportDirective directive) {
        return importTargets.apply(directive);
    }

    public Optional<ParseResult> parseOf(String file) {
        return file.equals(parse.path()) ? Optional.of(parse) : parses.apply(file);
    }
}
