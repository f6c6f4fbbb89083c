package ai.scopeview.analyzer.symbols;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * The merged, project-wide view of all file symbol tables, keyed by qualified name. Cross-file conflicts are kept as
 * lists in {@link Symbol#STABLE_ORDER}. Local symbols stay in their file table and are not merged.
 *
 * <p>Instances are persistent snapshots: {@link #withFile} and {@link #withoutFile} return a new table sharing
 * structure with this one, so readers holding an older snapshot are never disturbed.
 */
public final class ProjectSymbolTable {
    public static final ProjectSymbolTable EMPTY =
            new ProjectSymbolTable(HashTreePMap.empty(), HashTreePMap.empty(), HashTreePMap.empty());

    private final PMap<String, SymbolTable> files;
    private final PMap<String, List<Symbol>> byQualifiedName;
    private final PMap<String, List<Symbol>> bySimpleName;

    private ProjectSymbolTable(
            PMap<String, SymbolTable> files,
            PMap<String, List<Symbol>> byQualifiedName,
            PMap<String, List<Symbol>> bySimpleName) {
        this.files = files;
        this.byQualifiedName = byQualifiedName;
        this.bySimpleName = bySimpleName;
    }

    /** Replaces whatever {@code table.path()} contributed before with the symbols of {@code table}. */
    public ProjectSymbolTable withFile(SymbolTable table) {
        var base = withoutFile(table.path());
        var qualified = base.byQualifiedName;
        var simple = base.bySimpleName;
        for (var symbol : table.symbols()) {
            if (symbol.isLocal()) {
                continue;
            }
            qualified = add(qualified, symbol.qualifiedName(), symbol);
            simple = add(simple, symbol.name(), symbol);
        }
        return new ProjectSymbolTable(base.files.plus(table.path(), table), qualified, simple);
    }

    /** Drops the contribution of {@code path}; returns this table when the file is not part of it. */
    public ProjectSymbolTable withoutFile(String path) {
        var old = files.get(path);
        if (old == null) {
            return this;
        }
        var qualified = byQualifiedName;
        var simple = bySimpleName;
        for (var symbol : old.symbols()) {
            if (symbol.isLocal()) {
                continue;
            }
            qualified = remove(qualified, symbol.qualifiedName(), path);
            simple = remove(simple, symbol.name(), path);
        }
        return new ProjectSymbolTable(files.minus(path), qualified, simple);
    }

    /** Every non-local symbol declared under {@code qualifiedName}, in stable order. */
    public List<Symbol> lookup(String qualifiedName) {
        return byQualifiedName.getOrDefault(qualifiedName, List.of());
    }

    /** Every non-local symbol whose simple name is {@code name}, in stable order. */
    public List<Symbol> lookupSimpleName(String name) {
        return bySimpleName.getOrDefault(name, List.of());
    }

    public Optional<SymbolTable> fileTable(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public Set<String> files() {
        return files.keySet();
    }

    public boolean contains(String path) {
        return files.containsKey(path);
    }

    /** Number of distinct qualified names. */
    public int size() {
        return byQualifiedName.size();
    }

    /** Qualified names declared in more than one place. */
    public List<String> conflicts() {
        return byQualifiedName.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private static PMap<String, List<Symbol>> add(PMap<String, List<Symbol>> index, String key, Symbol symbol) {
        var current = index.getOrDefault(key, List.of());
        var updated = new ArrayList<Symbol>(current.size() + 1);
        updated.addAll(current);
        updated.add(symbol);
        updated.sort(Symbol.STABLE_ORDER);
        return index.plus(key, ImmutableList.copyOf(updated));
    }

    private static PMap<String, List<Symbol>> remove(PMap<String, List<Symbol>> index, String key, String path) {
        var current = index.get(key);
        if (current == null) {
            return index;
        }
        var kept = current.stream().filter(s -> !s.file().equals(path)).collect(ImmutableList.toImmutableList());
        return kept.isEmpty() ? index.minus(key) : index.plus(key, kept);
    }

    /** All merged symbols in stable order. */
    public List<Symbol> allSymbols() {
        return byQualifiedName.values().stream()
                .flatMap(List::stream)
                .sorted(Symbol.STABLE_ORDER)
                .toList();
    }

    /** Merged symbols of one kind, in stable order. */
    public List<Symbol> symbolsOfKind(SymbolKind kind) {
        return byQualifiedName.values().stream()
                .flatMap(List::stream)
                .filter(s -> s.kind() == kind)
                .sorted(Symbol.STABLE_ORDER)
                .toList();
    }

    @Override
    public String toString() {
        return "ProjectSymbolTable{files=" + files.size() + ", names=" + byQualifiedName.size() + "}";
    }
}
