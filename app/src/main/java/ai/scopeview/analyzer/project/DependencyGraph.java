package ai.scopeview.analyzer.project;

import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.ParseResult;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * File-level dependency edges derived from the import directives that resolve to project files. Immutable; a new
 * graph is built whenever the set of files or one file's imports changes.
 */
public final class DependencyGraph {
    public static final DependencyGraph EMPTY = new DependencyGraph(ImmutableMap.of(), ImmutableMap.of(), Map.of());

    private final ImmutableMap<String, ImmutableSortedSet<String>> dependencies;
    private final ImmutableMap<String, ImmutableSortedSet<String>> dependents;
    private final Map<String, Map<ImportDirective, String>> targets;

    private DependencyGraph(
            ImmutableMap<String, ImmutableSortedSet<String>> dependencies,
            ImmutableMap<String, ImmutableSortedSet<String>> dependents,
            Map<String, Map<ImportDirective, String>> targets) {
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.targets = targets;
    }

    public static DependencyGraph build(Map<String, ParseResult> parses, ImportPathResolver resolver) {
        var files = parses.keySet();
        var forward = new TreeMap<String, TreeSet<String>>();
        var backward = new TreeMap<String, TreeSet<String>>();
        var resolvedTargets = new HashMap<String, Map<ImportDirective, String>>();
        for (var entry : parses.entrySet()) {
            var from = entry.getKey();
            var parse = entry.getValue();
            var byDirective = new HashMap<ImportDirective, String>();
            for (var directive : parse.imports()) {
                resolver.resolve(from, parse.language(), directive, files).ifPresent(to -> {
                    byDirective.put(directive, to);
                    forward.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
                    backward.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
                });
            }
            if (!byDirective.isEmpty()) {
                resolvedTargets.put(from, Map.copyOf(byDirective));
            }
        }
        return new DependencyGraph(freeze(forward), freeze(backward), Map.copyOf(resolvedTargets));
    }

    private static ImmutableMap<String, ImmutableSortedSet<String>> freeze(TreeMap<String, TreeSet<String>> edges) {
        var builder = ImmutableMap.<String, ImmutableSortedSet<String>>builder();
        edges.forEach((k, v) -> builder.put(k, ImmutableSortedSet.copyOf(v)));
        return builder.build();
    }

    /** Files {@code file} imports or includes directly. */
    public SortedSet<String> dependencies(String file) {
        return dependencies.getOrDefault(file, ImmutableSortedSet.of());
    }

    /** Files importing or including {@code file} directly. */
    public SortedSet<String> dependents(String file) {
        return dependents.getOrDefault(file, ImmutableSortedSet.of());
    }

    /** Everything reachable from {@code file} through imports, not including the file itself. */
    public SortedSet<String> transitiveDependencies(String file) {
        var seen = new TreeSet<String>();
        var queue = new ArrayDeque<>(dependencies(file));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (!next.equals(file) && seen.add(next)) {
                queue.addAll(dependencies(next));
            }
        }
        return seen;
    }

    /** Project file a directive of {@code file} resolved to. */
    public Optional<String> target(String file, ImportDirective directive) {
        return Optional.ofNullable(targets.getOrDefault(file, Map.of()).get(directive));
    }

    public int edgeCount() {
        return dependencies.values().stream().mapToInt(Set::size).sum();
    }
}
