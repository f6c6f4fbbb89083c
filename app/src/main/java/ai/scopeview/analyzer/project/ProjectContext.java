package ai.scopeview.analyzer.project;

import ai.scopeview.analyzer.Diagnostic;
import ai.scopeview.analyzer.Language;
import ai.scopeview.analyzer.ParseException;
import ai.scopeview.analyzer.ParsePipeline;
import ai.scopeview.analyzer.ParseResult;
import ai.scopeview.analyzer.ProjectFile;
import ai.scopeview.analyzer.SourceRange;
import ai.scopeview.analyzer.resolve.Reference;
import ai.scopeview.analyzer.resolve.ReferenceResolver;
import ai.scopeview.analyzer.resolve.ResolutionContext;
import ai.scopeview.analyzer.symbols.ProjectSymbolTable;
import ai.scopeview.analyzer.symbols.Symbol;
import ai.scopeview.analyzer.symbols.SymbolKind;
import ai.scopeview.analyzer.symbols.SymbolTable;
import ai.scopeview.analyzer.symbols.SymbolTableBuilder;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * The parsed files of one project, their merged symbol table, the dependency graph between them and the references
 * resolved against it.
 *
 * <p>State lives in an immutable {@link Snapshot} behind an {@link AtomicReference}. Readers never lock. Writers parse
 * outside any lock and then merge under a single lock, replacing the snapshot. Each merge bumps the file's version and
 * marks the file and its dependents stale; resolution results computed against an older version are dropped.
 *
 * <p>Per-file failures become diagnostics and never abort a project-wide operation.
 */
public final class ProjectContext implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ProjectContext.class);

    /** One file's state in a snapshot. {@code parse} and {@code symbols} are null when the file failed to parse. */
    public record FileState(
            String path,
            long version,
            @Nullable ParseResult parse,
            @Nullable SymbolTable symbols,
            List<Diagnostic> diagnostics) {
        public FileState {
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean isParsed() {
            return parse != null;
        }
    }

    /** Everything a reader needs, consistent at one instant. */
    public record Snapshot(
            long generation, PMap<String, FileState> files, ProjectSymbolTable symbols, DependencyGraph graph) {}

    private record ResolvedFile(long version, List<Reference> references) {}

    private final Path root;
    private final ProjectConfig config;
    private final ParsePipeline pipeline;
    private final ReferenceResolver resolver;
    private final ImportPathResolver importPaths;
    private final ExecutorService pool;

    private final Object mergeLock = new Object();
    private final AtomicReference<Snapshot> snapshot;
    private final AtomicLong versions = new AtomicLong();
    private final Map<String, ResolvedFile> resolved = new ConcurrentHashMap<>();
    private final Set<String> stale = ConcurrentHashMap.newKeySet();
    private final List<Diagnostic> projectDiagnostics = new CopyOnWriteArrayList<>();

    public ProjectContext(
            Path root, ProjectConfig config, ParsePipeline pipeline, ReferenceResolver resolver) {
        this.root = root.toAbsolutePath().normalize();
        this.config = config;
        this.pipeline = pipeline;
        this.resolver = resolver;
        this.importPaths = new ImportPathResolver(config.includePaths());
        var threadCount = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(config.parseThreads(), r -> {
            var t = new Thread(r, "ScopeView-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.snapshot = new AtomicReference<>(
                new Snapshot(0, HashTreePMap.empty(), ProjectSymbolTable.EMPTY, DependencyGraph.EMPTY));
    }

    public Path root() {
        return root;
    }

    public ProjectConfig config() {
        return config;
    }

    public Snapshot snapshot() {
        return snapshot.get();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Mutation

    /**
     * Adds or replaces {@code path} with {@code content}. Returns the new parse result, or empty when the file was
     * refused or failed to parse; the reason is in {@link #diagnostics(String)} or {@link #projectDiagnostics()}.
     */
    public Optional<ParseResult> updateFile(String path, String content) {
        var normalized = normalizeOrReport(path);
        if (normalized.isEmpty() || !admit(normalized.get())) {
            return Optional.empty();
        }
        var state = parseFile(normalized.get(), () -> content);
        return Optional.ofNullable(commit(state, false).parse());
    }

    /** Reads {@code path} from disk below the project root and adds or replaces it. */
    public Optional<ParseResult> addFile(String path) {
        var normalized = normalizeOrReport(path);
        if (normalized.isEmpty() || !admit(normalized.get())) {
            return Optional.empty();
        }
        var state = parseFile(normalized.get(), () -> readFile(normalized.get()));
        return Optional.ofNullable(commit(state, false).parse());
    }

    /** Drops {@code path} and its symbols. Returns false when it was not part of the project. */
    public boolean removeFile(String path) {
        var normalized = ProjectPaths.normalize(path);
        if (normalized.isEmpty()) {
            return false;
        }
        var key = normalized.get();
        synchronized (mergeLock) {
            var current = snapshot.get();
            if (!current.files().containsKey(key)) {
                return false;
            }
            var files = current.files().minus(key);
            var next = new Snapshot(
                    current.generation() + 1,
                    files,
                    current.symbols().withoutFile(key),
                    DependencyGraph.build(parses(files), importPaths));
            markStale(key, current.graph(), next.graph());
            stale.remove(key);
            resolved.remove(key);
            snapshot.set(next);
        }
        log.debug("Removed {}", key);
        return true;
    }

    /** Reads and parses {@code paths} (relative to the root) in parallel on the worker pool. */
    public ProjectStats parseAll(Collection<String> paths) {
        var tasks = new ArrayList<CompletableFuture<Void>>();
        var batch = new ArrayList<String>();
        for (var path : new TreeSet<>(paths)) {
            var normalized = normalizeOrReport(path);
            if (normalized.isEmpty() || !admit(normalized.get())) {
                continue;
            }
            var key = normalized.get();
            tasks.add(CompletableFuture.runAsync(() -> commit(parseFile(key, () -> readFile(key)), true), pool));
            batch.add(key);
        }
        awaitAll(tasks);
        rebuildGraph(batch);
        var stats = stats();
        log.debug("Parsed project {}: {}", root(), stats);
        return stats;
    }

    /** Parses in-memory sources in parallel; keys are project-relative paths. */
    public ProjectStats parseAllSources(Map<String, String> sources) {
        var tasks = new ArrayList<CompletableFuture<Void>>();
        var batch = new ArrayList<String>();
        for (var path : new TreeSet<>(sources.keySet())) {
            var normalized = normalizeOrReport(path);
            if (normalized.isEmpty() || !admit(normalized.get())) {
                continue;
            }
            var key = normalized.get();
            var content = sources.get(path);
            tasks.add(CompletableFuture.runAsync(() -> commit(parseFile(key, () -> content), true), pool));
            batch.add(key);
        }
        awaitAll(tasks);
        rebuildGraph(batch);
        return stats();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Resolution

    /** Resolves every parsed file against the current snapshot, in parallel. */
    public ProjectStats resolveAll() {
        var snap = snapshot.get();
        var tasks = new ArrayList<CompletableFuture<Void>>();
        for (var state : snap.files().values()) {
            if (state.isParsed()) {
                tasks.add(CompletableFuture.runAsync(() -> resolveAgainst(snap, state), pool));
            }
        }
        awaitAll(tasks);
        return stats();
    }

    /** Resolves one file against the current snapshot and returns its references. */
    public List<Reference> resolveFile(String path) {
        var snap = snapshot.get();
        return ProjectPaths.normalize(path)
                .map(key -> snap.files().get(key))
                .filter(FileState::isParsed)
                .map(state -> resolveAgainst(snap, state))
                .orElse(List.of());
    }

    private List<Reference> resolveAgainst(Snapshot snap, FileState state) {
        List<Reference> references;
        try {
            references = resolver.resolveFile(contextFor(snap, state));
        } catch (RuntimeException e) {
            log.warn("Resolution failed for {}: {}", state.path(), e.getMessage(), e);
            projectDiagnostics.add(Diagnostic.error(
                    Diagnostic.Code.RESOLUTION_FAILED,
                    "Resolution failed: " + e.getMessage(),
                    SourceRange.UNKNOWN,
                    state.path()));
            return List.of();
        }
        synchronized (mergeLock) {
            var current = snapshot.get();
            var now = current.files().get(state.path());
            if (now == null || now.version() != state.version()) {
                log.debug("Discarding references of {} computed against version {}", state.path(), state.version());
                return references;
            }
            resolved.put(state.path(), new ResolvedFile(state.version(), references));
            if (current.generation() == snap.generation()) {
                stale.remove(state.path());
            }
        }
        return references;
    }

    /** The lookup context {@code state}'s file sees in {@code snap}. */
    public ResolutionContext contextFor(Snapshot snap, FileState state) {
        var parse = state.parse();
        var table = state.symbols();
        if (parse == null || table == null) {
            throw new IllegalArgumentException(state.path() + " has no parse result");
        }
        var path = state.path();
        Set<String> visible = switch (parse.language()) {
            case C, CPP -> snap.graph().transitiveDependencies(path);
            case PYTHON, JAVASCRIPT, TYPESCRIPT, UNKNOWN -> snap.graph().dependencies(path);
        };
        var files = snap.files();
        return new ResolutionContext(
                parse,
                table,
                snap.symbols(),
                visible,
                directive -> snap.graph().target(path, directive),
                other -> Optional.ofNullable(files.get(other)).map(FileState::parse));
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Lookups

    public Optional<ParseResult> parseResult(String path) {
        return fileState(path).map(FileState::parse);
    }

    public Optional<SymbolTable> symbols(String path) {
        return fileState(path).map(FileState::symbols);
    }

    public ProjectSymbolTable symbolTable() {
        return snapshot.get().symbols();
    }

    /** The last published references of {@code path}; empty until it has been resolved. */
    public List<Reference> references(String path) {
        return ProjectPaths.normalize(path)
                .map(resolved::get)
                .map(ResolvedFile::references)
                .orElse(List.of());
    }

    /** Non-local symbols of {@code kind} across the project, in stable order. */
    public List<Symbol> symbolsOfKind(SymbolKind kind) {
        return snapshot.get().symbols().symbolsOfKind(kind);
    }

    /**
     * Published references whose chosen declaration is {@code symbol}, ordered by file and then by position. Files that
     * have not been resolved yet contribute nothing.
     */
    public List<Reference> referencesTo(Symbol symbol) {
        var result = new ArrayList<Reference>();
        for (var file : resolved.values()) {
            for (var reference : file.references()) {
                if (symbol.equals(reference.resolved())) {
                    result.add(reference);
                }
            }
        }
        result.sort(Comparator.comparing(Reference::file)
                .thenComparingInt(r -> r.site().range().startLine())
                .thenComparingInt(r -> r.site().range().startColumn()));
        return result;
    }

    public boolean isStale(String path) {
        return ProjectPaths.normalize(path).map(stale::contains).orElse(false);
    }

    public SortedSet<String> staleFiles() {
        return new TreeSet<>(stale);
    }

    public SortedSet<String> dependencies(String path) {
        return ProjectPaths.normalize(path)
                .map(p -> snapshot.get().graph().dependencies(p))
                .orElse(new TreeSet<>());
    }

    public SortedSet<String> dependents(String path) {
        return ProjectPaths.normalize(path)
                .map(p -> snapshot.get().graph().dependents(p))
                .orElse(new TreeSet<>());
    }

    public long version(String path) {
        return fileState(path).map(FileState::version).orElse(0L);
    }

    public SortedSet<String> files() {
        return new TreeSet<>(snapshot.get().files().keySet());
    }

    public List<Diagnostic> diagnostics(String path) {
        return fileState(path).map(FileState::diagnostics).orElse(List.of());
    }

    /** Diagnostics not tied to a file in the project: refused paths, limits, resolution failures. */
    public List<Diagnostic> projectDiagnostics() {
        return List.copyOf(projectDiagnostics);
    }

    /** All diagnostics: per-file ones in path order, then project-level ones. */
    public List<Diagnostic> diagnostics() {
        var result = new ArrayList<Diagnostic>();
        for (var path : files()) {
            result.addAll(diagnostics(path));
        }
        result.addAll(projectDiagnostics);
        return result;
    }

    public ProjectStats stats() {
        var snap = snapshot.get();
        int parsed = 0;
        int failed = 0;
        int partial = 0;
        int nodes = 0;
        int diagnosticCount = projectDiagnostics.size();
        var byLanguage = new EnumMap<Language, Integer>(Language.class);
        for (var state : snap.files().values()) {
            diagnosticCount += state.diagnostics().size();
            var parse = state.parse();
            if (parse == null) {
                failed++;
                continue;
            }
            parsed++;
            if (parse.isPartial()) {
                partial++;
            }
            nodes += parse.nodeCount();
            byLanguage.merge(parse.language(), 1, Integer::sum);
        }
        int references = 0;
        int resolvedCount = 0;
        for (var file : resolved.values()) {
            references += file.references().size();
            resolvedCount += (int) file.references().stream().filter(Reference::isResolved).count();
        }
        int edges = 0;
        for (var path : snap.files().keySet()) {
            edges += snap.graph().dependencies(path).size();
        }
        return new ProjectStats(
                snap.files().size(),
                parsed,
                failed,
                partial,
                nodes,
                snap.symbols().size(),
                edges,
                references,
                resolvedCount,
                stale.size(),
                diagnosticCount,
                byLanguage);
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Internals

    private Optional<FileState> fileState(String path) {
        return ProjectPaths.normalize(path).map(p -> snapshot.get().files().get(p));
    }

    private Optional<String> normalizeOrReport(String path) {
        var normalized = ProjectPaths.normalize(path);
        if (normalized.isEmpty()) {
            log.warn("Refusing path outside the project: {}", path);
            projectDiagnostics.add(Diagnostic.error(
                    Diagnostic.Code.INVALID_PATH, "Path is not inside the project", SourceRange.UNKNOWN, path));
        }
        return normalized;
    }

    /** False when adding {@code path} would exceed the file limit. */
    private boolean admit(String path) {
        var current = snapshot.get();
        if (current.files().containsKey(path) || current.files().size() < config.maxFiles()) {
            return true;
        }
        log.warn("Project limit of {} files reached, refusing {}", config.maxFiles(), path);
        projectDiagnostics.add(Diagnostic.error(
                Diagnostic.Code.TOO_MANY_FILES,
                "Project limit of " + config.maxFiles() + " files reached",
                SourceRange.UNKNOWN,
                path));
        return false;
    }

    private String readFile(String path) {
        var file = new ProjectFile(root(), path);
        return file.read().orElseThrow(() -> new ParseException(
                "Cannot read " + path,
                List.of(Diagnostic.error(Diagnostic.Code.IO_ERROR, "Cannot read file", SourceRange.UNKNOWN, path))));
    }

    /** Runs the pipeline for one file; never throws. */
    private FileState parseFile(String path, Supplier<String> content) {
        try {
            var parse = pipeline.parse(content.get(), path, null);
            var table = SymbolTableBuilder.build(parse);
            var diagnostics = new ArrayList<>(parse.diagnostics());
            diagnostics.addAll(table.diagnostics());
            return new FileState(path, 0, parse, table, diagnostics);
        } catch (ParseException e) {
            log.warn("Failed to parse {}: {}", path, e.getMessage());
            return new FileState(path, 0, null, null, e.getDiagnostics());
        } catch (RuntimeException e) {
            log.warn("Unexpected failure parsing {}", path, e);
            return new FileState(
                    path,
                    0,
                    null,
                    null,
                    List.of(Diagnostic.error(
                            Diagnostic.Code.SYNTAX_ERROR, "Parse failed: " + e.getMessage(), SourceRange.UNKNOWN, path)));
        }
    }

    /**
     * Publishes {@code state} as the new version of its file. Batch commits keep the previous dependency graph; the
     * batch rebuilds it once at the end.
     */
    private FileState commit(FileState state, boolean deferGraph) {
        synchronized (mergeLock) {
            var current = snapshot.get();
            var versioned = new FileState(
                    state.path(), versions.incrementAndGet(), state.parse(), state.symbols(), state.diagnostics());
            var files = current.files().plus(state.path(), versioned);
            var table = versioned.symbols();
            var symbols = table == null
                    ? current.symbols().withoutFile(state.path())
                    : current.symbols().withFile(table);
            var graph = deferGraph ? current.graph() : DependencyGraph.build(parses(files), importPaths);
            var next = new Snapshot(current.generation() + 1, files, symbols, graph);
            markStale(state.path(), current.graph(), next.graph());
            snapshot.set(next);
            log.trace("Committed {} version {}", state.path(), versioned.version());
            return versioned;
        }
    }

    private void rebuildGraph(List<String> batch) {
        synchronized (mergeLock) {
            var current = snapshot.get();
            var graph = DependencyGraph.build(parses(current.files()), importPaths);
            snapshot.set(new Snapshot(current.generation() + 1, current.files(), current.symbols(), graph));
            for (var path : batch) {
                markStale(path, current.graph(), graph);
            }
        }
    }

    /** The changed file and everything that depended on it before or after the change. */
    private void markStale(String path, DependencyGraph before, DependencyGraph after) {
        var affected = new HashSet<String>();
        affected.add(path);
        affected.addAll(before.dependents(path));
        affected.addAll(after.dependents(path));
        affected.addAll(transitiveDependents(path, after));
        stale.addAll(affected);
    }

    /** C-family includes are transitive, so files including an includer see the change too. */
    private static Set<String> transitiveDependents(String path, DependencyGraph graph) {
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<>(graph.dependents(path));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(graph.dependents(next));
            }
        }
        return seen;
    }

    private static Map<String, ParseResult> parses(PMap<String, FileState> files) {
        var result = new HashMap<String, ParseResult>();
        for (var state : files.values()) {
            if (state.parse() != null) {
                result.put(state.path(), state.parse());
            }
        }
        return result;
    }

    private static void awaitAll(List<CompletableFuture<Void>> tasks) {
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();
    }
}
