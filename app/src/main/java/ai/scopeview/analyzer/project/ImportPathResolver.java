package ai.scopeview.analyzer.project;

import ai.scopeview.analyzer.ImportDirective;
import ai.scopeview.analyzer.Language;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps import directives to project files.
 *
 * <ul>
 *   <li>C and C++ includes are looked up next to the including file (quoted includes only), then at the project
 *       root, then under each configured include path.
 *   <li>Python modules {@code a.b} map to {@code a/b.py}, {@code a/b.pyi} or {@code a/b/__init__.py}, from the
 *       project root or an include path; relative imports start at the importing file's package.
 *   <li>JavaScript and TypeScript relative specifiers are tried as written, with each known extension, and as a
 *       directory index. Bare package names are never project files.
 * </ul>
 */
public final class ImportPathResolver {
    static final List<String> SCRIPT_EXTENSIONS = List.of(".js", ".jsx", ".mjs", ".cjs", ".ts", ".tsx");

    private final List<String> includePaths;

    public ImportPathResolver(List<String> includePaths) {
        var normalized = new ArrayList<String>();
        for (var include : includePaths) {
            ProjectPaths.normalize(include).ifPresent(normalized::add);
        }
        this.includePaths = List.copyOf(normalized);
    }

    /** Project file named by {@code directive} in {@code fromFile}, if it is one of {@code files}. */
    public Optional<String> resolve(String fromFile, Language language, ImportDirective directive, Set<String> files) {
        for (var candidate : candidates(fromFile, language, directive)) {
            if (files.contains(candidate) && !candidate.equals(fromFile)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Paths tried for {@code directive}, in order of preference. */
    List<String> candidates(String fromFile, Language language, ImportDirective directive) {
        var target = directive.target();
        var result = new ArrayList<String>();
        var dir = ProjectPaths.parent(fromFile);
        switch (language) {
            case C, CPP -> {
                if (target.isEmpty()) {
                    break;
                }
                if (!directive.system()) {
                    ProjectPaths.resolve(dir, target).ifPresent(result::add);
                }
                ProjectPaths.normalize(target).ifPresent(result::add);
                for (var include : includePaths) {
                    ProjectPaths.resolve(include, target).ifPresent(result::add);
                }
            }
            case PYTHON -> {
                var modulePath = target.replace('.', '/');
                if (directive.relativeLevel() > 0) {
                    var base = dir;
                    for (int i = 1; i < directive.relativeLevel() && !base.isEmpty(); i++) {
                        base = ProjectPaths.parent(base);
                    }
                    addPythonModule(base, modulePath, result);
                } else {
                    addPythonModule("", modulePath, result);
                    for (var include : includePaths) {
                        addPythonModule(include, modulePath, result);
                    }
                }
            }
            case JAVASCRIPT, TYPESCRIPT -> {
                if (!target.startsWith("./") && !target.startsWith("../")) {
                    break;
                }
                var resolved = ProjectPaths.resolve(dir, target);
                if (resolved.isEmpty()) {
                    break;
                }
                var base = resolved.get();
                result.add(base);
                var stripped = stripScriptExtension(base);
                for (var ext : SCRIPT_EXTENSIONS) {
                    result.add(stripped + ext);
                }
                for (var ext : SCRIPT_EXTENSIONS) {
                    result.add(base + "/index" + ext);
                }
            }
            case UNKNOWN -> {
                // nothing to resolve
            }
        }
        return result;
    }

    private static void addPythonModule(String base, String modulePath, List<String> result) {
        if (modulePath.isEmpty()) {
            // from . import x
            ProjectPaths.resolve(base, "__init__.py").ifPresent(result::add);
            return;
        }
        ProjectPaths.resolve(base, modulePath + ".py").ifPresent(result::add);
        ProjectPaths.resolve(base, modulePath + ".pyi").ifPresent(result::add);
        ProjectPaths.resolve(base, modulePath + "/__init__.py").ifPresent(result::add);
    }

    private static String stripScriptExtension(String path) {
        for (var ext : SCRIPT_EXTENSIONS) {
            if (path.endsWith(ext)) {
                return path.substring(0, path.length() - ext.length());
            }
        }
        return path;
    }
}
