package ai.scopeview.analyzer;

import java.util.Locale;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The closed set of languages the parse pipeline knows about. {@link #UNKNOWN} is a real member of the set so that
 * detection never has to return null.
 */
public enum Language {
    C("c", "C", ".", Set.of("c")),
    CPP("cpp", "C++", "::", Set.of("cpp", "cc", "cxx", "C", "hpp", "hh", "hxx")),
    PYTHON("python", "Python", ".", Set.of("py", "pyi")),
    JAVASCRIPT("javascript", "JavaScript", ".", Set.of("js", "mjs", "cjs", "jsx")),
    TYPESCRIPT("typescript", "TypeScript", ".", Set.of("ts", "mts", "cts", "tsx")),
    UNKNOWN("unknown", "Unknown", ".", Set.of());

    private final String tag;
    private final String displayName;
    private final String separator;
    private final Set<String> extensions;

    Language(String tag, String displayName, String separator, Set<String> extensions) {
        this.tag = tag;
        this.displayName = displayName;
        this.separator = separator;
        this.extensions = extensions;
    }

    /** Lowercase tag used in serialized output ("c", "cpp", "python", ...). */
    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    /** Separator used when joining a qualified name. */
    public String separator() {
        return separator;
    }

    /** File extensions (without the dot) that map unambiguously to this language. */
    public Set<String> extensions() {
        return extensions;
    }

    public boolean isCFamily() {
        return this == C || this == CPP || this == JAVASCRIPT || this == TYPESCRIPT;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Parses a language name or one of its usual aliases ("c++", "py", "js", "ts"). Anything unrecognised maps to
     * {@link #UNKNOWN}.
     */
    public static Language fromString(@Nullable String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "c" -> C;
            case "cpp", "c++", "cxx" -> CPP;
            case "python", "py" -> PYTHON;
            case "javascript", "js" -> JAVASCRIPT;
            case "typescript", "ts" -> TYPESCRIPT;
            default -> UNKNOWN;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
