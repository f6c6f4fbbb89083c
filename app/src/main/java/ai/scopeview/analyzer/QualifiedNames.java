package ai.scopeview.analyzer;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.List;

/** Pure helpers for building and splitting qualified names. */
public final class QualifiedNames {
    private QualifiedNames() {}

    /**
     * Joins a parent's qualified name and a child's simple name with the language separator. An empty parent (the
     * file root) contributes nothing, and an unnamed child inherits the parent's name.
     */
    public static String of(String parentQualifiedName, String name, Language language) {
        if (name.isEmpty()) {
            return parentQualifiedName;
        }
        if (parentQualifiedName.isEmpty()) {
            return name;
        }
        return parentQualifiedName + language.separator() + name;
    }

    public static List<String> split(String qualifiedName, Language language) {
        if (qualifiedName.isEmpty()) {
            return List.of();
        }
        return Splitter.on(language.separator()).omitEmptyStrings().splitToList(qualifiedName);
    }

    public static String join(List<String> segments, Language language) {
        return Joiner.on(language.separator()).join(segments);
    }

    public static String simpleName(String qualifiedName, Language language) {
        int idx = qualifiedName.lastIndexOf(language.separator());
        return idx < 0 ? qualifiedName : qualifiedName.substring(idx + language.separator().length());
    }

    /** Qualified name of the enclosing scope; "" for top-level names. */
    public static String parentOf(String qualifiedName, Language language) {
        int idx = qualifiedName.lastIndexOf(language.separator());
        return idx < 0 ? "" : qualifiedName.substring(0, idx);
    }
}
