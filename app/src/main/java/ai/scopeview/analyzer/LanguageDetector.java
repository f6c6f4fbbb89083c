package ai.scopeview.analyzer;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Maps a file path, and optionally a content sample, to a {@link Language}. The extension table is consulted first;
 * ambiguous ({@code .h}) or unmapped extensions fall back to content fingerprints. Detection is a pure function of its
 * inputs.
 */
public final class LanguageDetector {
    private static final Logger log = LogManager.getLogger(LanguageDetector.class);

    /** Only inspect this many characters of content. */
    static final int SAMPLE_LIMIT = 16 * 1024;

    private static final Map<String, Language> EXACT_EXTENSIONS = new HashMap<>();
    private static final Map<String, Language> LOWER_EXTENSIONS = new HashMap<>();

    static {
        for (var language : Language.values()) {
            for (var ext : language.extensions()) {
                EXACT_EXTENSIONS.put(ext, language);
                // ".C" is C++ but ".c" is C, so only fold extensions whose lowercase form is not already taken
                LOWER_EXTENSIONS.putIfAbsent(ext.toLowerCase(Locale.ROOT), language);
            }
        }
        LOWER_EXTENSIONS.put("c", Language.C);
    }

    private static final Pattern INCLUDE = Pattern.compile("^\\s*#\\s*include\\s*[<\"]", Pattern.MULTILINE);
    private static final Pattern CPP_FINGERPRINT = Pattern.compile(
            "\\bnamespace\\s+\\w+|\\bclass\\s+\\w+[^;]*\\{|\\btemplate\\s*<|\\bstd::|\\b(public|private|protected)\\s*:"
                    + "|#\\s*include\\s*<(iostream|string|vector|map|memory|algorithm|cstdio|cstdlib)>"
                    + "|\\busing\\s+namespace\\b|\\w+::\\w+");
    private static final Pattern PYTHON_DEF =
            Pattern.compile("^\\s*(async\\s+)?(def|class)\\s+\\w+[^\\n]*:\\s*$", Pattern.MULTILINE);
    private static final Pattern PYTHON_IMPORT =
            Pattern.compile("^(import\\s+[\\w.]+(\\s+as\\s+\\w+)?|from\\s+[\\w.]+\\s+import\\s+.+)\\s*$", Pattern.MULTILINE);
    private static final Pattern COLON_LINE = Pattern.compile(":\\s*$", Pattern.MULTILINE);
    private static final Pattern TS_FINGERPRINT = Pattern.compile(
            "\\binterface\\s+\\w+\\s*(extends\\s+[\\w<>, ]+)?\\{"
                    + "|^\\s*(export\\s+)?type\\s+\\w+\\s*=|\\w\\s*\\??:\\s*(string|number|boolean|void|any|unknown)\\b",
            Pattern.MULTILINE);
    private static final Pattern JS_FINGERPRINT =
            Pattern.compile("\\bfunction\\b\\s*\\w*\\s*\\(|=>|\\brequire\\s*\\(|\\b(const|let)\\s+\\w+\\s*=");

    private LanguageDetector() {}

    public static Language detect(Path path) {
        return detect(path, null);
    }

    /**
     * Detects the language of {@code path}. {@code content} may be null, in which case ambiguous extensions resolve to
     * their default ({@code .h} is C) and unmapped extensions are UNKNOWN.
     */
    public static Language detect(@Nullable Path path, @Nullable String content) {
        var ext = path == null ? "" : extensionOf(path);
        if (ext.equals("h") || ext.equals("H")) {
            var lang = content != null && looksLikeCpp(sample(content)) ? Language.CPP : Language.C;
            log.trace("Header {} detected as {}", path, lang);
            return lang;
        }
        var byExt = fromExtension(ext);
        if (byExt.isKnown() || content == null) {
            return byExt;
        }
        var byContent = fromContent(content);
        log.trace("No extension mapping for {}, content fingerprint gives {}", path, byContent);
        return byContent;
    }

    public static Language fromExtension(String extension) {
        if (extension.isEmpty()) {
            return Language.UNKNOWN;
        }
        var normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        var exact = EXACT_EXTENSIONS.get(normalized);
        if (exact != null) {
            return exact;
        }
        return LOWER_EXTENSIONS.getOrDefault(normalized.toLowerCase(Locale.ROOT), Language.UNKNOWN);
    }

    /** Content fingerprint detection, used when the extension says nothing. */
    public static Language fromContent(String content) {
        var sample = sample(content);
        if (INCLUDE.matcher(sample).find() && sample.indexOf('{') >= 0) {
            return looksLikeCpp(sample) ? Language.CPP : Language.C;
        }
        boolean pyDef = PYTHON_DEF.matcher(sample).find();
        if (pyDef || (PYTHON_IMPORT.matcher(sample).find() && COLON_LINE.matcher(sample).find())) {
            return Language.PYTHON;
        }
        if (TS_FINGERPRINT.matcher(sample).find()) {
            return Language.TYPESCRIPT;
        }
        if (JS_FINGERPRINT.matcher(sample).find()) {
            return Language.JAVASCRIPT;
        }
        return Language.UNKNOWN;
    }

    private static boolean looksLikeCpp(String sample) {
        return CPP_FINGERPRINT.matcher(sample).find();
    }

    private static String sample(String content) {
        return content.length() <= SAMPLE_LIMIT ? content : content.substring(0, SAMPLE_LIMIT);
    }

    private static String extensionOf(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        var name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1);
    }
}
