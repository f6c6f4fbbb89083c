package ai.scopeview.analyzer;

import java.util.List;

/** No grammar is registered for the requested language. Fatal for the file being parsed, never for a project. */
public class GrammarUnavailableException extends ParseException {
    private final Language language;

    public GrammarUnavailableException(Language language, String path) {
        super(
                "No grammar available for " + language + (path.isEmpty() ? "" : " (" + path + ")"),
                List.of(Diagnostic.error(
                        Diagnostic.Code.GRAMMAR_UNAVAILABLE,
                        "No grammar available for " + language,
                        SourceRange.UNKNOWN,
                        path)));
        this.language = language;
    }

    public Language getLanguage() {
        return language;
    }
}
