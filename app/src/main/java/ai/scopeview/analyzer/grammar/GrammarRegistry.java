package ai.scopeview.analyzer.grammar;

import ai.scopeview.analyzer.GrammarUnavailableException;
import ai.scopeview.analyzer.Language;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;

/**
 * Explicit, immutable map from language to grammar adapter. Built once at startup and passed to whoever parses; there
 * is no global registry.
 */
public final class GrammarRegistry {
    private final Map<Language, GrammarAdapter> adapters;

    private GrammarRegistry(EnumMap<Language, GrammarAdapter> adapters) {
        this.adapters = Collections.unmodifiableMap(new EnumMap<>(adapters));
    }

    /** Registry with the tree-sitter grammars for every supported language. */
    public static GrammarRegistry defaults() {
        return builder()
                .register(new TreeSitterGrammarAdapter(Language.C, TreeSitterC::new))
                .register(new TreeSitterGrammarAdapter(Language.CPP, TreeSitterCpp::new))
                .register(new TreeSitterGrammarAdapter(Language.PYTHON, TreeSitterPython::new))
                .register(new TreeSitterGrammarAdapter(Language.JAVASCRIPT, TreeSitterJavascript::new))
                .register(new TreeSitterGrammarAdapter(Language.TYPESCRIPT, TreeSitterTypescript::new))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<GrammarAdapter> find(Language language) {
        return Optional.ofNullable(adapters.get(language));
    }

    /** @throws GrammarUnavailableException when nothing is registered for {@code language} */
    public GrammarAdapter require(Language language, String path) {
        var adapter = adapters.get(language);
        if (adapter == null) {
            throw new GrammarUnavailableException(language, path);
        }
        return adapter;
    }

    public Set<Language> languages() {
        return adapters.keySet();
    }

    public static final class Builder {
        private final EnumMap<Language, GrammarAdapter> adapters = new EnumMap<>(Language.class);

        private Builder() {}

        public Builder register(GrammarAdapter adapter) {
            if (!adapter.language().isKnown()) {
                throw new IllegalArgumentException("Cannot register a grammar for " + adapter.language());
            }
            adapters.put(adapter.language(), adapter);
            return this;
        }

        public GrammarRegistry build() {
            return new GrammarRegistry(adapters);
        }
    }
}
