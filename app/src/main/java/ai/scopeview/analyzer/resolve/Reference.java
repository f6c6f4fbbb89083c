package ai.scopeview.analyzer.resolve;

import ai.scopeview.analyzer.ReferenceKind;
import ai.scopeview.analyzer.ReferenceSite;
import ai.scopeview.analyzer.symbols.Symbol;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of resolving one reference site. Unresolved references are kept with status NOT_FOUND; they are a normal
 * result for names declared outside the project.
 *
 * @param file path of the file containing the site
 * @param candidates every matching declaration, in stable order
 */
public record Reference(
        ReferenceSite site, String file, ResolutionStatus status, @Nullable Symbol resolved, List<Symbol> candidates) {

    public Reference {
        Objects.requireNonNull(site, "site");
        file = Objects.requireNonNullElse(file, "");
        Objects.requireNonNull(status, "status");
        candidates = List.copyOf(candidates);
    }

    /** Classifies {@code candidates}, which must already be in stable order. */
    static Reference of(ReferenceSite site, String file, List<Symbol> candidates) {
        if (candidates.isEmpty()) {
            return new Reference(site, file, ResolutionStatus.NOT_FOUND, null, List.of());
        }
        long files = candidates.stream().map(Symbol::file).distinct().count();
        var status = files > 1 ? ResolutionStatus.AMBIGUOUS : ResolutionStatus.RESOLVED;
        return new Reference(site, file, status, candidates.get(0), candidates);
    }

    public ReferenceKind kind() {
        return site.kind();
    }

    public Optional<Symbol> resolvedSymbol() {
        return Optional.ofNullable(resolved);
    }

    public boolean isResolved() {
        return status != ResolutionStatus.NOT_FOUND;
    }
}
