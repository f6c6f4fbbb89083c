package ai.scopeview.analyzer;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** A formal parameter of a function-like node. All components are non-null; absent data is the empty string. */
public record Parameter(String name, String type, String defaultValue) {
    public Parameter {
        name = Objects.requireNonNullElse(name, "");
        type = Objects.requireNonNullElse(type, "");
        defaultValue = Objects.requireNonNullElse(defaultValue, "");
    }

    public static Parameter of(@Nullable String name, @Nullable String type, @Nullable String defaultValue) {
        return new Parameter(name, type, defaultValue);
    }

    public static Parameter named(String name) {
        return new Parameter(name, "", "");
    }
}
