package work.lcod.formula.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.formula.functions.StandardFunctions;

/**
 * Immutable table of formula functions keyed by upper-case name. Safe to share across threads.
 */
public final class FunctionRegistry {
    private static final FunctionRegistry STANDARD = StandardFunctions.register(builder()).build();

    private final Map<String, FormulaFunction> functions;

    private FunctionRegistry(Map<String, FormulaFunction> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    /** Registry holding the built-in functions ({@code SUM}, {@code AVERAGE}, {@code MIN}, {@code MAX}, {@code IF}). */
    public static FunctionRegistry standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FormulaFunction> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(functions.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public Map<String, FormulaFunction> entries() {
        return functions;
    }

    /** Copies this registry into a builder so callers can derive an extended table. */
    public Builder toBuilder() {
        var builder = new Builder();
        functions.forEach(builder::register);
        return builder;
    }

    public static final class Builder {
        private final Map<String, FormulaFunction> functions = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String name, FormulaFunction fn) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(fn, "fn");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Function name must not be blank");
            }
            functions.put(name.trim().toUpperCase(Locale.ROOT), fn);
            return this;
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(functions);
        }
    }
}
