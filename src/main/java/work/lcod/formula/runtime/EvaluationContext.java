package work.lcod.formula.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.formula.model.CellAddress;

/**
 * Values known during one evaluation pass, keyed by reference ({@code A1} or {@code Sheet!A1}).
 * A context belongs to a single pass and is not thread-safe; views created by
 * {@link #withDefaultSheet(String)} share the same values. The address part of a key is matched
 * case-insensitively and without {@code $} markers.
 */
public final class EvaluationContext {
    private final Map<String, Object> values;
    private final String defaultSheet;

    public EvaluationContext() {
        this(new LinkedHashMap<>(), null);
    }

    private EvaluationContext(Map<String, Object> values, String defaultSheet) {
        this.values = values;
        this.defaultSheet = defaultSheet;
    }

    public static EvaluationContext of(Map<String, ?> initial) {
        var context = new EvaluationContext();
        if (initial != null) {
            initial.forEach(context::put);
        }
        return context;
    }

    /**
     * Returns a view on the same values where bare keys resolve against {@code sheet} first.
     */
    public EvaluationContext withDefaultSheet(String sheet) {
        return new EvaluationContext(values, sheet);
    }

    public String defaultSheet() {
        return defaultSheet;
    }

    public Object lookup(String key) {
        if (key == null) {
            return Blank.INSTANCE;
        }
        String canonical = canonicalKey(key);
        if (defaultSheet != null && canonical.indexOf('!') < 0) {
            Object scoped = values.get(defaultSheet + "!" + canonical);
            if (scoped != null) {
                return scoped;
            }
        }
        Object value = values.get(canonical);
        return value == null ? Blank.INSTANCE : value;
    }

    public boolean contains(String key) {
        return key != null && values.containsKey(canonicalKey(key));
    }

    public EvaluationContext put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        values.put(canonicalKey(key), value == null ? Blank.INSTANCE : value);
        return this;
    }

    // column letters are case-insensitive and '$' markers carry no meaning; the sheet name is kept as given
    private static String canonicalKey(String key) {
        int bang = key.lastIndexOf('!');
        return key.substring(0, bang + 1) + CellAddress.canonicalize(key.substring(bang + 1));
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
