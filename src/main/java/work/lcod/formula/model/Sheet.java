package work.lcod.formula.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Contents of one sheet as supplied by a loader. Every cell is either a constant or a formula:
 * {@code data} is the union of both, and {@code calculated} (cached results) only covers formulas.
 * Addresses are stored in canonical spelling ({@code $b$2} becomes {@code B2}).
 */
public record Sheet(
    Map<String, Object> data,
    Map<String, Object> constants,
    Map<String, String> formulas,
    Map<String, Object> calculated
) {
    public Sheet {
        data = freeze(data, "data");
        constants = freeze(constants, "constants");
        formulas = freeze(formulas, "formulas");
        calculated = freeze(calculated, "calculated");
        validate(data, constants, formulas, calculated);
    }

    public static Sheet empty() {
        return new Sheet(Map.of(), Map.of(), Map.of(), Map.of());
    }

    /**
     * Builds a sheet from its data map and formula map, deriving the constants.
     */
    public static Sheet of(Map<String, ?> data, Map<String, String> formulas) {
        return of(data, formulas, Map.of());
    }

    public static Sheet of(Map<String, ?> data, Map<String, String> formulas, Map<String, ?> calculated) {
        Map<String, String> formulaMap = freeze(formulas, "formulas");
        Map<String, Object> dataMap = new LinkedHashMap<>(Sheet.<Object>freeze(data, "data"));
        Map<String, Object> constants = new LinkedHashMap<>();
        for (var entry : dataMap.entrySet()) {
            if (!formulaMap.containsKey(entry.getKey())) {
                constants.put(entry.getKey(), entry.getValue());
            }
        }
        dataMap.putAll(formulaMap);
        return new Sheet(dataMap, constants, formulaMap, Sheet.<Object>freeze(calculated, "calculated"));
    }

    public boolean isFormula(String address) {
        return address != null && formulas.containsKey(CellAddress.canonicalize(address));
    }

    private static void validate(
        Map<String, Object> data,
        Map<String, Object> constants,
        Map<String, String> formulas,
        Map<String, Object> calculated
    ) {
        for (String key : constants.keySet()) {
            if (formulas.containsKey(key)) {
                throw new IllegalArgumentException("Cell " + key + " is both a constant and a formula");
            }
        }
        Set<String> union = new LinkedHashSet<>(constants.keySet());
        union.addAll(formulas.keySet());
        if (!union.equals(data.keySet())) {
            throw new IllegalArgumentException("Sheet data keys must equal constants plus formulas keys");
        }
        for (String key : calculated.keySet()) {
            if (!formulas.containsKey(key)) {
                throw new IllegalArgumentException("Calculated value for " + key + " has no formula");
            }
        }
    }

    // keys are stored canonical ("$a$1" -> "A1") so they match the references formulas produce;
    // LinkedHashMap keeps null values (blank constants), which Map.copyOf rejects
    private static <V> Map<String, V> freeze(Map<String, ? extends V> map, String name) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, V> canonical = new LinkedHashMap<>();
        for (var entry : map.entrySet()) {
            String key = CellAddress.canonicalize(Objects.requireNonNull(entry.getKey(), name + " key"));
            if (canonical.containsKey(key)) {
                throw new IllegalArgumentException(
                    "Sheet " + name + " holds " + key + " more than once under different spellings"
                );
            }
            canonical.put(key, entry.getValue());
        }
        return Collections.unmodifiableMap(canonical);
    }
}
