package work.lcod.formula.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sheets of a workbook in load order. Read-only once built.
 */
public final class SheetCatalog {
    private final Map<String, Sheet> sheets;
    private final Map<String, String> namesByFoldedCase;

    private SheetCatalog(Map<String, Sheet> sheets) {
        this.sheets = Collections.unmodifiableMap(new LinkedHashMap<>(sheets));
        var folded = new LinkedHashMap<String, String>();
        for (String name : sheets.keySet()) {
            folded.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
        }
        this.namesByFoldedCase = Collections.unmodifiableMap(folded);
    }

    public static SheetCatalog of(Map<String, Sheet> sheets) {
        return new SheetCatalog(sheets == null ? Map.of() : sheets);
    }

    public static SheetCatalog empty() {
        return new SheetCatalog(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Sheet> sheets() {
        return sheets;
    }

    public Optional<Sheet> sheet(String name) {
        return Optional.ofNullable(sheets.get(name));
    }

    /**
     * Resolves a sheet name the way spreadsheets do (case-insensitively) and returns the catalog's spelling.
     */
    public Optional<String> resolveSheetName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        if (sheets.containsKey(name)) {
            return Optional.of(name);
        }
        return Optional.ofNullable(namesByFoldedCase.get(name.toLowerCase(Locale.ROOT)));
    }

    public int cellCount() {
        return sheets.values().stream().mapToInt(sheet -> sheet.data().size()).sum();
    }

    public static final class Builder {
        private final Map<String, Sheet> sheets = new LinkedHashMap<>();

        private Builder() {}

        public Builder sheet(String name, Sheet sheet) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(sheet, "sheet");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Sheet name must not be blank");
            }
            sheets.put(name, sheet);
            return this;
        }

        public SheetCatalog build() {
            return new SheetCatalog(sheets);
        }
    }
}
