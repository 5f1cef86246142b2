package work.lcod.formula.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a row-major cell grid into a {@link Sheet}. The value grid holds what a spreadsheet shows,
 * the formula grid holds the cell text; a text starting with {@code =} marks a formula cell whose
 * displayed value becomes its cached result.
 */
public final class GridSplitter {
    private GridSplitter() {}

    public static Sheet split(List<? extends List<?>> values, List<? extends List<?>> formulas) {
        List<? extends List<?>> valueRows = values == null ? List.of() : values;
        List<? extends List<?>> formulaRows = formulas == null ? List.of() : formulas;
        int rows = Math.max(valueRows.size(), formulaRows.size());

        Map<String, Object> data = new LinkedHashMap<>();
        Map<String, Object> constants = new LinkedHashMap<>();
        Map<String, String> formulaMap = new LinkedHashMap<>();
        Map<String, Object> calculated = new LinkedHashMap<>();
        for (int r = 0; r < rows; r++) {
            List<?> valueRow = r < valueRows.size() ? valueRows.get(r) : List.of();
            List<?> formulaRow = r < formulaRows.size() ? formulaRows.get(r) : List.of();
            int columns = Math.max(size(valueRow), size(formulaRow));
            for (int c = 0; c < columns; c++) {
                Object value = cell(valueRow, c);
                Object text = cell(formulaRow, c);
                String address = CellAddress.format(c + 1, r + 1);
                if (text instanceof String formula && formula.startsWith("=")) {
                    formulaMap.put(address, formula);
                    data.put(address, formula);
                    if (value != null) {
                        calculated.put(address, value);
                    }
                } else if (value != null || text != null) {
                    Object constant = value != null ? value : text;
                    constants.put(address, constant);
                    data.put(address, constant);
                }
            }
        }
        return new Sheet(data, constants, formulaMap, calculated);
    }

    /**
     * Splits a single grid whose cells hold either a literal or formula text.
     */
    public static Sheet split(List<? extends List<?>> cells) {
        return split(null, cells);
    }

    private static int size(List<?> row) {
        return row == null ? 0 : row.size();
    }

    private static Object cell(List<?> row, int column) {
        if (row == null || column >= row.size()) {
            return null;
        }
        Object value = row.get(column);
        if (value instanceof String str && str.isEmpty()) {
            return null;
        }
        return value;
    }
}
