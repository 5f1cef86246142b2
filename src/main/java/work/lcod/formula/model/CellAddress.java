package work.lcod.formula.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single cell address with 1-based column and row ({@code A1} is column 1, row 1).
 */
public record CellAddress(int column, int row) {
    private static final Pattern ADDRESS = Pattern.compile("\\$?([A-Za-z]+)\\$?([0-9]+)");

    public CellAddress {
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1: " + column);
        }
        if (row < 1) {
            throw new IllegalArgumentException("row must be >= 1: " + row);
        }
    }

    public static CellAddress parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Cell address is required");
        }
        Matcher matcher = ADDRESS.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid cell address: " + text);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Row out of range in cell address: " + text, ex);
        }
        return new CellAddress(columnIndex(matcher.group(1)), row);
    }

    public static boolean isAddress(String text) {
        return text != null && ADDRESS.matcher(text.trim()).matches();
    }

    /**
     * Canonical spelling of an address or range: upper-case columns, no {@code $} markers.
     */
    public static String canonicalize(String reference) {
        int colon = reference.indexOf(':');
        if (colon >= 0) {
            return canonicalize(reference.substring(0, colon)) + ":" + canonicalize(reference.substring(colon + 1));
        }
        return reference.replace("$", "").toUpperCase(Locale.ROOT);
    }

    public static String format(int column, int row) {
        return new CellAddress(column, row).toString();
    }

    /** {@code 1 -> A}, {@code 26 -> Z}, {@code 27 -> AA}. */
    public static String columnName(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1: " + column);
        }
        var letters = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            remaining -= 1;
            letters.insert(0, (char) ('A' + remaining % 26));
            remaining /= 26;
        }
        return letters.toString();
    }

    public static int columnIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("Column letters are required");
        }
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char ch = Character.toUpperCase(letters.charAt(i));
            if (ch < 'A' || ch > 'Z') {
                throw new IllegalArgumentException("Invalid column letters: " + letters);
            }
            index = Math.addExact(Math.multiplyExact(index, 26), ch - 'A' + 1);
        }
        return index;
    }

    @Override
    public String toString() {
        return columnName(column) + row;
    }
}
