package work.lcod.formula.ast;

import java.util.Objects;

/**
 * Reference to a cell or an opaque range, holding the canonical key ({@code A1}, {@code Sheet1!B2:C3}).
 */
public record CellRef(String key) implements FormulaNode {
    public CellRef {
        Objects.requireNonNull(key, "key");
    }

    public boolean isQualified() {
        return key.indexOf('!') >= 0;
    }

    public boolean isRange() {
        return key.indexOf(':') >= 0;
    }

    @Override
    public String toString() {
        return key;
    }
}
