package work.lcod.formula.ast;

import java.util.Objects;

/**
 * Literal scalar: a {@link Double}, a {@link String} or a {@link Boolean}.
 */
public record Constant(Object value) implements FormulaNode {
    public Constant {
        Objects.requireNonNull(value, "value");
    }

    public static Constant number(double value) {
        return new Constant(value);
    }

    @Override
    public String toString() {
        return value instanceof String str ? '"' + str + '"' : String.valueOf(value);
    }
}
