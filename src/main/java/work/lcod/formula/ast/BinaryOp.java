package work.lcod.formula.ast;

import java.util.Objects;

public record BinaryOp(BinaryOperator operator, FormulaNode left, FormulaNode right) implements FormulaNode {
    public BinaryOp {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
