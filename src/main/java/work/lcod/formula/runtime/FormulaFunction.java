package work.lcod.formula.runtime;

import java.util.List;

/**
 * Built-in spreadsheet function. Receives its arguments already evaluated, left to right.
 */
@FunctionalInterface
public interface FormulaFunction {
    Object invoke(List<Object> arguments);
}
