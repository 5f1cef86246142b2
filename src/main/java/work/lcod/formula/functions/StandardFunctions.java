package work.lcod.formula.functions;

import java.util.ArrayList;
import java.util.List;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;
import work.lcod.formula.runtime.FunctionRegistry;
import work.lcod.formula.runtime.Values;

/**
 * Built-in spreadsheet functions.
 *
 * <p>Aggregates flatten their input when called with exactly one list argument (an opaque range
 * resolved by the caller) and skip blanks. {@code SUM} and {@code AVERAGE} return 0 for empty
 * input; {@code MIN} and {@code MAX} have no identity element and fail with
 * {@link ErrorCode#EMPTY_AGGREGATE} instead.
 */
public final class StandardFunctions {
    private StandardFunctions() {}

    public static FunctionRegistry.Builder register(FunctionRegistry.Builder registry) {
        registry.register("SUM", StandardFunctions::sum);
        registry.register("AVERAGE", StandardFunctions::average);
        registry.register("MIN", StandardFunctions::min);
        registry.register("MAX", StandardFunctions::max);
        registry.register("IF", StandardFunctions::ifFunction);
        return registry;
    }

    private static Object sum(List<Object> arguments) {
        double total = 0.0;
        for (double value : numbers(arguments)) {
            total += value;
        }
        return total;
    }

    private static Object average(List<Object> arguments) {
        List<Double> values = numbers(arguments);
        if (values.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (double value : values) {
            total += value;
        }
        return total / values.size();
    }

    private static Object min(List<Object> arguments) {
        List<Double> values = numbers(arguments);
        if (values.isEmpty()) {
            throw new FormulaException(ErrorCode.EMPTY_AGGREGATE, "MIN requires at least one value", "MIN");
        }
        double result = values.get(0);
        for (double value : values) {
            result = Math.min(result, value);
        }
        return result;
    }

    private static Object max(List<Object> arguments) {
        List<Double> values = numbers(arguments);
        if (values.isEmpty()) {
            throw new FormulaException(ErrorCode.EMPTY_AGGREGATE, "MAX requires at least one value", "MAX");
        }
        double result = values.get(0);
        for (double value : values) {
            result = Math.max(result, value);
        }
        return result;
    }

    // both branches arrive already evaluated
    private static Object ifFunction(List<Object> arguments) {
        if (arguments.size() < 2 || arguments.size() > 3) {
            throw new FormulaException(
                ErrorCode.INVALID_ARGUMENTS,
                "IF expects 2 or 3 arguments but got " + arguments.size(),
                "IF"
            );
        }
        if (Values.isTruthy(arguments.get(0))) {
            return arguments.get(1);
        }
        return arguments.size() == 3 ? arguments.get(2) : Boolean.FALSE;
    }

    private static List<Double> numbers(List<Object> arguments) {
        List<?> source = arguments;
        if (arguments.size() == 1 && arguments.get(0) instanceof List<?> only) {
            source = only;
        }
        List<Double> numbers = new ArrayList<>(source.size());
        for (Object value : source) {
            if (Values.isBlank(value)) {
                continue;
            }
            numbers.add(Values.toNumber(value));
        }
        return numbers;
    }
}
