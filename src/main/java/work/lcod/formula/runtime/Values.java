package work.lcod.formula.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Coercion rules shared by the evaluator and the built-in functions.
 */
public final class Values {
    private Values() {}

    public static boolean isBlank(Object value) {
        return value == null || value == Blank.INSTANCE;
    }

    /**
     * Normalizes a host value (context entry, catalog constant) into a formula scalar:
     * numbers become {@link Double}, {@code null} becomes {@link Blank}.
     */
    public static Object normalize(Object value) {
        if (value == null) {
            return Blank.INSTANCE;
        }
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (Object item : list) {
                copy.add(normalize(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * Numeric view of a scalar: numbers as-is, booleans as 1/0, numeric strings parsed.
     *
     * @throws FormulaException {@link ErrorCode#TYPE_MISMATCH} for blanks and non-numeric values
     */
    public static double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1.0 : 0.0;
        }
        if (value instanceof String str) {
            try {
                return Double.parseDouble(str.trim());
            } catch (NumberFormatException ex) {
                throw new FormulaException(ErrorCode.TYPE_MISMATCH, "Text is not a number: \"" + str + "\"", str, ex);
            }
        }
        if (isBlank(value)) {
            throw new FormulaException(ErrorCode.TYPE_MISMATCH, "Blank value used where a number is required");
        }
        throw new FormulaException(ErrorCode.TYPE_MISMATCH, "Value is not a number: " + value, String.valueOf(value));
    }

    public static boolean isTruthy(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof String str) {
            return !str.isEmpty();
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        return false;
    }

    /**
     * Spreadsheet ordering: numbers before text before booleans; text compares case-insensitively.
     * A blank takes the neutral value of the other operand's kind.
     */
    public static int compare(Object left, Object right) {
        Object l = isBlank(left) ? neutralFor(right) : left;
        Object r = isBlank(right) ? neutralFor(left) : right;
        int lRank = rank(l);
        int rRank = rank(r);
        if (lRank != rRank) {
            return Integer.compare(lRank, rRank);
        }
        if (l instanceof Number ln && r instanceof Number rn) {
            return Double.compare(ln.doubleValue(), rn.doubleValue());
        }
        if (l instanceof String ls && r instanceof String rs) {
            return ls.toLowerCase(Locale.ROOT).compareTo(rs.toLowerCase(Locale.ROOT));
        }
        if (l instanceof Boolean lb && r instanceof Boolean rb) {
            return Boolean.compare(lb, rb);
        }
        throw new FormulaException(ErrorCode.TYPE_MISMATCH, "Values cannot be compared: " + l + ", " + r);
    }

    private static Object neutralFor(Object other) {
        if (other instanceof String) {
            return "";
        }
        if (other instanceof Boolean) {
            return Boolean.FALSE;
        }
        return 0.0;
    }

    private static int rank(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof String) {
            return 1;
        }
        if (value instanceof Boolean) {
            return 2;
        }
        return 3;
    }
}
