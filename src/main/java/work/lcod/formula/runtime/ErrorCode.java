package work.lcod.formula.runtime;

import java.util.Locale;

/**
 * Failure categories reported through {@link FormulaException}.
 */
public enum ErrorCode {
    SYNTAX_ERROR,
    UNKNOWN_FUNCTION,
    DIVISION_BY_ZERO,
    EMPTY_AGGREGATE,
    GRAPH_CYCLE,
    DEPTH_EXCEEDED,
    TYPE_MISMATCH,
    INVALID_ARGUMENTS;

    /** Lower-case form used in serialized results ({@code division_by_zero}). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
