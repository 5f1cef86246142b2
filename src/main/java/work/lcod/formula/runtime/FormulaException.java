package work.lcod.formula.runtime;

import java.util.Objects;

/**
 * Exception carrying a formula error code and optional data (cycle path, offending name, ...).
 */
public final class FormulaException extends RuntimeException {
    private final ErrorCode code;
    private final Object data;

    public FormulaException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public FormulaException(ErrorCode code, String message, Object data) {
        this(code, message, data, null);
    }

    public FormulaException(ErrorCode code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.data = data;
    }

    public ErrorCode code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
