package work.lcod.formula.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.formula.runtime.FormulaEvaluator;

/**
 * Immutable settings of a {@link WorkbookCalculator} run.
 *
 * @param maxDepth recursion limit for parsing and evaluation
 * @param keepGoing record failing cells and continue instead of aborting on the first failure
 * @param includeConstants list constant cells next to the computed formula cells in the result
 * @param logLevel threshold applied by the command line before logging starts
 */
public record CalculatorConfiguration(int maxDepth, boolean keepGoing, boolean includeConstants, LogLevel logLevel) {
    public CalculatorConfiguration {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static CalculatorConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = FormulaEvaluator.DEFAULT_MAX_DEPTH;
        private boolean keepGoing;
        private boolean includeConstants;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder keepGoing(boolean keepGoing) {
            this.keepGoing = keepGoing;
            return this;
        }

        public Builder includeConstants(boolean includeConstants) {
            this.includeConstants = includeConstants;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        /**
         * Applies the {@code [calculator]} table of a TOML file
         * ({@code max_depth}, {@code keep_going}, {@code include_constants}, {@code log_level}).
         */
        public Builder fromToml(Path path) {
            TomlParseResult result;
            try {
                result = Toml.parse(path);
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to read configuration: " + path, ex);
            }
            if (result.hasErrors()) {
                throw new IllegalArgumentException("Invalid configuration " + path + ": " + result.errors().get(0));
            }
            return fromToml(result);
        }

        public Builder fromToml(String text) {
            TomlParseResult result = Toml.parse(text);
            if (result.hasErrors()) {
                throw new IllegalArgumentException("Invalid configuration: " + result.errors().get(0));
            }
            return fromToml(result);
        }

        private Builder fromToml(TomlParseResult result) {
            TomlTable table = result.getTable("calculator");
            if (table == null) {
                return this;
            }
            try {
                Long depth = table.getLong("max_depth");
                if (depth != null) {
                    maxDepth(Math.toIntExact(depth));
                }
                Boolean keep = table.getBoolean("keep_going");
                if (keep != null) {
                    keepGoing(keep);
                }
                Boolean constants = table.getBoolean("include_constants");
                if (constants != null) {
                    includeConstants(constants);
                }
                String level = table.getString("log_level");
                if (level != null) {
                    logLevel(LogLevel.from(level));
                }
            } catch (TomlInvalidTypeException | ArithmeticException ex) {
                throw new IllegalArgumentException("Invalid [calculator] setting: " + ex.getMessage(), ex);
            }
            return this;
        }

        public CalculatorConfiguration build() {
            return new CalculatorConfiguration(maxDepth, keepGoing, includeConstants, logLevel);
        }
    }
}
