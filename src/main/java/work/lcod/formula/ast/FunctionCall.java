package work.lcod.formula.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Call of a registered function. The name is stored upper-cased.
 */
public record FunctionCall(String name, List<FormulaNode> arguments) implements FormulaNode {
    public FunctionCall {
        Objects.requireNonNull(name, "name");
        name = name.toUpperCase(Locale.ROOT);
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(String::valueOf).collect(Collectors.joining(",", "(", ")"));
    }
}
