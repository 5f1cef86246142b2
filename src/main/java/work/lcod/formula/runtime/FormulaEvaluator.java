package work.lcod.formula.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.formula.ast.BinaryOp;
import work.lcod.formula.ast.BinaryOperator;
import work.lcod.formula.ast.CellRef;
import work.lcod.formula.ast.Constant;
import work.lcod.formula.ast.FormulaNode;
import work.lcod.formula.ast.FunctionCall;

/**
 * Recursive tree-walk over a formula AST. Stateless apart from its registry and depth limit,
 * so one instance can serve concurrent passes that each own their {@link EvaluationContext}.
 */
public final class FormulaEvaluator {
    public static final int DEFAULT_MAX_DEPTH = 1024;

    private final FunctionRegistry registry;
    private final int maxDepth;

    public FormulaEvaluator() {
        this(FunctionRegistry.standard(), DEFAULT_MAX_DEPTH);
    }

    public FormulaEvaluator(FunctionRegistry registry) {
        this(registry, DEFAULT_MAX_DEPTH);
    }

    public FormulaEvaluator(FunctionRegistry registry, int maxDepth) {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public FunctionRegistry registry() {
        return registry;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public Object evaluate(FormulaNode node, EvaluationContext context) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(context, "context");
        return eval(node, context, 1);
    }

    private Object eval(FormulaNode node, EvaluationContext context, int depth) {
        if (depth > maxDepth) {
            throw new FormulaException(
                ErrorCode.DEPTH_EXCEEDED,
                "Formula nesting exceeds the maximum depth of " + maxDepth,
                maxDepth
            );
        }
        if (node instanceof Constant constant) {
            return constant.value();
        }
        if (node instanceof CellRef ref) {
            return Values.normalize(context.lookup(ref.key()));
        }
        if (node instanceof FunctionCall call) {
            return evalCall(call, context, depth);
        }
        if (node instanceof BinaryOp op) {
            Object left = eval(op.left(), context, depth + 1);
            Object right = eval(op.right(), context, depth + 1);
            return apply(op.operator(), left, right);
        }
        throw new IllegalStateException("Unsupported formula node: " + node.getClass().getName());
    }

    private Object evalCall(FunctionCall call, EvaluationContext context, int depth) {
        List<Object> arguments = new ArrayList<>(call.arguments().size());
        for (FormulaNode argument : call.arguments()) {
            arguments.add(eval(argument, context, depth + 1));
        }
        FormulaFunction fn = registry.find(call.name()).orElseThrow(() -> new FormulaException(
            ErrorCode.UNKNOWN_FUNCTION,
            "Unknown function: " + call.name(),
            call.name()
        ));
        return fn.invoke(arguments);
    }

    static Object apply(BinaryOperator operator, Object left, Object right) {
        if (operator.isComparison()) {
            int cmp = Values.compare(left, right);
            switch (operator) {
                case EQUAL:
                    return cmp == 0;
                case NOT_EQUAL:
                    return cmp != 0;
                case LESS:
                    return cmp < 0;
                case LESS_OR_EQUAL:
                    return cmp <= 0;
                case GREATER:
                    return cmp > 0;
                default:
                    return cmp >= 0;
            }
        }
        double result;
        switch (operator) {
            case ADD:
                result = additiveOperand(left) + additiveOperand(right);
                break;
            case SUBTRACT:
                result = additiveOperand(left) - additiveOperand(right);
                break;
            case MULTIPLY:
                result = Values.toNumber(left) * Values.toNumber(right);
                break;
            case DIVIDE:
                double dividend = Values.toNumber(left);
                double divisor = Values.toNumber(right);
                if (divisor == 0.0) {
                    throw new FormulaException(ErrorCode.DIVISION_BY_ZERO, "Division by zero");
                }
                result = dividend / divisor;
                break;
            default:
                throw new IllegalStateException("Unsupported operator: " + operator);
        }
        if (!Double.isFinite(result)) {
            throw new FormulaException(
                ErrorCode.TYPE_MISMATCH,
                "Arithmetic result is not a finite number for operator " + operator.symbol()
            );
        }
        return result;
    }

    // a blank operand counts as 0 for + and -; * and / require a real number
    private static double additiveOperand(Object value) {
        return Values.isBlank(value) ? 0.0 : Values.toNumber(value);
    }
}
