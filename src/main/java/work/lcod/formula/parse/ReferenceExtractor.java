package work.lcod.formula.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.formula.ast.BinaryOp;
import work.lcod.formula.ast.CellRef;
import work.lcod.formula.ast.FormulaNode;
import work.lcod.formula.ast.FunctionCall;
import work.lcod.formula.model.SheetCatalog;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaEvaluator;
import work.lcod.formula.runtime.FormulaException;

/**
 * Finds the cell and range references of a formula by walking its AST, so function names
 * are never taken for references. Keys come back canonical: {@code Sheet!Addr} when the formula
 * names a sheet, bare {@code Addr} otherwise.
 */
public final class ReferenceExtractor {
    private final FormulaParser parser;
    private final int maxDepth;

    public ReferenceExtractor() {
        this(new FormulaParser());
    }

    public ReferenceExtractor(FormulaParser parser) {
        this(parser, FormulaEvaluator.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth deepest tree {@link #resolveSheets} rewrites before failing with
     *     {@link ErrorCode#DEPTH_EXCEEDED}
     */
    public ReferenceExtractor(FormulaParser parser, int maxDepth) {
        this.parser = Objects.requireNonNull(parser, "parser");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /** Distinct references in first-occurrence order. */
    public static Set<String> extractReferences(String formulaText, SheetCatalog catalog) {
        return new LinkedHashSet<>(new ReferenceExtractor().collect(formulaText, catalog));
    }

    /** Every reference occurrence in source order; duplicates are kept. */
    public static List<String> collectReferences(String formulaText, SheetCatalog catalog) {
        return new ReferenceExtractor().collect(formulaText, catalog);
    }

    public List<String> collect(String formulaText, SheetCatalog catalog) {
        return collect(parser.parse(formulaText), catalog);
    }

    public List<String> collect(FormulaNode root, SheetCatalog catalog) {
        List<String> references = new ArrayList<>();
        Deque<FormulaNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            FormulaNode node = pending.pop();
            if (node instanceof CellRef ref) {
                references.add(canonical(ref.key(), catalog));
            } else if (node instanceof BinaryOp op) {
                pending.push(op.right());
                pending.push(op.left());
            } else if (node instanceof FunctionCall call) {
                for (int i = call.arguments().size() - 1; i >= 0; i--) {
                    pending.push(call.arguments().get(i));
                }
            }
        }
        return references;
    }

    /**
     * Rewrites sheet prefixes to the catalog's spelling ({@code sheet1!A1} becomes {@code Sheet1!A1})
     * so the keys of the tree match the keys of the dependency graph.
     *
     * @throws FormulaException {@link ErrorCode#DEPTH_EXCEEDED} when the tree is deeper than {@code maxDepth}
     */
    public FormulaNode resolveSheets(FormulaNode node, SheetCatalog catalog) {
        return resolveSheets(node, catalog, 1);
    }

    // a flat operator chain nests one level per operator, which the parser does not bound
    private FormulaNode resolveSheets(FormulaNode node, SheetCatalog catalog, int depth) {
        if (depth > maxDepth) {
            throw new FormulaException(
                ErrorCode.DEPTH_EXCEEDED,
                "Formula nesting exceeds the maximum depth of " + maxDepth,
                maxDepth
            );
        }
        if (node instanceof CellRef ref) {
            String key = canonical(ref.key(), catalog);
            return key.equals(ref.key()) ? ref : new CellRef(key);
        }
        if (node instanceof BinaryOp op) {
            return new BinaryOp(
                op.operator(),
                resolveSheets(op.left(), catalog, depth + 1),
                resolveSheets(op.right(), catalog, depth + 1)
            );
        }
        if (node instanceof FunctionCall call) {
            List<FormulaNode> arguments = new ArrayList<>(call.arguments().size());
            for (FormulaNode argument : call.arguments()) {
                arguments.add(resolveSheets(argument, catalog, depth + 1));
            }
            return new FunctionCall(call.name(), arguments);
        }
        return node;
    }

    private static String canonical(String key, SheetCatalog catalog) {
        int bang = key.lastIndexOf('!');
        if (bang < 0 || catalog == null) {
            return key;
        }
        String sheet = key.substring(0, bang);
        return catalog.resolveSheetName(sheet).orElse(sheet) + key.substring(bang);
    }
}
