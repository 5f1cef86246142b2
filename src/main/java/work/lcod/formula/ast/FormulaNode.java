package work.lcod.formula.ast;

/**
 * Node of a parsed formula. Nodes are immutable once built and may be evaluated concurrently
 * against independent contexts.
 */
public sealed interface FormulaNode permits Constant, CellRef, FunctionCall, BinaryOp {
}
