package work.lcod.formula.parse;

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import work.lcod.formula.ast.BinaryOp;
import work.lcod.formula.ast.BinaryOperator;
import work.lcod.formula.ast.CellRef;
import work.lcod.formula.ast.Constant;
import work.lcod.formula.ast.FormulaNode;
import work.lcod.formula.ast.FunctionCall;
import work.lcod.formula.model.CellAddress;
import work.lcod.formula.parse.grammar.ExcelFormulaBaseVisitor;
import work.lcod.formula.parse.grammar.ExcelFormulaParser;

/**
 * Converts an ANTLR parse tree into the formula AST. Operator chains fold to the left.
 */
final class AstBuilder extends ExcelFormulaBaseVisitor<FormulaNode> {
    @Override
    public FormulaNode visitFormula(ExcelFormulaParser.FormulaContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public FormulaNode visitExpression(ExcelFormulaParser.ExpressionContext ctx) {
        return fold(ctx.additive(), ctx.comparisonOperator());
    }

    @Override
    public FormulaNode visitAdditive(ExcelFormulaParser.AdditiveContext ctx) {
        return fold(ctx.multiplicative(), ctx.additiveOperator());
    }

    @Override
    public FormulaNode visitMultiplicative(ExcelFormulaParser.MultiplicativeContext ctx) {
        return fold(ctx.unary(), ctx.multiplicativeOperator());
    }

    // the generated getters rescan the children on every call, so both lists are fetched once
    private FormulaNode fold(List<? extends ParserRuleContext> operands, List<? extends ParserRuleContext> operators) {
        FormulaNode node = visit(operands.get(0));
        for (int i = 0; i < operators.size(); i++) {
            var operator = BinaryOperator.fromSymbol(operators.get(i).getText());
            node = new BinaryOp(operator, node, visit(operands.get(i + 1)));
        }
        return node;
    }

    // -x is stored as 0 - x
    @Override
    public FormulaNode visitNegation(ExcelFormulaParser.NegationContext ctx) {
        return new BinaryOp(BinaryOperator.SUBTRACT, Constant.number(0.0), visit(ctx.unary()));
    }

    @Override
    public FormulaNode visitPrimary(ExcelFormulaParser.PrimaryContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public FormulaNode visitNumberLiteral(ExcelFormulaParser.NumberLiteralContext ctx) {
        return Constant.number(Double.parseDouble(ctx.NUMBER().getText()));
    }

    @Override
    public FormulaNode visitStringLiteral(ExcelFormulaParser.StringLiteralContext ctx) {
        String raw = ctx.STRING().getText();
        return new Constant(raw.substring(1, raw.length() - 1).replace("\"\"", "\""));
    }

    @Override
    public FormulaNode visitBooleanLiteral(ExcelFormulaParser.BooleanLiteralContext ctx) {
        return new Constant(ctx.TRUE() != null);
    }

    @Override
    public FormulaNode visitFunctionCall(ExcelFormulaParser.FunctionCallContext ctx) {
        List<FormulaNode> arguments = new ArrayList<>();
        if (ctx.arguments() != null) {
            for (var argument : ctx.arguments().expression()) {
                arguments.add(visit(argument));
            }
        }
        return new FunctionCall(ctx.functionName().getText(), arguments);
    }

    @Override
    public FormulaNode visitReference(ExcelFormulaParser.ReferenceContext ctx) {
        String address = CellAddress.canonicalize(ctx.CELL().getText());
        if (ctx.sheetPrefix() == null) {
            return new CellRef(address);
        }
        return new CellRef(sheetName(ctx.sheetPrefix().getStart()) + "!" + address);
    }

    @Override
    public FormulaNode visitParenthesized(ExcelFormulaParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    private static String sheetName(Token token) {
        String text = token.getText();
        if (token.getType() == ExcelFormulaParser.QUOTED_SHEET) {
            return text.substring(1, text.length() - 1).replace("''", "'");
        }
        return text;
    }
}
