package work.lcod.formula.parse;

import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import work.lcod.formula.ast.FormulaNode;
import work.lcod.formula.parse.grammar.ExcelFormulaLexer;
import work.lcod.formula.parse.grammar.ExcelFormulaParser;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;

/**
 * Parses formula text ({@code =SUM(A1, Sheet2!B2) * 2}) into a {@link FormulaNode} tree.
 *
 * <p>Leading {@code =} characters are stripped. Parsing is deterministic and keeps no state,
 * so a single instance may be shared across threads.
 */
public final class FormulaParser {
    public static final int DEFAULT_MAX_NESTING = 256;

    private static final FormulaParser DEFAULT = new FormulaParser();

    private final int maxNesting;

    public FormulaParser() {
        this(DEFAULT_MAX_NESTING);
    }

    public FormulaParser(int maxNesting) {
        if (maxNesting < 1) {
            throw new IllegalArgumentException("maxNesting must be positive: " + maxNesting);
        }
        this.maxNesting = maxNesting;
    }

    public static FormulaNode parseFormula(String text) {
        return DEFAULT.parse(text);
    }

    public FormulaNode parse(String text) {
        Objects.requireNonNull(text, "text");
        String body = stripLeadingEquals(text);
        checkNesting(body);

        var listener = new SyntaxErrorListener(text);
        var lexer = new ExcelFormulaLexer(CharStreams.fromString(body));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        var parser = new ExcelFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        return new AstBuilder().visit(parser.formula());
    }

    static String stripLeadingEquals(String text) {
        int start = 0;
        while (start < text.length() && text.charAt(start) == '=') {
            start++;
        }
        return text.substring(start);
    }

    // ANTLR descends once per parenthesis or unary minus; reject pathological input before it does
    private void checkNesting(String body) {
        int parens = 0;
        int minusRun = 0;
        int deepest = 0;
        char quote = 0;
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (Character.isWhitespace(ch)) {
                continue;
            }
            if (ch == '/' && i + 1 < body.length() && body.charAt(i + 1) == '/') {
                int newline = body.indexOf('\n', i);
                i = newline < 0 ? body.length() : newline;
                continue;
            }
            if (ch == '-') {
                minusRun++;
            } else {
                minusRun = 0;
                if (ch == '(') {
                    parens++;
                } else if (ch == ')') {
                    parens = Math.max(0, parens - 1);
                } else if (ch == '"' || ch == '\'') {
                    quote = ch;
                }
            }
            deepest = Math.max(deepest, parens + minusRun);
        }
        if (deepest > maxNesting) {
            throw new FormulaException(
                ErrorCode.DEPTH_EXCEEDED,
                "Formula nesting exceeds the maximum depth of " + maxNesting,
                maxNesting
            );
        }
    }
}
