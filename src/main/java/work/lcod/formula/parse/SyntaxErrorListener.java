package work.lcod.formula.parse;

import java.util.LinkedHashMap;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import work.lcod.formula.runtime.ErrorCode;
import work.lcod.formula.runtime.FormulaException;

/**
 * Turns the first lexer or parser diagnostic into a {@link ErrorCode#SYNTAX_ERROR} failure
 * instead of letting ANTLR recover and print to stderr.
 */
final class SyntaxErrorListener extends BaseErrorListener {
    private final String formula;

    SyntaxErrorListener(String formula) {
        this.formula = formula;
    }

    @Override
    public void syntaxError(
        Recognizer<?, ?> recognizer,
        Object offendingSymbol,
        int line,
        int charPositionInLine,
        String msg,
        RecognitionException e
    ) {
        var data = new LinkedHashMap<String, Object>();
        data.put("formula", formula);
        data.put("line", line);
        data.put("column", charPositionInLine);
        throw new FormulaException(
            ErrorCode.SYNTAX_ERROR,
            "Invalid formula syntax at " + line + ":" + charPositionInLine + ": " + msg,
            data,
            e
        );
    }
}
