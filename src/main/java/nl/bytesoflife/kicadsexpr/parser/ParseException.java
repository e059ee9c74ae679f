package nl.bytesoflife.kicadsexpr.parser;

import nl.bytesoflife.kicadsexpr.SExpressionException;
import nl.bytesoflife.kicadsexpr.lexer.Token;

public class ParseException extends SExpressionException {

    public enum Kind {
        UNEXPECTED_TOKEN,
        UNTERMINATED_LIST,
        EMPTY_INPUT,
        NESTING_TOO_DEEP
    }

    private final Kind kind;
    private final int line;
    private final int column;

    public ParseException(Kind kind, String message, int position, int line, int column) {
        super(message + " at line " + line + ", column " + column, position);
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    /**
     * Reports the problem at the given token.
     */
    public ParseException(Kind kind, String message, Token token) {
        this(kind, message, token.offset(), token.line(), token.column());
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
