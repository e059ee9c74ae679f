package nl.bytesoflife.kicadsexpr.lexer;

import nl.bytesoflife.kicadsexpr.SExpressionException;

public class SyntaxException extends SExpressionException {

    public enum Kind {
        UNTERMINATED_STRING,
        INVALID_CHARACTER
    }

    private final Kind kind;
    private final int line;
    private final int column;

    public SyntaxException(Kind kind, String message, int position, int line, int column) {
        super(message + " at line " + line + ", column " + column, position);
        this.kind = kind;
        this.line = line;
        this.column = column;
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
