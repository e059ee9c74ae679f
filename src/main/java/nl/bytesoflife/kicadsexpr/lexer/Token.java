package nl.bytesoflife.kicadsexpr.lexer;

/**
 * A lexical token. For quoted strings {@code value} holds the text with escapes resolved;
 * for every other kind it is the raw source text.
 */
public record Token(TokenType type, String value, int offset, int line, int column) {

    @Override
    public String toString() {
        return type + "('" + value + "') at " + line + ":" + column;
    }
}
