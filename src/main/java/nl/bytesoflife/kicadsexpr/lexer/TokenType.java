package nl.bytesoflife.kicadsexpr.lexer;

public enum TokenType {
    OPEN_PAREN,
    CLOSE_PAREN,
    SYMBOL,
    QUOTED_STRING,
    NUMBER
}
