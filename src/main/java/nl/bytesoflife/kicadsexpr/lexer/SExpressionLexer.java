package nl.bytesoflife.kicadsexpr.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Lexer for KiCad S-expression text.
 * Produces tokens lazily; a stream cannot be rewound, tokenize again to start over.
 */
public class SExpressionLexer {

    // Optional sign, digits with optional fraction (or a bare fraction), optional exponent
    private static final Pattern NUMBER = Pattern.compile(
        "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    public TokenStream tokenize(String content) {
        return new TokenStream(content);
    }

    public List<Token> tokenizeAll(String content) {
        List<Token> tokens = new ArrayList<>();
        tokenize(content).forEachRemaining(tokens::add);
        return tokens;
    }

    /**
     * True when {@code text} is a complete numeric literal.
     */
    public static boolean isNumber(String text) {
        return NUMBER.matcher(text).matches();
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == '"' || isWhitespace(c);
    }

    public static class TokenStream implements Iterator<Token> {

        private final String input;
        private int pos;
        private int line = 1;
        private int column = 1;
        private Token next;

        TokenStream(String input) {
            this.input = input;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = readToken();
            }
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more tokens");
            }
            Token token = next;
            next = null;
            return token;
        }

        private Token readToken() {
            skipWhitespace();
            if (pos >= input.length()) {
                return null;
            }
            int start = pos;
            int startLine = line;
            int startColumn = column;
            char c = input.charAt(pos);
            if (c == '(') {
                advance();
                return new Token(TokenType.OPEN_PAREN, "(", start, startLine, startColumn);
            }
            if (c == ')') {
                advance();
                return new Token(TokenType.CLOSE_PAREN, ")", start, startLine, startColumn);
            }
            if (c == '"') {
                return readQuotedString(start, startLine, startColumn);
            }
            return readBareToken(start, startLine, startColumn);
        }

        private Token readQuotedString(int start, int startLine, int startColumn) {
            advance();
            StringBuilder sb = new StringBuilder();
            while (pos < input.length()) {
                char c = advance();
                if (c == '"') {
                    return new Token(TokenType.QUOTED_STRING, sb.toString(), start, startLine, startColumn);
                }
                if (c == '\\' && pos < input.length()) {
                    char escaped = advance();
                    switch (escaped) {
                        case '"', '\\' -> sb.append(escaped);
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        default -> sb.append('\\').append(escaped);
                    }
                } else {
                    sb.append(c);
                }
            }
            throw new SyntaxException(SyntaxException.Kind.UNTERMINATED_STRING,
                "Unterminated quoted string", start, startLine, startColumn);
        }

        private Token readBareToken(int start, int startLine, int startColumn) {
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (isDelimiter(c)) {
                    break;
                }
                if (Character.isISOControl(c)) {
                    throw new SyntaxException(SyntaxException.Kind.INVALID_CHARACTER,
                        String.format("Invalid character U+%04X", (int) c), pos, line, column);
                }
                advance();
            }
            String raw = input.substring(start, pos);
            TokenType type = isNumber(raw) ? TokenType.NUMBER : TokenType.SYMBOL;
            return new Token(type, raw, start, startLine, startColumn);
        }

        private void skipWhitespace() {
            while (pos < input.length() && isWhitespace(input.charAt(pos))) {
                advance();
            }
        }

        private char advance() {
            char c = input.charAt(pos++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }
    }
}
