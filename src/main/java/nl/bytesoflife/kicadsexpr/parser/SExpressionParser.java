package nl.bytesoflife.kicadsexpr.parser;

import nl.bytesoflife.kicadsexpr.lexer.SExpressionLexer;
import nl.bytesoflife.kicadsexpr.lexer.Token;
import nl.bytesoflife.kicadsexpr.lexer.TokenType;
import nl.bytesoflife.kicadsexpr.model.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Recursive descent parser turning a token stream into a single {@link SNode}.
 * <p>
 * Files holding several top-level expressions (design rules) must be wrapped
 * into one list by the caller before parsing. Parsing is all-or-nothing.
 */
public class SExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(SExpressionParser.class);

    public static final int DEFAULT_MAX_DEPTH = 512;

    private final int maxDepth;

    public SExpressionParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public SExpressionParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public SNode parse(String text) {
        long start = System.nanoTime();
        SNode node = parse(new SExpressionLexer().tokenize(text));
        if (log.isDebugEnabled()) {
            log.debug("Parsed {} characters in {}ms", text.length(), (System.nanoTime() - start) / 1_000_000);
        }
        return node;
    }

    public SNode parse(Iterator<Token> tokens) {
        if (!tokens.hasNext()) {
            throw new ParseException(ParseException.Kind.EMPTY_INPUT, "No expression in input", 0, 1, 1);
        }
        SNode root = parseNode(tokens.next(), tokens, 0);
        if (tokens.hasNext()) {
            Token extra = tokens.next();
            throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN,
                "Unexpected " + describe(extra) + " after the end of the expression", extra);
        }
        return root;
    }

    private SNode parseNode(Token token, Iterator<Token> tokens, int depth) {
        return switch (token.type()) {
            case OPEN_PAREN -> parseList(token, tokens, depth + 1);
            case CLOSE_PAREN -> throw new ParseException(ParseException.Kind.UNEXPECTED_TOKEN,
                "Unexpected ')' without matching '('", token);
            case SYMBOL -> new SNode.SSymbol(token.value());
            case QUOTED_STRING -> new SNode.SString(token.value());
            case NUMBER -> toNumber(token.value());
        };
    }

    private SNode.SList parseList(Token open, Iterator<Token> tokens, int depth) {
        if (depth > maxDepth) {
            throw new ParseException(ParseException.Kind.NESTING_TOO_DEEP,
                "Nesting deeper than " + maxDepth + " levels", open);
        }
        List<SNode> children = new ArrayList<>();
        while (tokens.hasNext()) {
            Token token = tokens.next();
            if (token.type() == TokenType.CLOSE_PAREN) {
                return new SNode.SList(children);
            }
            children.add(parseNode(token, tokens, depth));
        }
        throw new ParseException(ParseException.Kind.UNTERMINATED_LIST,
            "Unexpected end of input, expected ')' to close the list opened", open);
    }

    private static String describe(Token token) {
        return token.type() + " '" + token.value() + "'";
    }

    private static SNode toNumber(String raw) {
        if (raw.indexOf('.') >= 0 || raw.indexOf('e') >= 0 || raw.indexOf('E') >= 0) {
            return new SNode.SFloat(Double.parseDouble(raw));
        }
        try {
            return new SNode.SInteger(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            // Out of 64-bit range: keep the digits verbatim
            log.trace("Integer literal {} out of range, kept as symbol", raw);
            return new SNode.SSymbol(raw);
        }
    }
}
