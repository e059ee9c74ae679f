package nl.bytesoflife.kicadsexpr;

import nl.bytesoflife.kicadsexpr.lexer.SExpressionLexer;
import nl.bytesoflife.kicadsexpr.model.SNode;
import nl.bytesoflife.kicadsexpr.parser.SExpressionParser;
import nl.bytesoflife.kicadsexpr.writer.RenderStrategy;
import nl.bytesoflife.kicadsexpr.writer.SExpressionWriter;

/**
 * Entry points for reading and writing KiCad S-expression text.
 */
public final class SExpressions {

    private static final SExpressionWriter KICAD_WRITER = new SExpressionWriter();

    private SExpressions() {
    }

    /**
     * @throws nl.bytesoflife.kicadsexpr.lexer.SyntaxException on malformed tokens
     * @throws nl.bytesoflife.kicadsexpr.parser.ParseException on unbalanced or empty input
     */
    public static SNode parse(String text) {
        return new SExpressionParser().parse(text);
    }

    public static SExpressionLexer.TokenStream tokenize(String text) {
        return new SExpressionLexer().tokenize(text);
    }

    public static String render(SNode node) {
        return KICAD_WRITER.render(node);
    }

    public static String render(SNode node, RenderStrategy strategy) {
        return new SExpressionWriter(strategy).render(node);
    }
}
