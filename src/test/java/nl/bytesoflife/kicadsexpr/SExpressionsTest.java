package nl.bytesoflife.kicadsexpr;

import nl.bytesoflife.kicadsexpr.fields.SExprFields;
import nl.bytesoflife.kicadsexpr.lexer.TokenType;
import nl.bytesoflife.kicadsexpr.model.Position;
import nl.bytesoflife.kicadsexpr.model.SNode;
import nl.bytesoflife.kicadsexpr.model.Stroke;
import nl.bytesoflife.kicadsexpr.model.StrokeType;
import nl.bytesoflife.kicadsexpr.parser.ParseException;
import nl.bytesoflife.kicadsexpr.writer.RenderStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

import static nl.bytesoflife.kicadsexpr.model.SNode.*;
import static org.junit.jupiter.api.Assertions.*;

class SExpressionsTest {

    static String fixture(String name) throws IOException {
        try (InputStream is = SExpressionsTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(is, "missing fixture " + name);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"resistor.kicad_sym", "board.kicad_pcb"})
    void reproducesReferenceOutput(String name) throws IOException {
        String reference = fixture(name);
        assertEquals(reference, SExpressions.render(SExpressions.parse(reference)));
    }

    @Test
    void symbolLibraryEndsWithBlankLine() throws IOException {
        String rendered = SExpressions.render(SExpressions.parse(fixture("resistor.kicad_sym")));
        assertTrue(rendered.endsWith("\n)\n"));
    }

    @Test
    void fixtureFieldsAreReachable() throws IOException {
        SNode.SList board = (SNode.SList) SExpressions.parse(fixture("board.kicad_pcb"));
        assertEquals(1.6, SExprFields.getRequiredFloat(SExprFields.findToken(board, "general").orElseThrow(), "thickness"));
        assertEquals(2, SExprFields.findAllTokens(board, "net").size());

        SNode.SList footprint = SExprFields.findToken(board, "footprint").orElseThrow();
        assertEquals(new Position(10, 20, 90), SExprFields.getRequiredPosition(footprint, "at"));
        assertEquals(List.of("1", "2"), SExprFields.findAllTokens(footprint, "pad").stream()
                .map(pad -> SExprFields.safeGetStr(pad, 1, "")).toList());

        SNode.SList text = SExprFields.findToken(footprint, "fp_text").orElseThrow();
        assertTrue(SExprFields.hasSymbol(text, "hide"));

        SNode.SList line = SExprFields.findToken(footprint, "fp_line").orElseThrow();
        assertEquals(new Stroke(0.12, StrokeType.SOLID, null), SExprFields.getStrokeOrWidth(line, Stroke.DEFAULT_WIDTH));
        SNode.SList rect = SExprFields.findToken(board, "gr_rect").orElseThrow();
        assertEquals(new Stroke(0.1), SExprFields.getStrokeOrWidth(rect, Stroke.DEFAULT_WIDTH));
    }

    @Test
    void referenceLayoutHoistsTrailingFlags() throws IOException {
        String reference = fixture("board.kicad_pcb");
        String hoisted = SExpressions.render(SExpressions.parse(reference), RenderStrategy.reference());
        assertTrue(hoisted.contains("(fp_text reference \"R1\" hide\n"));

        SNode.SList text = SExprFields.findToken(
                SExprFields.findToken((SNode.SList) SExpressions.parse(hoisted), "footprint").orElseThrow(),
                "fp_text").orElseThrow();
        assertEquals(symbol("hide"), text.get(3));
    }

    static Stream<SNode> trees() {
        return Stream.of(
                named("net", integer(1), string("GND")),
                named("pts", named("xy", integer(0), integer(0)), named("xy", integer(10), integer(0))),
                named("at", decimal(2), decimal(-0.5), decimal(1e-5), decimal(1e7)),
                named("property", string("Reference"), string("R \"1\"\n"),
                        new Position(1.27, 0, 90).toNode("at"),
                        named("effects", named("font", named("size", decimal(1.27), decimal(1.27))), symbol("hide"))),
                named("kicad_symbol_lib", named("version", integer(20231120)), named("symbol", string("R"), list())),
                named("fp_text", symbol("reference"), named("at", integer(0), integer(0)), symbol("hide"), string("")),
                list(),
                list(list(), list(symbol("a"))),
                new Stroke(0.2, StrokeType.DASH_DOT, new Stroke.Color(0, 0.5, 1, 1)).toNode()
        );
    }

    @ParameterizedTest
    @MethodSource("trees")
    void roundTrip(SNode tree) {
        assertEquals(tree, SExpressions.parse(SExpressions.render(tree)));
    }

    @ParameterizedTest
    @MethodSource("trees")
    void renderIsIdempotent(SNode tree) {
        String once = SExpressions.render(tree);
        assertEquals(once, SExpressions.render(SExpressions.parse(once)));
    }

    @Test
    void integralFloatSurvivesRoundTrip() {
        String text = SExpressions.render(named("width", decimal(2)));
        assertEquals("(width 2.0)", text);
        SNode.SList parsed = (SNode.SList) SExpressions.parse(text);
        assertInstanceOf(SNode.SFloat.class, parsed.get(1));
    }

    @Test
    void singleLineCollapse() {
        SNode node = SExpressions.parse("(net 1 \"GND\")");
        assertEquals(list(symbol("net"), integer(1), string("GND")), node);
        assertEquals("(net 1 \"GND\")", SExpressions.render(node));
    }

    @Test
    void multiLineNesting() {
        SNode node = SExpressions.parse("(pts (xy 0 0) (xy 10 0))");
        String rendered = SExpressions.render(node);
        assertEquals("(pts\n\t(xy 0 0)\n\t(xy 10 0)\n)", rendered);
        assertEquals(node, SExpressions.parse(rendered));
    }

    @Test
    void unknownEscapeIsNormalisedOnce() {
        SNode node = SExpressions.parse("(a \"\\q\")");
        assertEquals(named("a", string("\\q")), node);

        String rendered = SExpressions.render(node);
        assertEquals("(a \"\\\\q\")", rendered);
        assertEquals(node, SExpressions.parse(rendered));
        assertEquals(rendered, SExpressions.render(SExpressions.parse(rendered)));
    }

    @Test
    void malformedInputFails() {
        ParseException e = assertThrows(ParseException.class, () -> SExpressions.parse("(kicad_pcb (version 1)"));
        assertEquals(ParseException.Kind.UNTERMINATED_LIST, e.getKind());
    }

    @Test
    void hundredLevelsDeep() {
        SNode node = symbol("leaf");
        for (int i = 0; i < 100; i++) {
            node = named("level", integer(i), node);
        }
        String rendered = SExpressions.render(node);
        assertEquals(node, SExpressions.parse(rendered));
        assertEquals(rendered, SExpressions.render(SExpressions.parse(rendered)));
    }

    @Test
    void hundredLevelsDeepOfNestedLists() {
        String input = "(".repeat(100) + ")".repeat(100);
        SNode node = SExpressions.parse(input);
        String rendered = SExpressions.render(node);
        assertEquals(node, SExpressions.parse(rendered));
    }

    @Test
    void rebuildingATreeLeavesTheOriginalUntouched() {
        SNode.SList original = (SNode.SList) SExpressions.parse("(footprint \"R\" (at 1 2) (layer \"F.Cu\"))");
        SNode.SList moved = new SNode.SList(original.children().stream()
                .map(child -> child instanceof SNode.SList token && SExprFields.isToken(token, "at")
                        ? new Position(5, 6).toNode("at")
                        : child)
                .toList());

        assertEquals("(footprint \"R\"\n\t(at 5.0 6.0)\n\t(layer \"F.Cu\")\n)", SExpressions.render(moved));
        assertEquals(named("at", integer(1), integer(2)), original.get(2));
    }

    @Test
    void tokenizeIsExposed() {
        assertEquals(TokenType.OPEN_PAREN, SExpressions.tokenize("(a)").next().type());
    }
}
