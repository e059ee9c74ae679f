package nl.bytesoflife.kicadsexpr.drc.parser;

import nl.bytesoflife.kicadsexpr.drc.model.*;
import nl.bytesoflife.kicadsexpr.model.SNode;
import nl.bytesoflife.kicadsexpr.parser.ParseException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KicadDruParserTest {

    private static String manufacturerRules;

    private final KicadDruParser parser = new KicadDruParser();

    @BeforeAll
    static void loadFixture() throws IOException {
        try (InputStream is = KicadDruParserTest.class.getResourceAsStream("/fixtures/manufacturer.kicad_dru")) {
            assertNotNull(is);
            manufacturerRules = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void parseManufacturerRulesEndToEnd() {
        DrcRuleSet ruleSet = parser.parse(manufacturerRules);

        assertEquals(1, ruleSet.getVersion());

        // The commented-out rule is not counted
        List<DrcRule> rules = ruleSet.getRules();
        assertEquals(6, rules.size());
        assertTrue(ruleSet.getRule("disabled rule").isEmpty());

        DrcRule outerTraceRule = rules.get(0);
        assertEquals("Minimum Trace Width and Spacing (outer layer)", outerTraceRule.getName());
        assertEquals(2, outerTraceRule.getConstraints().size());

        DrcConstraint trackWidth = outerTraceRule.getConstraints().get(0);
        assertEquals(ConstraintType.TRACK_WIDTH, trackWidth.getType());
        assertEquals(0.127, trackWidth.getMinMm(), 0.0001);
        assertNull(trackWidth.getMaxMm());

        DrcConstraint clearance = outerTraceRule.getConstraints().get(1);
        assertEquals(ConstraintType.CLEARANCE, clearance.getType());
        assertEquals(0.127, clearance.getMinMm(), 0.0001);

        assertEquals("A.Type == 'track'", outerTraceRule.getConditionExpression());
        assertNotNull(outerTraceRule.getLayer());
        assertTrue(outerTraceRule.getLayer().matches("F.Cu"));
        assertTrue(outerTraceRule.getLayer().matches("B.Cu"));
        assertFalse(outerTraceRule.getLayer().matches("In1.Cu"));
        assertFalse(outerTraceRule.hasExplicitSeverity());
        assertEquals(Severity.ERROR, outerTraceRule.getSeverity());
    }

    @Test
    void innerLayerRule() {
        DrcRule innerRule = parser.parse(manufacturerRules).getRules().get(1);
        assertTrue(innerRule.getLayer().matches("In1.Cu"));
        assertFalse(innerRule.getLayer().matches("F.Cu"));
        assertEquals(0.09, innerRule.getConstraints().get(0).getMinMm(), 0.0001);
    }

    @Test
    void parseHoleSizeWithMinAndMax() {
        DrcRule drillRule = parser.parse(manufacturerRules).getRules().get(2);
        assertEquals("drill hole size (mechanical)", drillRule.getName());
        DrcConstraint holeSize = drillRule.getConstraints().get(0);
        assertEquals(ConstraintType.HOLE_SIZE, holeSize.getType());
        assertEquals(0.15, holeSize.getMinMm(), 0.0001);
        assertEquals(6.3, holeSize.getMaxMm(), 0.0001);
    }

    @Test
    void parseRuleWithoutCondition() {
        DrcRule drillRule = parser.parse(manufacturerRules).getRules().get(2);
        assertNull(drillRule.getConditionExpression());
        assertNull(drillRule.getLayer());
    }

    @Test
    void parseSilkscreenRuleInMil() {
        DrcRule silkRule = parser.parse(manufacturerRules).getRule("Silkscreen clearance").orElseThrow();
        assertEquals(Severity.WARNING, silkRule.getSeverity());
        assertTrue(silkRule.hasExplicitSeverity());
        assertTrue(silkRule.getLayer().matches("F.Silkscreen"));
        assertTrue(silkRule.getLayer().matches("B.Silkscreen"));
        assertFalse(silkRule.getLayer().matches("F.Cu"));

        DrcConstraint silk = silkRule.getConstraints().get(0);
        assertEquals(ConstraintType.SILK_CLEARANCE, silk.getType());
        assertEquals(0.1524, silk.getMinMm(), 0.00001);
    }

    @Test
    void parseDisallowConstraint() {
        DrcRule rule = parser.parse(manufacturerRules).getRule("No buried vias").orElseThrow();
        DrcConstraint disallow = rule.getConstraints().get(0);
        assertEquals(ConstraintType.DISALLOW, disallow.getType());
        assertEquals(List.of("buried_via", "micro_via"), disallow.getDisallowed());
        assertNull(disallow.getMinMm());
    }

    @Test
    void unknownSeverityAndConstraintFallBack() {
        DrcRule rule = parser.parse(manufacturerRules).getRule("Future constraint").orElseThrow();
        assertEquals(Severity.ERROR, rule.getSeverity());
        assertEquals(1, rule.getConstraints().size());

        DrcConstraint via = rule.getConstraints().get(0);
        assertEquals(ConstraintType.VIA_DIAMETER, via.getType());
        assertEquals(0.45, via.getMinMm(), 0.0001);
        assertEquals(0.6, via.getOptMm(), 0.0001);
        assertNull(via.getMaxMm());
    }

    @Test
    void rulesWithConstraintType() {
        DrcRuleSet ruleSet = parser.parse(manufacturerRules);
        assertEquals(2, ruleSet.getRulesWithConstraint(ConstraintType.CLEARANCE).size());
        assertEquals(1, ruleSet.getRulesWithConstraint(ConstraintType.DISALLOW).size());
    }

    @Test
    void emptyAndCommentOnlyInput() {
        assertTrue(parser.parse("").getRules().isEmpty());
        assertTrue(parser.parse("# nothing here\n   # still nothing\n").getRules().isEmpty());
        assertEquals(1, parser.parse("# nothing here\n").getVersion());
    }

    @Test
    void ruleWithoutVersionKeepsDefault() {
        DrcRuleSet ruleSet = parser.parse("(rule x (constraint clearance (min 0.2)))");
        assertEquals(1, ruleSet.getVersion());
        assertEquals(0.2, ruleSet.getRules().get(0).getConstraints().get(0).getMinMm(), 0.0001);
    }

    @Test
    void unbalancedRuleFails() {
        assertThrows(ParseException.class, () -> parser.parse("(version 1)\n(rule \"x\" (constraint clearance (min 1mm))"));
    }

    @Test
    void stripCommentsKeepsRuleLines() {
        String stripped = KicadDruParser.stripComments("(version 1)\n\n# comment\n  # indented comment\n(rule a)\n");
        assertEquals("(version 1)\n(rule a)\n", stripped);
    }

    @Test
    void parseValueUnits() {
        assertEquals(0.2, KicadDruParser.parseValueMm(SNode.symbol("0.2mm")).orElseThrow(), 1e-9);
        assertEquals(0.2032, KicadDruParser.parseValueMm(SNode.symbol("8mil")).orElseThrow(), 1e-9);
        assertEquals(0.254, KicadDruParser.parseValueMm(SNode.symbol("0.01in")).orElseThrow(), 1e-9);
        assertEquals(0.5, KicadDruParser.parseValueMm(SNode.decimal(0.5)).orElseThrow(), 1e-9);
        assertEquals(3.0, KicadDruParser.parseValueMm(SNode.integer(3)).orElseThrow(), 1e-9);
        assertTrue(KicadDruParser.parseValueMm(SNode.symbol("wide")).isEmpty());
    }
}
