package nl.bytesoflife.kicadsexpr.drc.parser;

import nl.bytesoflife.kicadsexpr.drc.model.*;
import nl.bytesoflife.kicadsexpr.fields.Coercions;
import nl.bytesoflife.kicadsexpr.fields.SExprFields;
import nl.bytesoflife.kicadsexpr.lexer.SExpressionLexer;
import nl.bytesoflife.kicadsexpr.model.SNode;
import nl.bytesoflife.kicadsexpr.parser.SExpressionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads KiCad custom design rule files (.kicad_dru).
 * <p>
 * These files hold several top-level expressions and {@code #} comment lines, so the
 * comments are stripped and the remainder is wrapped in one list before parsing.
 */
public class KicadDruParser {

    private static final Logger log = LoggerFactory.getLogger(KicadDruParser.class);

    private final SExpressionParser sexprParser = new SExpressionParser();

    public DrcRuleSet parse(String content) {
        String body = stripComments(content);
        if (body.isBlank()) {
            return new DrcRuleSet();
        }
        SNode root = sexprParser.parse("(" + body + "\n)");
        DrcRuleSet ruleSet = buildRuleSet((SNode.SList) root);
        log.debug("Read {} design rules (version {})", ruleSet.getRules().size(), ruleSet.getVersion());
        return ruleSet;
    }

    /**
     * Drops every line whose first non-blank character is '#'.
     */
    public static String stripComments(String content) {
        StringBuilder sb = new StringBuilder();
        for (String line : content.split("\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private DrcRuleSet buildRuleSet(SNode.SList root) {
        DrcRuleSet ruleSet = new DrcRuleSet();

        for (SNode node : root.children()) {
            if (!(node instanceof SNode.SList list)) {
                continue;
            }
            if (SExprFields.isToken(list, "version")) {
                ruleSet.setVersion(SExprFields.safeGetInt(list, 1, ruleSet.getVersion()));
            } else if (SExprFields.isToken(list, "rule")) {
                ruleSet.addRule(parseRule(list));
            } else {
                log.warn("Ignoring unknown top-level token '{}'", list.head().orElse(""));
            }
        }

        return ruleSet;
    }

    private DrcRule parseRule(SNode.SList list) {
        DrcRule rule = new DrcRule(SExprFields.safeGetStr(list, 1, ""));

        for (int i = 2; i < list.size(); i++) {
            if (!(list.get(i) instanceof SNode.SList clause)) {
                continue;
            }
            String tag = clause.head().orElse("");
            switch (tag) {
                case "constraint" -> parseConstraint(clause).ifPresent(rule::addConstraint);
                case "severity" -> rule.setSeverity(SExprFields.getValue(clause, 1)
                        .map(v -> SExprFields.parseEnum(v, Severity.class, Severity.ERROR))
                        .orElse(Severity.ERROR));
                case "layer" -> rule.setLayer(new LayerSelector(SExprFields.safeGetStr(clause, 1, "")));
                case "condition" -> rule.setConditionExpression(SExprFields.safeGetStr(clause, 1, ""));
                default -> log.warn("Ignoring unknown clause '{}' in rule '{}'", tag, rule.getName());
            }
        }

        return rule;
    }

    private Optional<DrcConstraint> parseConstraint(SNode.SList list) {
        ConstraintType type = SExprFields.getValue(list, 1)
                .map(v -> SExprFields.parseEnum(v, ConstraintType.class, null))
                .orElse(null);
        if (type == null) {
            log.warn("Skipping constraint of unknown type '{}'", SExprFields.safeGetStr(list, 1, ""));
            return Optional.empty();
        }

        if (type == ConstraintType.DISALLOW) {
            // (constraint disallow buried_via micro_via)
            List<String> items = new ArrayList<>();
            for (int i = 2; i < list.size(); i++) {
                Coercions.toStr(list.get(i)).ifPresent(items::add);
            }
            return Optional.of(DrcConstraint.disallow(items));
        }

        Double minMm = limit(list, "min");
        Double optMm = limit(list, "opt");
        Double maxMm = limit(list, "max");
        return Optional.of(new DrcConstraint(type, minMm, optMm, maxMm));
    }

    private static Double limit(SNode.SList constraint, String name) {
        return SExprFields.findToken(constraint, name)
                .flatMap(token -> SExprFields.getValue(token, 1))
                .flatMap(KicadDruParser::parseValueMm)
                .orElse(null);
    }

    /**
     * Converts {@code 0.2mm}, {@code 8mil}, {@code 0.01in} or a bare number (millimetres, or a count
     * for unitless constraint types).
     */
    static Optional<Double> parseValueMm(SNode value) {
        if (value instanceof SNode.SInteger || value instanceof SNode.SFloat) {
            return Coercions.toDouble(value);
        }
        String text = Coercions.toStr(value).orElse("").trim();
        double scale = 1.0;
        if (text.endsWith("mm")) {
            text = text.substring(0, text.length() - 2);
        } else if (text.endsWith("mil")) {
            text = text.substring(0, text.length() - 3);
            scale = 0.0254;
        } else if (text.endsWith("in")) {
            text = text.substring(0, text.length() - 2);
            scale = 25.4;
        }
        if (!SExpressionLexer.isNumber(text)) {
            log.warn("Unreadable constraint value '{}'", value);
            return Optional.empty();
        }
        return Optional.of(Double.parseDouble(text) * scale);
    }
}
