package nl.bytesoflife.kicadsexpr.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outline style of a graphic item: {@code (stroke (width W) (type T) (color R G B A))}.
 * A {@code null} color means the item uses the default color.
 */
public record Stroke(double width, StrokeType type, Color color) {

    public static final double DEFAULT_WIDTH = 0.254;

    public Stroke(double width) {
        this(width, StrokeType.SOLID, null);
    }

    public SNode.SList toNode() {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.symbol("stroke"));
        children.add(SNode.named("width", SNode.decimal(width)));
        if (type != StrokeType.SOLID) {
            children.add(SNode.named("type", SNode.symbol(type.token())));
        }
        if (color != null) {
            children.add(SNode.named("color",
                    SNode.decimal(color.r()), SNode.decimal(color.g()),
                    SNode.decimal(color.b()), SNode.decimal(color.a())));
        }
        return new SNode.SList(children);
    }

    public record Color(double r, double g, double b, double a) {
    }
}
