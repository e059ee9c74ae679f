package nl.bytesoflife.kicadsexpr.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Position identifier: {@code (at X Y [ANGLE])}, or {@code (offset (xyz X Y Z))} when {@code z} is set.
 */
public record Position(double x, double y, double angle, Double z) {

    public static final Position ORIGIN = new Position(0, 0);

    public Position(double x, double y) {
        this(x, y, 0.0, null);
    }

    public Position(double x, double y, double angle) {
        this(x, y, angle, null);
    }

    public static Position xyz(double x, double y, double z) {
        return new Position(x, y, 0.0, z);
    }

    public SNode.SList toNode(String token) {
        if (z != null) {
            return SNode.named(token, SNode.named("xyz", SNode.decimal(x), SNode.decimal(y), SNode.decimal(z)));
        }
        List<SNode> children = new ArrayList<>(4);
        children.add(SNode.symbol(token));
        children.add(SNode.decimal(x));
        children.add(SNode.decimal(y));
        if (angle != 0.0) {
            children.add(SNode.decimal(angle));
        }
        return new SNode.SList(children);
    }
}
