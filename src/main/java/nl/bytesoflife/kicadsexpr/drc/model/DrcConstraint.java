package nl.bytesoflife.kicadsexpr.drc.model;

import java.util.List;

/**
 * A single {@code (constraint ...)} clause. Limits are in millimetres, or plain numbers for
 * {@link ConstraintType#isUnitless() unitless} types, and {@code null} when absent;
 * a {@link ConstraintType#DISALLOW} constraint carries the disallowed item types instead.
 */
public class DrcConstraint {

    private final ConstraintType type;
    private final Double minMm;
    private final Double optMm;
    private final Double maxMm;
    private final List<String> disallowed;

    public DrcConstraint(ConstraintType type, Double minMm, Double maxMm) {
        this(type, minMm, null, maxMm);
    }

    public DrcConstraint(ConstraintType type, Double minMm, Double optMm, Double maxMm) {
        this.type = type;
        this.minMm = minMm;
        this.optMm = optMm;
        this.maxMm = maxMm;
        this.disallowed = List.of();
    }

    private DrcConstraint(List<String> disallowed) {
        this.type = ConstraintType.DISALLOW;
        this.minMm = null;
        this.optMm = null;
        this.maxMm = null;
        this.disallowed = List.copyOf(disallowed);
    }

    public static DrcConstraint disallow(List<String> itemTypes) {
        return new DrcConstraint(itemTypes);
    }

    public ConstraintType getType() {
        return type;
    }

    public Double getMinMm() {
        return minMm;
    }

    public Double getOptMm() {
        return optMm;
    }

    public Double getMaxMm() {
        return maxMm;
    }

    public List<String> getDisallowed() {
        return disallowed;
    }

    @Override
    public String toString() {
        if (type == ConstraintType.DISALLOW) {
            return "disallow " + String.join(" ", disallowed);
        }
        String unit = type.isUnitless() ? "" : "mm";
        StringBuilder sb = new StringBuilder(type.token());
        if (minMm != null) sb.append(" min=").append(minMm).append(unit);
        if (optMm != null) sb.append(" opt=").append(optMm).append(unit);
        if (maxMm != null) sb.append(" max=").append(maxMm).append(unit);
        return sb.toString();
    }
}
