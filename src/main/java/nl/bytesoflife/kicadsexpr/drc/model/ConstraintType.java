package nl.bytesoflife.kicadsexpr.drc.model;

import nl.bytesoflife.kicadsexpr.model.KicadToken;

public enum ConstraintType implements KicadToken {
    CLEARANCE("clearance"),
    TRACK_WIDTH("track_width"),
    HOLE_SIZE("hole_size"),
    HOLE_TO_HOLE("hole_to_hole"),
    EDGE_CLEARANCE("edge_clearance"),
    ANNULAR_WIDTH("annular_width"),
    SILK_CLEARANCE("silk_clearance"),
    TEXT_HEIGHT("text_height"),
    TEXT_THICKNESS("text_thickness"),
    VIA_DIAMETER("via_diameter"),
    HOLE_CLEARANCE("hole_clearance"),
    COURTYARD_CLEARANCE("courtyard_clearance"),
    LENGTH("length"),
    SKEW("skew"),
    ZONE_CONNECTION("zone_connection"),
    THERMAL_RELIEF_GAP("thermal_relief_gap"),
    THERMAL_SPOKE_WIDTH("thermal_spoke_width"),
    MIN_RESOLVED_SPOKES("min_resolved_spokes", true),
    DISALLOW("disallow");

    private final String token;
    private final boolean unitless;

    ConstraintType(String token) {
        this(token, false);
    }

    ConstraintType(String token, boolean unitless) {
        this.token = token;
        this.unitless = unitless;
    }

    @Override
    public String token() {
        return token;
    }

    /**
     * True for counts such as {@code min_resolved_spokes}, whose limits carry no length unit.
     */
    public boolean isUnitless() {
        return unitless;
    }
}
