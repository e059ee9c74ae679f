package nl.bytesoflife.kicadsexpr.writer;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings for {@link SExpressionWriter}.
 */
public final class RenderStrategy {

    private static final RenderStrategy KICAD = builder().build();

    private final AtomFormatter atomFormatter;
    private final String indentUnit;
    private final Set<String> rootMarkers;
    private final AtomPlacement atomPlacement;
    private final boolean prettyPrint;

    private RenderStrategy(Builder builder) {
        this.atomFormatter = builder.atomFormatter;
        this.indentUnit = builder.indentUnit;
        this.rootMarkers = Set.copyOf(builder.rootMarkers);
        this.atomPlacement = builder.atomPlacement;
        this.prettyPrint = builder.prettyPrint;
    }

    /**
     * Tab indentation, order-preserving layout, trailing blank line after a symbol library.
     */
    public static RenderStrategy kicad() {
        return KICAD;
    }

    /**
     * Same as {@link #kicad()} but with the reference writer's atom hoisting.
     */
    public static RenderStrategy reference() {
        return builder().atomPlacement(AtomPlacement.HOIST_ATOMS).build();
    }

    /**
     * Whole tree on one line, single spaces between children, no trailing newline.
     */
    public static RenderStrategy compact() {
        return builder().prettyPrint(false).rootMarkers(Set.of()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .atomFormatter(atomFormatter)
                .indentUnit(indentUnit)
                .rootMarkers(rootMarkers)
                .atomPlacement(atomPlacement)
                .prettyPrint(prettyPrint);
    }

    public AtomFormatter getAtomFormatter() {
        return atomFormatter;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    /** Head symbols of root lists that are followed by an extra newline. */
    public Set<String> getRootMarkers() {
        return rootMarkers;
    }

    public AtomPlacement getAtomPlacement() {
        return atomPlacement;
    }

    /** When false, every list is written on one line and the indent unit is unused. */
    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    @Override
    public String toString() {
        return "RenderStrategy{placement=" + atomPlacement + ", rootMarkers=" + rootMarkers
                + ", prettyPrint=" + prettyPrint + "}";
    }

    public static final class Builder {

        private AtomFormatter atomFormatter = KicadAtomFormatter.INSTANCE;
        private String indentUnit = "\t";
        private Set<String> rootMarkers = Set.of("kicad_symbol_lib");
        private AtomPlacement atomPlacement = AtomPlacement.LEADING_ATOMS;
        private boolean prettyPrint = true;

        private Builder() {
        }

        public Builder atomFormatter(AtomFormatter atomFormatter) {
            this.atomFormatter = Objects.requireNonNull(atomFormatter, "atomFormatter");
            return this;
        }

        public Builder indentUnit(String indentUnit) {
            this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
            return this;
        }

        public Builder rootMarkers(Set<String> rootMarkers) {
            this.rootMarkers = Objects.requireNonNull(rootMarkers, "rootMarkers");
            return this;
        }

        public Builder atomPlacement(AtomPlacement atomPlacement) {
            this.atomPlacement = Objects.requireNonNull(atomPlacement, "atomPlacement");
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public RenderStrategy build() {
            return new RenderStrategy(this);
        }
    }
}
