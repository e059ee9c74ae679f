package nl.bytesoflife.kicadsexpr.writer;

/**
 * Where the atoms of a list that also holds nested lists are written.
 */
public enum AtomPlacement {
    /**
     * Atoms before the first nested list stay on the opening line; later children
     * each get their own line. Child order is preserved.
     */
    LEADING_ATOMS,
    /**
     * All atoms move to the opening line, followed by the nested lists. This is the
     * layout of the reference writer; it reorders lists that mix atoms after lists.
     */
    HOIST_ATOMS
}
