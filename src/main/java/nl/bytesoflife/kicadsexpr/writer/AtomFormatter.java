package nl.bytesoflife.kicadsexpr.writer;

import nl.bytesoflife.kicadsexpr.model.SNode;

/**
 * Renders each kind of atom to its textual form.
 */
public interface AtomFormatter {

    String formatSymbol(SNode.SSymbol symbol);

    String formatString(SNode.SString string);

    String formatInteger(SNode.SInteger integer);

    String formatFloat(SNode.SFloat decimal);

    default String format(SNode.SAtom atom) {
        if (atom instanceof SNode.SSymbol symbol) {
            return formatSymbol(symbol);
        } else if (atom instanceof SNode.SString string) {
            return formatString(string);
        } else if (atom instanceof SNode.SInteger integer) {
            return formatInteger(integer);
        }
        return formatFloat((SNode.SFloat) atom);
    }
}
