package nl.bytesoflife.kicadsexpr.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of a parsed S-expression: either an atom or an ordered list of nodes.
 * <p>
 * Lists are immutable; code that needs to change a tree builds a new one.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    static SSymbol symbol(String name) {
        return new SSymbol(name);
    }

    static SString string(String value) {
        return new SString(value);
    }

    static SInteger integer(long value) {
        return new SInteger(value);
    }

    static SFloat decimal(double value) {
        return new SFloat(value);
    }

    static SList list(SNode... children) {
        return new SList(Arrays.asList(children));
    }

    /**
     * Builds a named list, e.g. {@code named("net", integer(1), string("GND"))}
     * for {@code (net 1 "GND")}.
     */
    static SList named(String head, SNode... rest) {
        SNode[] children = new SNode[rest.length + 1];
        children[0] = new SSymbol(head);
        System.arraycopy(rest, 0, children, 1, rest.length);
        return new SList(Arrays.asList(children));
    }

    sealed interface SAtom extends SNode permits SSymbol, SString, SInteger, SFloat {

        /** Textual form of the atom, without quoting. */
        String text();
    }

    record SSymbol(String name) implements SAtom {
        public SSymbol {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record SString(String value) implements SAtom {
        public SString {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
    }

    record SInteger(long value) implements SAtom {
        @Override
        public String text() {
            return Long.toString(value);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record SFloat(double value) implements SAtom {
        @Override
        public String text() {
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record SList(List<SNode> children) implements SNode {
        public SList {
            children = List.copyOf(children);
        }

        public int size() {
            return children.size();
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        /**
         * Name of this list when its first child is a symbol.
         */
        public Optional<String> head() {
            if (!children.isEmpty() && children.get(0) instanceof SSymbol symbol) {
                return Optional.of(symbol.name());
            }
            return Optional.empty();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
