package nl.bytesoflife.deltatokn.parser;

import java.util.ArrayList;
import java.util.List;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    enum AtomType {
        STRING,
        NUMBER,
        SYMBOL
    }

    record SAtom(String value, AtomType type) implements SNode {

        public boolean isNumber() {
            return type == AtomType.NUMBER;
        }

        public double asDouble() {
            return Double.parseDouble(value);
        }

        @Override
        public String toString() {
            if (type == AtomType.STRING) {
                return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
            }
            return value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        /**
         * Head atom of this list, or an empty string when the list is empty or starts with a list.
         */
        public String tag() {
            if (children.isEmpty()) return "";
            SNode first = children.get(0);
            if (first instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public SAtom atom(int index) {
            if (index >= children.size()) return null;
            SNode node = children.get(index);
            if (node instanceof SAtom atom) {
                return atom;
            }
            return null;
        }

        public String atomValue(int index) {
            SAtom atom = atom(index);
            return atom != null ? atom.value() : null;
        }

        /**
         * Numeric value at {@code index}, or {@code fallback} when missing or not a number.
         */
        public double doubleAt(int index, double fallback) {
            SAtom atom = atom(index);
            if (atom == null || !atom.isNumber()) return fallback;
            return atom.asDouble();
        }

        public int size() {
            return children.size();
        }

        /**
         * First immediate child list whose head atom equals {@code tag}.
         */
        public SList child(String tag) {
            for (SNode node : children) {
                if (node instanceof SList list && tag.equals(list.tag())) {
                    return list;
                }
            }
            return null;
        }

        /**
         * All immediate child lists whose head atom equals {@code tag}, in document order.
         */
        public List<SList> children(String tag) {
            List<SList> result = new ArrayList<>();
            for (SNode node : children) {
                if (node instanceof SList list && tag.equals(list.tag())) {
                    result.add(list);
                }
            }
            return result;
        }

        /**
         * First value element (index 1) of the first child tagged {@code tag}.
         */
        public SAtom value(String tag) {
            SList list = child(tag);
            return list != null ? list.atom(1) : null;
        }

        public String valueString(String tag) {
            SAtom atom = value(tag);
            return atom != null ? atom.value() : null;
        }

        public boolean has(String tag) {
            return child(tag) != null;
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
