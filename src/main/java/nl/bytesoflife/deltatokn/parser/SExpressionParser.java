package nl.bytesoflife.deltatokn.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class SExpressionParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private String input;
    private int pos;

    public List<SNode> parse(String text) {
        this.input = text;
        this.pos = 0;
        List<SNode> nodes = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespace();
            if (pos >= input.length()) break;
            char c = input.charAt(pos);
            if (c == '(') {
                nodes.add(parseList());
            } else if (c == ')') {
                throw new ParseException("Unbalanced ')' at position " + pos, pos);
            } else {
                throw new ParseException("Expected '(' at position " + pos, pos);
            }
        }
        return nodes;
    }

    /**
     * Parses a document that consists of exactly one top-level list and returns it.
     */
    public SNode.SList parseDocument(String text) {
        List<SNode> nodes = parse(text);
        if (nodes.isEmpty()) {
            throw new ParseException("Empty document", 0);
        }
        if (nodes.size() > 1) {
            throw new ParseException("Trailing content after root expression", input.length());
        }
        return (SNode.SList) nodes.get(0);
    }

    private SNode.SList parseList() {
        int start = pos;
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespace();
            if (pos >= input.length()) {
                break;
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children);
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
        throw new ParseException("Unexpected end of input, expected ')' for list opened at position " + start, pos);
    }

    private SNode.SAtom parseQuotedString() {
        int start = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString(), SNode.AtomType.STRING);
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                char escaped = input.charAt(pos);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw new ParseException("Unterminated quoted string starting at position " + start, start);
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw new ParseException("Expected atom at position " + pos, pos);
        }
        String value = input.substring(start, pos);
        SNode.AtomType type = NUMBER.matcher(value).matches() ? SNode.AtomType.NUMBER : SNode.AtomType.SYMBOL;
        return new SNode.SAtom(value, type);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw new ParseException("Expected '" + expected + "' at position " + pos, pos);
        }
        pos++;
    }

    public static class ParseException extends RuntimeException {
        private final int position;

        public ParseException(String message, int position) {
            super(message);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
