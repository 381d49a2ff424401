package nl.bytesoflife.deltatokn.project;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Parses KiCAD .kicad_pro project files (JSON format). Only the keys that point at the root
 * schematic are interpreted; everything else in the file is read and ignored.
 */
public class KicadProParser {

    public KicadProject parse(String content) {
        Map<String, Object> root = parseJson(content);
        return buildProject(root);
    }

    public KicadProject parse(InputStream is) throws IOException {
        String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        return parse(content);
    }

    private KicadProject buildProject(Map<String, Object> root) {
        String schematicFilename = stringAt(root, "schematic", "filename");
        String metaFilename = stringAt(root, "meta", "filename");
        return new KicadProject(schematicFilename, metaFilename);
    }

    /**
     * Follows a path of object keys and returns the string found there, or null.
     */
    @SuppressWarnings("unchecked")
    static String stringAt(Map<String, Object> root, String... keys) {
        Object current = root;
        for (String key : keys) {
            if (!(current instanceof Map)) return null;
            current = ((Map<String, Object>) current).get(key);
        }
        if (current instanceof String s && !s.isBlank()) {
            return s;
        }
        return null;
    }

    // --- Minimal JSON parser (no external dependencies) ---

    @SuppressWarnings("unchecked")
    private Map<String, Object> parseJson(String json) {
        JsonTokenizer tokenizer = new JsonTokenizer(json);
        Object result = parseValue(tokenizer);
        tokenizer.skipWhitespace();
        if (tokenizer.hasMore()) {
            throw new IllegalArgumentException("Unexpected content after JSON value at position " + tokenizer.pos);
        }
        if (result instanceof Map) {
            return (Map<String, Object>) result;
        }
        throw new IllegalArgumentException("Expected JSON object at root");
    }

    private Object parseValue(JsonTokenizer t) {
        t.skipWhitespace();
        char c = t.peek();
        return switch (c) {
            case '{' -> parseObject(t);
            case '[' -> parseArray(t);
            case '"' -> parseString(t);
            case 't', 'f' -> parseBoolean(t);
            case 'n' -> parseNull(t);
            default -> parseNumber(t);
        };
    }

    private Map<String, Object> parseObject(JsonTokenizer t) {
        t.expect('{');
        Map<String, Object> map = new LinkedHashMap<>();
        t.skipWhitespace();
        if (t.peek() == '}') {
            t.advance();
            return map;
        }
        while (true) {
            t.skipWhitespace();
            String key = parseString(t);
            t.skipWhitespace();
            t.expect(':');
            Object value = parseValue(t);
            map.put(key, value);
            t.skipWhitespace();
            if (t.peek() == ',') {
                t.advance();
            } else {
                break;
            }
        }
        t.skipWhitespace();
        t.expect('}');
        return map;
    }

    private List<Object> parseArray(JsonTokenizer t) {
        t.expect('[');
        List<Object> list = new ArrayList<>();
        t.skipWhitespace();
        if (t.peek() == ']') {
            t.advance();
            return list;
        }
        while (true) {
            list.add(parseValue(t));
            t.skipWhitespace();
            if (t.peek() == ',') {
                t.advance();
            } else {
                break;
            }
        }
        t.skipWhitespace();
        t.expect(']');
        return list;
    }

    private String parseString(JsonTokenizer t) {
        t.expect('"');
        StringBuilder sb = new StringBuilder();
        while (t.peek() != '"') {
            char c = t.advance();
            if (c == '\\') {
                char esc = t.advance();
                switch (esc) {
                    case '"', '\\', '/' -> sb.append(esc);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        String hex = "" + t.advance() + t.advance() + t.advance() + t.advance();
                        sb.append((char) Integer.parseInt(hex, 16));
                    }
                    default -> { sb.append('\\'); sb.append(esc); }
                }
            } else {
                sb.append(c);
            }
        }
        t.expect('"');
        return sb.toString();
    }

    private Number parseNumber(JsonTokenizer t) {
        StringBuilder sb = new StringBuilder();
        while (t.hasMore() && isNumberChar(t.peek())) {
            sb.append(t.advance());
        }
        String s = sb.toString();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Unexpected character '" + t.peek() + "' at position " + t.pos);
        }
        if (s.contains(".") || s.contains("e") || s.contains("E")) {
            return Double.parseDouble(s);
        }
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return Long.parseLong(s);
        }
    }

    private boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E';
    }

    private Boolean parseBoolean(JsonTokenizer t) {
        if (t.peek() == 't') {
            t.expectWord("true");
            return Boolean.TRUE;
        } else {
            t.expectWord("false");
            return Boolean.FALSE;
        }
    }

    private Object parseNull(JsonTokenizer t) {
        t.expectWord("null");
        return null;
    }

    private static class JsonTokenizer {
        private final String input;
        private int pos;

        JsonTokenizer(String input) {
            this.input = input;
            this.pos = 0;
        }

        void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        char peek() {
            if (pos >= input.length()) throw new IllegalArgumentException("Unexpected end of JSON");
            return input.charAt(pos);
        }

        char advance() {
            if (pos >= input.length()) throw new IllegalArgumentException("Unexpected end of JSON");
            return input.charAt(pos++);
        }

        boolean hasMore() {
            return pos < input.length();
        }

        void expect(char c) {
            skipWhitespace();
            if (pos >= input.length() || input.charAt(pos) != c) {
                throw new IllegalArgumentException("Expected '" + c + "' at position " + pos +
                        " but got " + (pos < input.length() ? "'" + input.charAt(pos) + "'" : "EOF"));
            }
            pos++;
        }

        void expectWord(String word) {
            for (int i = 0; i < word.length(); i++) {
                if (pos >= input.length() || input.charAt(pos) != word.charAt(i)) {
                    throw new IllegalArgumentException("Expected '" + word + "' at position " + (pos - i));
                }
                pos++;
            }
        }
    }
}
