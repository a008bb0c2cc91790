package org.minihttp.json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recursive-descent JSON reader.
 * <p>
 * One instance per document: the input string is never modified and the only
 * mutable state is the cursor. The reader is deliberately lenient and
 * deliberately incomplete:
 * <ul>
 *   <li>separating commas are skipped when present and not required, so
 *       {@code {"a":1 "b":2}} reads as two members;</li>
 *   <li>a backslash inside a string only protects the next character from
 *       ending the string, escape sequences are kept as written;</li>
 *   <li>numbers have no exponent form unless they already contain a '.'.</li>
 * </ul>
 */
public final class JsonParser {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    /** Deepest nesting of objects and arrays accepted in one document. */
    public static final int MAX_DEPTH = 512;

    private final String json;
    private int index;
    private int depth;

    private JsonParser(String json) {
        this.json = json;
    }

    /**
     * Reads a document whose top level is an object or an array.
     *
     * @throws JsonSyntaxException if the document is malformed
     */
    public static JsonValue parse(String json) {
        if (json == null) {
            throw new JsonSyntaxException("no input", 0);
        }
        return new JsonParser(json).readDocument();
    }

    private JsonValue readDocument() {
        skipWhitespace();
        if (index >= json.length()) {
            throw new JsonSyntaxException("empty document", index);
        }
        char c = json.charAt(index);
        if (c == '{') return readObject();
        if (c == '[') return readArray();
        throw new JsonSyntaxException("top level must be '{' or '[' but was '" + c + "'", index);
    }

    private JsonValue.Object readObject() {
        enter();
        index++;
        Map<String, JsonValue> members = new LinkedHashMap<>();
        while (true) {
            skipWhitespace();
            char c = current("object");
            if (c == '}') {
                index++;
                depth--;
                return new JsonValue.Object(members);
            }
            if (c == ',') {
                index++;
                continue;
            }
            String key = readKey();
            skipKeySeparator();
            members.put(key, readValue());
        }
    }

    private JsonValue.Array readArray() {
        enter();
        index++;
        List<JsonValue> elements = new ArrayList<>();
        while (true) {
            skipWhitespace();
            char c = current("array");
            if (c == ']') {
                index++;
                depth--;
                return new JsonValue.Array(elements);
            }
            if (c == ',') {
                index++;
                continue;
            }
            elements.add(readValue());
        }
    }

    private String readKey() {
        if (json.charAt(index) != '"') {
            throw new JsonSyntaxException("object key must be a quoted string", index);
        }
        return readString();
    }

    private JsonValue readValue() {
        skipWhitespace();
        char c = current("value");
        switch (c) {
            case '{':
                return readObject();
            case '[':
                return readArray();
            case '"':
                return new JsonValue.Text(readString());
            default:
                return readScalar();
        }
    }

    /** Cursor is on the opening quote; returns the raw text up to the closing quote. */
    private String readString() {
        int start = index + 1;
        int i = start;
        while (true) {
            if (i >= json.length()) {
                throw new JsonSyntaxException("unterminated string", start - 1);
            }
            char c = json.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') break;
            i++;
        }
        index = i + 1;
        return json.substring(start, i);
    }

    private JsonValue readScalar() {
        int start = index;
        while (index < json.length() && !isDelimiter(json.charAt(index))) {
            index++;
        }
        if (index >= json.length()) {
            throw new JsonSyntaxException("unterminated structure", start);
        }
        String token = json.substring(start, index);
        if (token.isEmpty()) {
            throw new JsonSyntaxException("expected a value but found '" + json.charAt(index) + "'", index);
        }

        switch (token) {
            case "true":
                return JsonValue.Bool.TRUE;
            case "false":
                return JsonValue.Bool.FALSE;
            case "null":
                return JsonValue.Null.INSTANCE;
            default:
                break;
        }

        if (token.indexOf('.') >= 0) {
            if (!DECIMAL.matcher(token).matches()) {
                throw new JsonSyntaxException("invalid number '" + token + "'", start);
            }
            return new JsonValue.Float(Double.parseDouble(token));
        }
        if (!INTEGER.matcher(token).matches()) {
            throw new JsonSyntaxException("unexpected token '" + token + "'", start);
        }
        try {
            return new JsonValue.Int(Long.parseLong(token));
        } catch (NumberFormatException e) {
            throw new JsonSyntaxException("integer out of range '" + token + "'", start, e);
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new JsonSyntaxException("nesting deeper than " + MAX_DEPTH, index);
        }
    }

    private char current(String inside) {
        if (index >= json.length()) {
            throw new JsonSyntaxException("unterminated " + inside, index);
        }
        return json.charAt(index);
    }

    private void skipWhitespace() {
        while (index < json.length() && isWhitespace(json.charAt(index))) {
            index++;
        }
    }

    // whitespace and any number of ':' between a key and its value
    private void skipKeySeparator() {
        while (index < json.length() && (isWhitespace(json.charAt(index)) || json.charAt(index) == ':')) {
            index++;
        }
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isDelimiter(char c) {
        return c == ',' || c == ']' || c == '}' || isWhitespace(c);
    }
}
