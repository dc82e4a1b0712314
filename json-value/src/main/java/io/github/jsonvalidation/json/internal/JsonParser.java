package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonArray;
import io.github.jsonvalidation.json.JsonBoolean;
import io.github.jsonvalidation.json.JsonNull;
import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonParseException;
import io.github.jsonvalidation.json.JsonParseException.Code;
import io.github.jsonvalidation.json.JsonString;
import io.github.jsonvalidation.json.JsonValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Parses a JSON document into {@link JsonValue}s following RFC 8259.
///
/// A recursive descent parser over a `char[]`. Each parse method starts at
/// the first significant character of its production and leaves the offset
/// just past it. Line and column are only computed when an error is raised.
///
/// Nesting is bounded by the system property `json.parser.maxDepth`
/// (default 1000) so that hostile input cannot exhaust the thread stack.
public final class JsonParser {

    static final String MAX_DEPTH_PROPERTY = "json.parser.maxDepth";
    static final int DEFAULT_MAX_DEPTH = 1000;

    private final char[] doc;
    private final int maxDepth;
    private int offset;
    private int depth;

    public JsonParser(char[] doc) {
        this(doc, Integer.getInteger(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH));
    }

    JsonParser(char[] doc, int maxDepth) {
        this.doc = doc;
        this.maxDepth = maxDepth;
    }

    /// Parses the whole document; nothing but whitespace may follow the root value.
    public JsonValue parseRoot() {
        skipWhitespace();
        if (offset >= doc.length) {
            throw failure(Code.EMPTY_DOCUMENT, "Document is empty");
        }
        JsonValue root = parseValue();
        skipWhitespace();
        if (offset < doc.length) {
            throw failure(Code.TRAILING_CONTENT,
                    String.format("Unexpected content '%s' after the root value", doc[offset]));
        }
        return root;
    }

    private JsonValue parseValue() {
        skipWhitespace();
        if (offset >= doc.length) {
            throw failure(Code.UNEXPECTED_END, "Expected a value but reached the end of input");
        }
        char c = doc[offset];
        switch (c) {
            case '{':
                return parseObject();
            case '[':
                return parseArray();
            case '"':
                return JsonString.of(parseString());
            case 't':
                return parseLiteral("true", JsonBoolean.of(true));
            case 'f':
                return parseLiteral("false", JsonBoolean.of(false));
            case 'n':
                return parseLiteral("null", JsonNull.of());
            default:
                if (c == '-' || isDigit(c)) {
                    return parseNumber();
                }
                throw failure(Code.UNEXPECTED_CHARACTER, String.format("Unexpected character '%s'", c));
        }
    }

    private JsonObject parseObject() {
        enterContainer();
        offset++; // '{'
        Map<String, JsonValue> members = new LinkedHashMap<>();
        skipWhitespace();
        if (peek() == '}') {
            offset++;
            depth--;
            return Utils.objectOf(members);
        }
        while (true) {
            skipWhitespace();
            if (peek() != '"') {
                throw expected("a member name");
            }
            int nameOffset = offset;
            String name = parseString();
            if (members.containsKey(name)) {
                offset = nameOffset;
                throw failure(Code.DUPLICATE_NAME, String.format("Duplicate member name \"%s\"", name));
            }
            skipWhitespace();
            if (peek() != ':') {
                throw expected("':'");
            }
            offset++;
            members.put(name, parseValue());
            skipWhitespace();
            char c = peek();
            offset++;
            if (c == ',') {
                continue;
            }
            if (c == '}') {
                depth--;
                return Utils.objectOf(members);
            }
            offset--;
            throw expected("',' or '}'");
        }
    }

    private JsonArray parseArray() {
        enterContainer();
        offset++; // '['
        List<JsonValue> values = new ArrayList<>();
        skipWhitespace();
        if (peek() == ']') {
            offset++;
            depth--;
            return Utils.arrayOf(values);
        }
        while (true) {
            values.add(parseValue());
            skipWhitespace();
            char c = peek();
            offset++;
            if (c == ',') {
                continue;
            }
            if (c == ']') {
                depth--;
                return Utils.arrayOf(values);
            }
            offset--;
            throw expected("',' or ']'");
        }
    }

    private String parseString() {
        offset++; // opening quote
        StringBuilder sb = null;
        int start = offset;
        while (offset < doc.length) {
            char c = doc[offset];
            if (c == '"') {
                String s = sb == null
                        ? new String(doc, start, offset - start)
                        : sb.append(doc, start, offset - start).toString();
                offset++;
                return s;
            }
            if (c < 0x20) {
                throw failure(Code.CONTROL_CHARACTER,
                        String.format("Unescaped control character U+%04X in string", (int) c));
            }
            if (c == '\\') {
                if (sb == null) {
                    sb = new StringBuilder();
                }
                sb.append(doc, start, offset - start);
                sb.append(parseEscape());
                start = offset;
            } else {
                offset++;
            }
        }
        throw failure(Code.UNEXPECTED_END, "Unterminated string");
    }

    // offset is at the backslash; leaves it past the escape sequence
    private char parseEscape() {
        int escapeStart = offset;
        offset++;
        if (offset >= doc.length) {
            throw failure(Code.UNEXPECTED_END, "Unterminated string");
        }
        char c = doc[offset++];
        switch (c) {
            case '"':
                return '"';
            case '\\':
                return '\\';
            case '/':
                return '/';
            case 'b':
                return '\b';
            case 'f':
                return '\f';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case 'u':
                if (offset + 4 > doc.length) {
                    throw failure(Code.UNEXPECTED_END, "Truncated unicode escape");
                }
                int cp = 0;
                for (int i = 0; i < 4; i++) {
                    int digit = Character.digit(doc[offset], 16);
                    if (digit < 0) {
                        throw failure(Code.INVALID_ESCAPE,
                                String.format("Invalid hex digit '%s' in unicode escape", doc[offset]));
                    }
                    cp = (cp << 4) | digit;
                    offset++;
                }
                return (char) cp;
            default:
                offset = escapeStart;
                throw failure(Code.INVALID_ESCAPE, String.format("Invalid escape sequence '\\%s'", c));
        }
    }

    private JsonValue parseNumber() {
        int start = offset;
        if (doc[offset] == '-') {
            offset++;
        }
        if (offset >= doc.length) {
            throw failure(Code.INVALID_NUMBER, "Number has no digits");
        }
        if (doc[offset] == '0') {
            offset++;
            if (offset < doc.length && isDigit(doc[offset])) {
                throw failure(Code.INVALID_NUMBER, "Leading zeros are not allowed");
            }
        } else if (isDigit(doc[offset])) {
            skipDigits();
        } else {
            throw failure(Code.INVALID_NUMBER, "Number has no digits");
        }
        if (offset < doc.length && doc[offset] == '.') {
            offset++;
            if (offset >= doc.length || !isDigit(doc[offset])) {
                throw failure(Code.INVALID_NUMBER, "Fraction has no digits");
            }
            skipDigits();
        }
        if (offset < doc.length && (doc[offset] == 'e' || doc[offset] == 'E')) {
            offset++;
            if (offset < doc.length && (doc[offset] == '+' || doc[offset] == '-')) {
                offset++;
            }
            if (offset >= doc.length || !isDigit(doc[offset])) {
                throw failure(Code.INVALID_NUMBER, "Exponent has no digits");
            }
            skipDigits();
            String literal = new String(doc, start, offset - start);
            BigDecimal exact;
            try {
                exact = new BigDecimal(literal);
            } catch (NumberFormatException e) {
                // scale must fit in an int
                offset = start;
                throw failure(Code.INVALID_NUMBER, String.format("Exponent out of range in '%s'", literal));
            }
            return new JsonNumberImpl(literal, exact);
        }
        return new JsonNumberImpl(new String(doc, start, offset - start));
    }

    private JsonValue parseLiteral(String literal, JsonValue value) {
        int len = literal.length();
        for (int i = 0; i < len; i++) {
            if (offset + i >= doc.length) {
                offset += i;
                throw failure(Code.UNEXPECTED_END, String.format("Truncated literal, expected '%s'", literal));
            }
            if (doc[offset + i] != literal.charAt(i)) {
                offset += i;
                throw failure(Code.UNEXPECTED_CHARACTER,
                        String.format("Unexpected character '%s', expected '%s'", doc[offset], literal));
            }
        }
        offset += len;
        return value;
    }

    private void enterContainer() {
        if (++depth > maxDepth) {
            throw failure(Code.NESTING_TOO_DEEP,
                    String.format("Nesting depth exceeds the limit of %d", maxDepth));
        }
    }

    private void skipDigits() {
        while (offset < doc.length && isDigit(doc[offset])) {
            offset++;
        }
    }

    private void skipWhitespace() {
        while (offset < doc.length) {
            char c = doc[offset];
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                return;
            }
            offset++;
        }
    }

    // 0 is never a legal token start here, so it stands in for end of input
    private char peek() {
        return offset < doc.length ? doc[offset] : 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private JsonParseException expected(String what) {
        if (offset >= doc.length) {
            return failure(Code.UNEXPECTED_END, String.format("Expected %s but reached the end of input", what));
        }
        return failure(Code.UNEXPECTED_CHARACTER,
                String.format("Expected %s but found '%s'", what, doc[offset]));
    }

    private JsonParseException failure(Code code, String reason) {
        int line = 1;
        int lineStart = 0;
        int end = Math.min(offset, doc.length);
        for (int i = 0; i < end; i++) {
            if (doc[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new JsonParseException(code, reason, offset, line, end - lineStart + 1);
    }
}
