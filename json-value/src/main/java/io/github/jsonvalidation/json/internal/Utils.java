package io.github.jsonvalidation.json.internal;

import io.github.jsonvalidation.json.JsonArray;
import io.github.jsonvalidation.json.JsonAssertionException;
import io.github.jsonvalidation.json.JsonBoolean;
import io.github.jsonvalidation.json.JsonNull;
import io.github.jsonvalidation.json.JsonNumber;
import io.github.jsonvalidation.json.JsonObject;
import io.github.jsonvalidation.json.JsonString;
import io.github.jsonvalidation.json.JsonValue;

import java.util.List;
import java.util.Map;

/// Shared helpers for the JSON value implementations.
public final class Utils {

    // Bypasses the defensive copy in JsonObject.of; the caller hands over ownership
    public static JsonObject objectOf(Map<String, JsonValue> members) {
        return new JsonObjectImpl(members);
    }

    // Bypasses the defensive copy in JsonArray.of; the caller hands over ownership
    public static JsonArray arrayOf(List<JsonValue> values) {
        return new JsonArrayImpl(values);
    }

    public static JsonAssertionException composeTypeError(JsonValue jv, String expected) {
        return composeError(jv, String.format("%s is not a %s.", kindOf(jv), expected));
    }

    public static JsonAssertionException composeError(JsonValue jv, String message) {
        String text = jv.toString();
        if (text.length() > 64) {
            text = text.substring(0, 64) + "...";
        }
        return new JsonAssertionException(message + " Path: " + text);
    }

    /// {@return the simple interface name of the given value's kind}
    public static String kindOf(JsonValue jv) {
        if (jv instanceof JsonObject) return "JsonObject";
        if (jv instanceof JsonArray) return "JsonArray";
        if (jv instanceof JsonString) return "JsonString";
        if (jv instanceof JsonNumber) return "JsonNumber";
        if (jv instanceof JsonBoolean) return "JsonBoolean";
        if (jv instanceof JsonNull) return "JsonNull";
        return jv.getClass().getSimpleName();
    }

    /// Quotes and escapes `s` as a JSON string literal.
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (ch < 0x20) {
                        sb.append(String.format("\\u%04x", (int) ch));
                    } else {
                        sb.append(ch);
                    }
            }
        }
        return sb.append('"').toString();
    }

    private Utils() {}
}
