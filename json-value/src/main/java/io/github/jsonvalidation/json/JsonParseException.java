package io.github.jsonvalidation.json;

import java.util.Objects;

/// Signals that JSON text does not conform to RFC 8259.
///
/// Carries a machine-readable {@link Code} together with the zero-based character
/// offset and the one-based line and column of the offending character.
public final class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Reason a document was rejected
    public enum Code {
        EMPTY_DOCUMENT,
        UNEXPECTED_CHARACTER,
        UNEXPECTED_END,
        TRAILING_CONTENT,
        INVALID_ESCAPE,
        INVALID_NUMBER,
        CONTROL_CHARACTER,
        DUPLICATE_NAME,
        NESTING_TOO_DEEP
    }

    private final Code code;
    private final int offset;
    private final int line;
    private final int column;
    private final String reason;

    public JsonParseException(Code code, String reason, int offset, int line, int column) {
        super(String.format("%s at line %d, column %d", reason, line, column));
        this.code = Objects.requireNonNull(code, "code");
        this.reason = Objects.requireNonNull(reason, "reason");
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public Code code() {
        return code;
    }

    /// {@return the message without the position suffix}
    public String reason() {
        return reason;
    }

    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
