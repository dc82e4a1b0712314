package io.github.jsonvalidation.json;

/// Signals that an access method was called on a `JsonValue` of the wrong kind,
/// or that the requested member or element does not exist.
public class JsonAssertionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public JsonAssertionException(String message) {
        super(message);
    }
}
