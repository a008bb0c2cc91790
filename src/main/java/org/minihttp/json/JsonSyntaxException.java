package org.minihttp.json;

/** Thrown by {@link JsonParser} for malformed input. */
public class JsonSyntaxException extends RuntimeException {

    private final int offset;

    public JsonSyntaxException(String message, int offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    public JsonSyntaxException(String message, int offset, Throwable cause) {
        super(message + " (at offset " + offset + ")", cause);
        this.offset = offset;
    }

    /** Cursor position in the input where parsing stopped. */
    public int offset() { return offset; }
}
