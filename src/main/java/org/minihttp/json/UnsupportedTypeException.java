package org.minihttp.json;

/** Thrown when a value has no JSON representation. */
public class UnsupportedTypeException extends RuntimeException {

    public UnsupportedTypeException(String message) {
        super(message);
    }
}
