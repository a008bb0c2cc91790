package org.minihttp.http;

/** Thrown when received bytes cannot be read as an HTTP request. */
public class IncompleteRequestDataException extends RuntimeException {

    public IncompleteRequestDataException(String message) {
        super(message);
    }

    public IncompleteRequestDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
