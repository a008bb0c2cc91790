package org.minihttp.server;

/** The listening socket could not be set up. */
public class ServerStartupException extends RuntimeException {

    public ServerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
