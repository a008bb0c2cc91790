package org.minihttp.interfaces;

/** Creates one {@link ByteStreamHandler} for each accepted connection. */
public interface ByteStreamHandlerFactory {
    ByteStreamHandler newConnection(long connectionId);
}
