package org.minihttp.interfaces;

/**
 * Per-connection consumer of received bytes. The returned bytes are written
 * back to the peer before the next read; an empty array writes nothing.
 */
public interface ByteStreamHandler {
    byte[] onData(byte[] chunk);
}
