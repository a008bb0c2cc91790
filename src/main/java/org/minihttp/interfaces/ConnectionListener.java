package org.minihttp.interfaces;

/** Lifecycle notifications from the socket loop. */
public interface ConnectionListener {

    ConnectionListener NONE = new ConnectionListener() {};

    default void onConnect(long connectionId) {}

    default void onClose(long connectionId) {}
}
