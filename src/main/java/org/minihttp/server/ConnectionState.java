package org.minihttp.server;

import api.impl.RequestHeader;

import java.util.Objects;

/** Where a connection stands in the 100-continue exchange. */
public interface ConnectionState {

    Idle IDLE = new Idle();

    /** Next chunk starts a new request. */
    record Idle() implements ConnectionState {}

    /** A 100 Continue was sent for {@code header}; the next chunk is its body. */
    record PendingContinuation(RequestHeader header) implements ConnectionState {
        public PendingContinuation {
            Objects.requireNonNull(header, "header");
        }
    }
}
