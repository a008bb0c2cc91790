package org.minihttp.interfaces;

import api.impl.HttpResponseImpl;
import org.minihttp.http.ParsedRequest;

/**
 * HttpCodec: wire-level reading and writing of HTTP messages.
 * No routing or connection state lives here.
 */
public interface HttpCodec {

    int CONTINUE = 100;
    int OK = 200;
    int BAD_REQUEST = 400;
    int NOT_FOUND = 404;
    int METHOD_NOT_ALLOWED = 405;
    int INTERNAL_SERVER_ERROR = 500;

    /** Split raw request bytes into header and body. */
    ParsedRequest parse(byte[] raw);

    /** Serialize a response to bytes ready for the socket. */
    byte[] render(HttpResponseImpl response);

    /** Map HTTP status codes to reason phrases. */
    String reason(int code);
}
