package api.impl;

import api.interfaces.http.HttpRequest;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

public class MinimalHttpRequest implements HttpRequest {
    private final RequestHeader header;
    private final byte[] body;

    public MinimalHttpRequest(RequestHeader header, byte[] body) {
        this.header = Objects.requireNonNull(header, "header");
        this.body = body == null ? new byte[0] : body.clone();
    }

    @Override public RequestHeader requestHeader() { return header; }

    @Override public byte[] body() { return body.clone(); }

    @Override
    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return header + " (" + body.length + " body bytes)";
    }
}
