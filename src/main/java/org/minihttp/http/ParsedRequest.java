package org.minihttp.http;

import api.impl.MinimalHttpRequest;
import api.impl.RequestHeader;

import java.nio.charset.StandardCharsets;

/** Result of one parse: the header and whatever bytes followed it. */
public record ParsedRequest(RequestHeader header, byte[] body) {

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public MinimalHttpRequest toRequest() {
        return new MinimalHttpRequest(header, body);
    }
}
