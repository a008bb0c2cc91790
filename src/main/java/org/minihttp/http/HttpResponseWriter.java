package org.minihttp.http;

import api.impl.HttpResponseImpl;
import org.minihttp.util.ByteData;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serializes a response: status line, Content-Type, Content-Length, the
 * additional headers in insertion order, a blank line and the body.
 * Lines end with a bare LF and the version is always HTTP/1.1.
 */
public final class HttpResponseWriter {

    private static final Map<Integer, String> REASONS = Map.ofEntries(
            Map.entry(100, "Continue"),
            Map.entry(101, "Switching Protocols"),
            Map.entry(200, "OK"),
            Map.entry(201, "Created"),
            Map.entry(202, "Accepted"),
            Map.entry(203, "Non-Authoritative Information"),
            Map.entry(204, "No Content"),
            Map.entry(205, "Reset Content"),
            Map.entry(206, "Partial Content"),
            Map.entry(300, "Multiple Choices"),
            Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"),
            Map.entry(303, "See Other"),
            Map.entry(304, "Not Modified"),
            Map.entry(305, "Use Proxy"),
            Map.entry(307, "Temporary Redirect"),
            Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"),
            Map.entry(402, "Payment Required"),
            Map.entry(403, "Forbidden"),
            Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"),
            Map.entry(406, "Not Acceptable"),
            Map.entry(407, "Proxy Authentication Required"),
            Map.entry(408, "Request Time-out"),
            Map.entry(409, "Conflict"),
            Map.entry(410, "Gone"),
            Map.entry(411, "Length Required"),
            Map.entry(412, "Precondition Failed"),
            Map.entry(413, "Request Entity Too Large"),
            Map.entry(414, "Request-URI Too Large"),
            Map.entry(415, "Unsupported Media Type"),
            Map.entry(416, "Requested range not satisfiable"),
            Map.entry(417, "Expectation Failed"),
            Map.entry(500, "Internal Server Error"),
            Map.entry(501, "Not Implemented"),
            Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"),
            Map.entry(504, "Gateway Time-out"),
            Map.entry(505, "HTTP Version not supported"));

    private HttpResponseWriter() {}

    /** Reason phrase for {@code status}, or "Custom" for codes outside the table. */
    public static String reason(int status) {
        return REASONS.getOrDefault(status, "Custom");
    }

    public static byte[] render(HttpResponseImpl res) {
        byte[] body = res.body().getBytes(StandardCharsets.UTF_8);

        StringBuilder head = new StringBuilder();
        head.append("HTTP/1.1 ").append(res.status()).append(' ').append(reason(res.status())).append('\n');
        head.append("Content-Type: ").append(res.contentType()).append('\n');
        head.append("Content-Length: ").append(body.length).append('\n');
        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        }
        head.append('\n');

        return ByteData.of(head.toString()).append(body).toByteArray();
    }

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        out.write(render(res));
        out.flush();
    }
}
