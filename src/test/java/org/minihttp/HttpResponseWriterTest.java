package org.minihttp;

import api.impl.HttpResponseImpl;
import org.minihttp.http.DefaultHttpCodec;
import org.minihttp.http.HttpResponseWriter;
import org.minihttp.interfaces.HttpCodec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpResponseWriterTest {

    private static String render(HttpResponseImpl res) {
        return new String(HttpResponseWriter.render(res), StandardCharsets.UTF_8);
    }

    @Test
    void defaultsRenderAsOkHtml() {
        HttpResponseImpl res = new HttpResponseImpl();
        res.body("hello");

        assertEquals("HTTP/1.1 200 OK\nContent-Type: text/html\nContent-Length: 5\n\nhello", render(res));
    }

    @Test
    void additionalHeadersFollowInInsertionOrder() {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(201);
        res.contentType("application/json");
        res.header("X-B", "2");
        res.header("X-A", "1");
        res.body("{}");

        assertEquals("HTTP/1.1 201 Created\nContent-Type: application/json\nContent-Length: 2\n"
                + "X-B: 2\nX-A: 1\n\n{}", render(res));
    }

    @Test
    void continueResponseHasEmptyBody() {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(HttpCodec.CONTINUE);

        assertEquals("HTTP/1.1 100 Continue\nContent-Type: text/html\nContent-Length: 0\n\n", render(res));
    }

    @Test
    void reasonTable() {
        assertEquals("Not Found", HttpResponseWriter.reason(404));
        assertEquals("Custom", HttpResponseWriter.reason(999));
        assertEquals("Custom", HttpResponseWriter.reason(306));
        assertEquals("Custom", HttpResponseWriter.reason(418));
        assertEquals("Switching Protocols", HttpResponseWriter.reason(101));
        assertEquals("Partial Content", HttpResponseWriter.reason(206));
        assertEquals("Temporary Redirect", HttpResponseWriter.reason(307));
        assertEquals("Expectation Failed", HttpResponseWriter.reason(417));
        assertEquals("HTTP Version not supported", HttpResponseWriter.reason(505));
        assertEquals("Internal Server Error", new DefaultHttpCodec().reason(500));

        HttpResponseImpl res = new HttpResponseImpl();
        res.status(999);
        assertTrue(render(res).startsWith("HTTP/1.1 999 Custom\n"));
        assertEquals("Custom", res.reason());
    }

    @Test
    void contentLengthCountsEncodedBytes() {
        HttpResponseImpl res = new HttpResponseImpl();
        res.body("é");
        assertTrue(render(res).contains("Content-Length: 2\n"));
    }

    @Test
    void writeSendsRenderedBytes() throws IOException {
        HttpResponseImpl res = new HttpResponseImpl();
        res.status(404);
        res.body("nope");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        HttpResponseWriter.write(out, res);

        assertArrayEquals(new DefaultHttpCodec().render(res), out.toByteArray());
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("HTTP/1.1 404 Not Found\n"));
    }
}
