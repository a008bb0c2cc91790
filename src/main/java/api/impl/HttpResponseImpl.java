package api.impl;

import api.interfaces.http.HttpResponse;
import org.minihttp.http.HttpResponseWriter;

import java.util.LinkedHashMap;
import java.util.Map;

public class HttpResponseImpl implements HttpResponse {
    private int status = 200;
    private String contentType = "text/html";
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String body = "";

    @Override
    public void status(int code) {
        this.status = code;
    }

    @Override
    public void contentType(String type) {
        this.contentType = type == null ? "" : type;
    }

    @Override
    public void header(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public void body(String text) {
        this.body = text == null ? "" : text;
    }

    // getters used by writer
    public int status() { return status; }
    public String reason() { return HttpResponseWriter.reason(status); }
    public String contentType() { return contentType; }
    public Map<String, String> headers() { return headers; }
    public String body() { return body; }
}
